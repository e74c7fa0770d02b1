package fun.fengwk.mcc.core.service.crawl.fetch;

import fun.fengwk.mcc.core.service.crawl.identity.IdentityPool;
import fun.fengwk.mcc.core.service.crawl.identity.Sleeper;
import fun.fengwk.mcc.core.service.crawl.model.FetchStrategyType;
import fun.fengwk.mcc.core.service.crawl.support.CrawlUrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Plain HTTP GET with browser-like headers and bounded retry.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class DirectFetchStrategy implements FetchStrategy {

    private final HttpClient httpClient;
    private final FetchProperties fetchProperties;
    private final IdentityPool identityPool;
    private final NetworkProbe networkProbe;
    private final Sleeper sleeper;

    @Autowired
    public DirectFetchStrategy(HttpClient httpClient, FetchProperties fetchProperties,
                               IdentityPool identityPool, NetworkProbe networkProbe) {
        this(httpClient, fetchProperties, identityPool, networkProbe, Sleeper.THREAD);
    }

    public DirectFetchStrategy(HttpClient httpClient, FetchProperties fetchProperties,
                               IdentityPool identityPool, NetworkProbe networkProbe, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.fetchProperties = fetchProperties;
        this.identityPool = identityPool;
        this.networkProbe = networkProbe;
        this.sleeper = sleeper;
    }

    @Override
    public FetchStrategyType type() {
        return FetchStrategyType.DIRECT;
    }

    @Override
    public String attempt(String url, String topic) throws Exception {
        int maxAttempts = Math.max(1, fetchProperties.getDirectMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            HttpRequest request = buildRequest(url, identityPool.nextHeaders(topic, url));
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int statusCode = response.statusCode();
                if (statusCode == 200 && StringUtils.hasText(response.body())) {
                    return response.body();
                }
                if (!isRetryable(statusCode)) {
                    log.debug("direct fetch rejected, url={}, statusCode={}", url, statusCode);
                    return null;
                }
                log.debug("direct fetch retryable status, url={}, statusCode={}, attempt={}", url, statusCode, attempt);
            } catch (IOException ex) {
                // Throws when the resolver itself is down.
                networkProbe.checkAfterFailure(CrawlUrlUtils.hostOf(url), ex);
                log.debug("direct fetch io error, url={}, attempt={}, error={}", url, attempt, ex.getMessage());
            }

            if (attempt < maxAttempts) {
                sleeper.sleep(backoffMs(attempt));
            }
        }
        return null;
    }

    long backoffMs(int attempt) {
        long base = Math.max(0, fetchProperties.getDirectBackoffMs());
        return base * (1L << (attempt - 1));
    }

    private boolean isRetryable(int statusCode) {
        return fetchProperties.getRetryStatusCodes() != null
            && fetchProperties.getRetryStatusCodes().contains(statusCode);
    }

    private HttpRequest buildRequest(String url, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
            .GET()
            .timeout(Duration.ofMillis(fetchProperties.getDirectTimeoutMs()));
        for (Map.Entry<String, String> header : headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

}
