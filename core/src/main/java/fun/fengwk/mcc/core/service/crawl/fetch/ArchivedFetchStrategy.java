package fun.fengwk.mcc.core.service.crawl.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mcc.core.service.crawl.identity.IdentityPool;
import fun.fengwk.mcc.core.service.crawl.model.FetchStrategyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Falls back to the latest web archive snapshot of the page.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArchivedFetchStrategy implements FetchStrategy {

    private final HttpClient httpClient;
    private final FetchProperties fetchProperties;
    private final IdentityPool identityPool;
    private final ObjectMapper objectMapper;

    @Override
    public FetchStrategyType type() {
        return FetchStrategyType.ARCHIVED;
    }

    @Override
    public String attempt(String url, String topic) throws Exception {
        String timestamp = lookupLatestSnapshot(url);
        if (!StringUtils.hasText(timestamp)) {
            log.debug("no archived snapshot, url={}", url);
            return null;
        }

        String snapshotUrl = baseUrl() + "/web/" + timestamp + "/" + url;
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(snapshotUrl))
            .GET()
            .timeout(Duration.ofMillis(fetchProperties.getArchiveTimeoutMs()));
        for (Map.Entry<String, String> header : identityPool.nextHeaders(topic, url).entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200 || !StringUtils.hasText(response.body())) {
            log.debug("archived snapshot unavailable, snapshotUrl={}, statusCode={}", snapshotUrl, response.statusCode());
            return null;
        }
        log.info("using archived snapshot, url={}, timestamp={}", url, timestamp);
        return response.body();
    }

    String lookupLatestSnapshot(String url) throws Exception {
        String lookupUrl = baseUrl() + "/__wb/sparkline?url="
            + URLEncoder.encode(url, StandardCharsets.UTF_8)
            + "&collection=web&output=json";
        HttpRequest request = HttpRequest.newBuilder(URI.create(lookupUrl))
            .GET()
            .header("Accept", "application/json")
            .header("User-Agent", identityPool.nextUserAgent())
            .timeout(Duration.ofMillis(fetchProperties.getArchiveTimeoutMs()))
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200 || !StringUtils.hasText(response.body())) {
            return null;
        }
        JsonNode lastTs = objectMapper.readTree(response.body()).get("last_ts");
        if (lastTs == null || lastTs.isNull()) {
            return null;
        }
        return lastTs.asText();
    }

    private String baseUrl() {
        String base = fetchProperties.getArchiveBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

}
