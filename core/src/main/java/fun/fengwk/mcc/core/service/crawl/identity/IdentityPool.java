package fun.fengwk.mcc.core.service.crawl.identity;

import fun.fengwk.mcc.core.service.crawl.support.CrawlUrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Browser-like request identity and human-like pacing.
 *
 * <p>Each origin keeps a delay multiplier: failures grow it by half up to
 * {@link IdentityProperties#getMaxBackoffFactor()}, successes shrink it back toward 1.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class IdentityPool {

    private static final double FAILURE_GROWTH = 1.5;
    private static final double SUCCESS_DECAY = 0.8;

    private final IdentityProperties properties;
    private final Random random;
    private final Sleeper sleeper;
    private final Map<String, Double> backoffFactors = new ConcurrentHashMap<>();

    @Autowired
    public IdentityPool(IdentityProperties properties) {
        this(properties, null, Sleeper.THREAD);
    }

    public IdentityPool(IdentityProperties properties, Random random, Sleeper sleeper) {
        this.properties = properties;
        this.random = random;
        this.sleeper = sleeper;
    }

    public Map<String, String> nextHeaders(String topic, String url) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", nextUserAgent());
        headers.put("Accept", properties.getAccept());
        headers.put("Accept-Language", properties.getAcceptLanguage());
        headers.put("Referer", nextReferer(topic, url));
        headers.put("DNT", "1");
        headers.put("Upgrade-Insecure-Requests", "1");
        return headers;
    }

    public String nextUserAgent() {
        List<String> userAgents = properties.getUserAgents();
        if (userAgents == null || userAgents.isEmpty()) {
            throw new IllegalStateException("user agent pool is empty");
        }
        return userAgents.get(random().nextInt(userAgents.size()));
    }

    /**
     * Blocks for a uniformly random interval scaled by the origin's backoff factor.
     */
    public void pace(String origin) throws InterruptedException {
        long min = Math.max(0, properties.getMinPaceMs());
        long max = Math.max(min, properties.getMaxPaceMs());
        double base = min + random().nextDouble() * (max - min);
        long delayMs = Math.round(base * backoffFactor(origin));
        if (delayMs <= 0) {
            return;
        }
        log.debug("pacing before fetch, origin={}, delayMs={}", origin, delayMs);
        sleeper.sleep(delayMs);
    }

    public void recordOutcome(String origin, boolean success) {
        double max = Math.max(1.0, properties.getMaxBackoffFactor());
        double factor = backoffFactors.compute(origin, (key, current) -> {
            double value = current == null ? 1.0 : current;
            return success
                ? Math.max(1.0, value * SUCCESS_DECAY)
                : Math.min(max, value * FAILURE_GROWTH);
        });
        log.debug("origin backoff adjusted, origin={}, success={}, factor={}", origin, success, factor);
    }

    public double backoffFactor(String origin) {
        return backoffFactors.getOrDefault(origin, 1.0);
    }

    private String nextReferer(String topic, String url) {
        String host = CrawlUrlUtils.hostOf(url);
        String query = URLEncoder.encode(((topic == null ? "" : topic) + " " + host).trim(), StandardCharsets.UTF_8);
        if (random().nextDouble() < properties.getGoogleRefererRatio()) {
            return "https://www.google.com/search?q=" + query;
        }
        return random().nextBoolean()
            ? "https://duckduckgo.com/?q=" + query + "&t=h_"
            : "https://www.bing.com/search?q=" + query;
    }

    private Random random() {
        return random != null ? random : ThreadLocalRandom.current();
    }

}
