package fun.fengwk.mcc.core.service.crawl.identity;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Request identity and pacing configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcc.identity")
public class IdentityProperties {

    /**
     * User agent pool for random rotation.
     */
    private List<String> userAgents = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.3 Safari/605.1.15",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36 Edg/121.0.0.0",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
    );

    private String accept = "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8";

    private String acceptLanguage = "en-US,en;q=0.9";

    /**
     * Share of requests that claim to come from a Google search.
     */
    private double googleRefererRatio = 0.7;

    /**
     * Lower bound of the delay before each fetch attempt.
     */
    private long minPaceMs = 1000;

    /**
     * Upper bound of the delay before each fetch attempt.
     */
    private long maxPaceMs = 3000;

    /**
     * Upper bound of the per-origin delay multiplier grown by failures.
     */
    private double maxBackoffFactor = 5.0;

}
