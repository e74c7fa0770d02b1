package fun.fengwk.mcc.core.service.crawl.fetch;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetch strategy configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcc.fetch")
public class FetchProperties {

    /**
     * Direct request timeout in milliseconds.
     */
    private int directTimeoutMs = 15000;

    /**
     * Max attempts of one direct request, retries included.
     */
    private int directMaxAttempts = 3;

    /**
     * Base backoff before the first retry, doubled on every further retry.
     */
    private long directBackoffMs = 500;

    /**
     * Status codes that trigger a retry of the direct request.
     */
    private List<Integer> retryStatusCodes = new ArrayList<>(List.of(403, 429, 500, 502, 503, 504, 999));

    /**
     * Headless render navigate timeout in milliseconds.
     */
    private int renderTimeoutMs = 30000;

    /**
     * Whether to fall back to archived snapshots.
     */
    private boolean archiveEnabled = true;

    /**
     * Web archive base url.
     */
    private String archiveBaseUrl = "https://web.archive.org";

    /**
     * Archive lookup and snapshot timeout in milliseconds.
     */
    private int archiveTimeoutMs = 15000;

    /**
     * Host resolved to tell a dead resolver apart from one unknown host, empty disables the check.
     */
    private String networkProbeHost = "web.archive.org";

}
