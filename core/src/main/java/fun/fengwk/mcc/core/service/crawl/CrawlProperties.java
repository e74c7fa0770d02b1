package fun.fengwk.mcc.core.service.crawl;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Crawl limits and scheduling configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcc.crawl")
public class CrawlProperties {

    /**
     * Max link distance from a seed url.
     */
    private int maxDepth = 2;

    /**
     * Max fetch attempts for the whole crawl, fallback steps included.
     */
    private int maxPages = 20;

    /**
     * Max fetch attempts per origin.
     */
    private int perOriginCap = 5;

    /**
     * Number of origins crawled concurrently.
     */
    private int concurrency = 5;

    /**
     * Seed urls beyond this count are ignored.
     */
    private int maxSeeds = 12;

    /**
     * Each origin block is truncated to this many words, 0 means no limit.
     */
    private int maxWordsPerOrigin = 5000;

    /**
     * Paragraphs more similar than this to an earlier one are dropped.
     */
    private double duplicateThreshold = 0.8;

    /**
     * Overall crawl deadline in milliseconds, 0 means no deadline.
     */
    private long deadlineMs = 0;

}
