package fun.fengwk.mcc.core.service.crawl.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Crawl response model.
 *
 * @author fengwk
 */
@Data
@Builder
public class CrawlResponse {

    private String topic;

    /**
     * Per-origin text blocks joined by a blank line, empty when nothing was gathered.
     */
    private String corpus;

    private int wordCount;
    private CrawlState state;
    private int pagesCrawled;
    private List<OriginCorpus> origins;
    private Long elapsedMs;

}
