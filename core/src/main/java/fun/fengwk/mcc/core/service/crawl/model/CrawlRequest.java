package fun.fengwk.mcc.core.service.crawl.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Crawl request model, null limits fall back to configured defaults.
 *
 * @author fengwk
 */
@Data
@Builder
public class CrawlRequest {

    private String topic;
    private List<String> seedUrls;
    private Integer maxDepth;
    private Integer maxPages;
    private Integer perOriginCap;

}
