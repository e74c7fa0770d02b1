package fun.fengwk.mcc.core.service.crawl;

import fun.fengwk.mcc.core.service.crawl.model.CrawlRequest;
import fun.fengwk.mcc.core.service.crawl.model.CrawlResponse;

/**
 * Topic-guided crawl entry.
 *
 * @author fengwk
 */
public interface ContentCrawlService {

    /**
     * Crawls the seed urls and gathers the text relevant to the topic.
     *
     * @throws IllegalArgumentException when the request is invalid
     * @throws fun.fengwk.mcc.core.service.crawl.fetch.NetworkUnavailableException when no host can be resolved
     */
    CrawlResponse crawl(CrawlRequest request);

}
