package fun.fengwk.mcc.core.service.crawl.fetch;

import fun.fengwk.mcc.core.service.crawl.model.FetchStrategyType;

/**
 * One way of retrieving the markup of a page.
 *
 * @author fengwk
 */
public interface FetchStrategy {

    FetchStrategyType type();

    /**
     * @param url sanitized page url
     * @param topic crawl topic, used for request identity
     * @return page markup, or null when this strategy produced nothing usable
     * @throws Exception any failure, treated as a failed attempt by the chain
     */
    String attempt(String url, String topic) throws Exception;

}
