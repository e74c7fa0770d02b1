package fun.fengwk.mcc.core.service.crawl.model;

import lombok.Builder;
import lombok.Data;

/**
 * Fetch log entry of one dequeued url.
 *
 * @author fengwk
 */
@Data
@Builder
public class PageVisit {

    private String url;
    private int depth;

    /**
     * Strategy that produced the markup, null when the url yielded nothing.
     */
    private FetchStrategyType strategy;

    private int budgetUnits;

}
