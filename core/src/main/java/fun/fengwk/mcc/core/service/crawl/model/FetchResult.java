package fun.fengwk.mcc.core.service.crawl.model;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of running the fetch strategy chain for one url.
 *
 * @author fengwk
 */
@Data
@Builder
public class FetchResult {

    /**
     * Raw markup, null when every strategy failed or the budget ran out.
     */
    private String html;

    private FetchStrategyType strategyUsed;

    private String origin;

    /**
     * True when a budget reservation was refused and the chain was aborted.
     */
    private boolean budgetDenied;

    /**
     * Budget units consumed by this url.
     */
    private int budgetUnits;

    public boolean isSuccess() {
        return html != null;
    }

}
