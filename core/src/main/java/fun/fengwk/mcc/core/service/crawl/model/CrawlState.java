package fun.fengwk.mcc.core.service.crawl.model;

/**
 * Frontier controller lifecycle.
 *
 * <p>{@link #COMPLETED} and {@link #EXHAUSTED} are both successful terminal states,
 * the latter meaning the crawl stopped early on a page budget.
 *
 * @author fengwk
 */
public enum CrawlState {

    IDLE,
    RUNNING,
    COMPLETED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == EXHAUSTED;
    }

}
