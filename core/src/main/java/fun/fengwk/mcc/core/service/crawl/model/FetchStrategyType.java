package fun.fengwk.mcc.core.service.crawl.model;

/**
 * Fetch strategies in fallback order.
 *
 * @author fengwk
 */
public enum FetchStrategyType {

    DIRECT("direct"),
    RENDERED("rendered"),
    ARCHIVED("archived");

    private final String value;

    FetchStrategyType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

}
