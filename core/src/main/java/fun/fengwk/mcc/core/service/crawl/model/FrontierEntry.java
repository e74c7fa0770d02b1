package fun.fengwk.mcc.core.service.crawl.model;

/**
 * Queued url with its link distance from the seed.
 *
 * @author fengwk
 */
public record FrontierEntry(String url, int depth) {
}
