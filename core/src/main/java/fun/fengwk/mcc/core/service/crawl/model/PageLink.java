package fun.fengwk.mcc.core.service.crawl.model;

/**
 * Same-origin outgoing link.
 *
 * @param url sanitized absolute url, used for the frontier
 * @param rawHref href attribute as written in the page
 * @param anchorText visible anchor text
 * @author fengwk
 */
public record PageLink(String url, String rawHref, String anchorText) {
}
