package fun.fengwk.mcc.core.service.crawl.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Main-content text and candidate links of one fetched page.
 *
 * @author fengwk
 */
@Data
@Builder
public class ExtractedPage {

    /**
     * One paragraph per line.
     */
    private String text;

    /**
     * Same-origin links in document order.
     */
    private List<PageLink> links;

}
