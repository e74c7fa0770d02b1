package fun.fengwk.mcc.core.service.crawl.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Text gathered from one origin.
 *
 * @author fengwk
 */
@Data
@Builder
public class OriginCorpus {

    private String origin;
    private String text;
    private int wordCount;
    private int pagesFetched;
    private CrawlState state;
    private List<PageVisit> visits;

}
