package fun.fengwk.mcc.cli.crawl;

import fun.fengwk.mcc.core.service.crawl.ContentCrawlService;
import fun.fengwk.mcc.core.service.crawl.CrawlProperties;
import fun.fengwk.mcc.core.service.crawl.fetch.FetchProperties;
import fun.fengwk.mcc.core.service.crawl.fetch.FetchStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
@SpringBootTest(properties = {
    "mcc.crawl.max-pages=7",
    "mcc.fetch.archive-enabled=false"
})
public class CliCrawlApplicationTest {

    @Autowired
    private ContentCrawlService contentCrawlService;

    @Autowired
    private CrawlProperties crawlProperties;

    @Autowired
    private FetchProperties fetchProperties;

    @Autowired
    private List<FetchStrategy> fetchStrategies;

    @Test
    public void shouldWireCrawlerWithConfiguredDefaults() {
        assertThat(contentCrawlService).isNotNull();
        assertThat(fetchStrategies).hasSize(3);
        assertThat(crawlProperties.getMaxPages()).isEqualTo(7);
        assertThat(crawlProperties.getPerOriginCap()).isEqualTo(5);
        assertThat(fetchProperties.isArchiveEnabled()).isFalse();
        assertThat(fetchProperties.getRetryStatusCodes()).contains(403, 429, 999);
    }

}
