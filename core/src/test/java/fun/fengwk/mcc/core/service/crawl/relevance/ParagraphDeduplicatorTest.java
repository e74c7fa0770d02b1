package fun.fengwk.mcc.core.service.crawl.relevance;

import fun.fengwk.mcc.core.service.crawl.CrawlProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ParagraphDeduplicatorTest {

    private final ParagraphDeduplicator deduplicator = new ParagraphDeduplicator(new CrawlProperties());

    @Test
    public void shouldDropNearDuplicateParagraphs() {
        List<String> paragraphs = List.of(
            "widgets are small useful parts for many machines",
            "Widgets are small useful parts for many machines",
            "widgets are small useful parts for many machines today",
            "gadgets are something else entirely"
        );

        assertThat(deduplicator.deduplicate(paragraphs)).containsExactly(
            "widgets are small useful parts for many machines",
            "gadgets are something else entirely"
        );
    }

    @Test
    public void shouldKeepParagraphsBelowThreshold() {
        List<String> paragraphs = List.of("widgets are great", "widgets are cheap");

        assertThat(deduplicator.deduplicate(paragraphs)).containsExactlyElementsOf(paragraphs);
    }

    @Test
    public void shouldComputeJaccardSimilarity() {
        assertThat(ParagraphDeduplicator.jaccard(Set.of("a", "b"), Set.of("b", "c"))).isEqualTo(1.0 / 3);
        assertThat(ParagraphDeduplicator.jaccard(Set.of("a"), Set.of("a"))).isEqualTo(1.0);
    }

}
