package fun.fengwk.mcc.core.service.crawl.relevance;

import fun.fengwk.mcc.core.service.crawl.model.PageLink;
import fun.fengwk.mcc.core.service.crawl.parser.ContentExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class TopicRelevanceFilterTest {

    private final TopicRelevanceFilter filter = new TopicRelevanceFilter();

    @Test
    public void shouldKeepOnlyParagraphsMentioningTopic() {
        String text = "Widgets are great.\nNothing to see here.\nBuy WIDGETS today.";

        assertThat(filter.filterText(text, "widgets")).isEqualTo("Widgets are great.\nBuy WIDGETS today.");
    }

    @Test
    public void shouldReturnWholeTextWhenNothingMatches() {
        String text = "Apples.\nOranges.";

        assertThat(filter.filterText(text, "widgets")).isEqualTo(text);
    }

    @Test
    public void shouldReturnEmptyForEmptyText() {
        assertThat(filter.filterText("", "widgets")).isEmpty();
        assertThat(filter.filterText(null, "widgets")).isEmpty();
    }

    @Test
    public void shouldKeepLinksWhoseAnchorOrHrefMentionsTopic() {
        List<PageLink> links = List.of(
            new PageLink("https://example.com/widgets/a", "/widgets/a", "Item A"),
            new PageLink("https://example.com/b", "b", "All about Widgets"),
            new PageLink("https://example.com/c", "/c", "Contact"),
            new PageLink("https://example.com/d", "/d", null)
        );

        assertThat(filter.filterLinks(links, "widgets")).containsExactly(links.get(0), links.get(1));
    }

    @Test
    public void shouldIgnoreTopicInResolvedHost() {
        List<PageLink> links = new ContentExtractor()
            .extract("<article>widgets <a href=\"/about\">About us</a></article>", "https://widgets.example.com/")
            .getLinks();

        assertThat(links).containsExactly(new PageLink("https://widgets.example.com/about", "/about", "About us"));
        assertThat(filter.filterLinks(links, "widgets")).isEmpty();
    }

    @Test
    public void shouldSplitParagraphsOnLines() {
        assertThat(TopicRelevanceFilter.splitParagraphs(" a \n\n b\n")).containsExactly("a", "b");
    }

}
