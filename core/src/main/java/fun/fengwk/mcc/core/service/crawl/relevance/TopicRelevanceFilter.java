package fun.fengwk.mcc.core.service.crawl.relevance;

import fun.fengwk.mcc.core.service.crawl.model.PageLink;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Case-insensitive substring match of the topic against paragraphs and links.
 *
 * @author fengwk
 */
@Component
public class TopicRelevanceFilter {

    /**
     * Keeps the paragraphs mentioning the topic. When none does, the whole text is kept so a
     * fetched page never contributes nothing.
     */
    public String filterText(String text, String topic) {
        if (!StringUtils.hasText(text) || !StringUtils.hasText(topic)) {
            return text == null ? "" : text;
        }
        String needle = topic.toLowerCase(Locale.ROOT);
        StringJoiner joiner = new StringJoiner("\n");
        int matched = 0;
        for (String paragraph : splitParagraphs(text)) {
            if (paragraph.toLowerCase(Locale.ROOT).contains(needle)) {
                joiner.add(paragraph);
                matched++;
            }
        }
        return matched == 0 ? text : joiner.toString();
    }

    /**
     * Keeps the links whose anchor text or raw href mentions the topic.
     */
    public List<PageLink> filterLinks(List<PageLink> links, String topic) {
        if (links == null || links.isEmpty() || !StringUtils.hasText(topic)) {
            return List.of();
        }
        String needle = topic.toLowerCase(Locale.ROOT);
        List<PageLink> relevant = new ArrayList<>();
        for (PageLink link : links) {
            // The raw href, not the resolved url, so a topic in the host name matches nothing.
            if (contains(link.anchorText(), needle) || contains(link.rawHref(), needle)) {
                relevant.add(link);
            }
        }
        return relevant;
    }

    public static List<String> splitParagraphs(String text) {
        List<String> paragraphs = new ArrayList<>();
        if (text == null) {
            return paragraphs;
        }
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                paragraphs.add(trimmed);
            }
        }
        return paragraphs;
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

}
