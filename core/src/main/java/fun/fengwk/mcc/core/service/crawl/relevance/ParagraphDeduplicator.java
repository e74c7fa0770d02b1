package fun.fengwk.mcc.core.service.crawl.relevance;

import fun.fengwk.mcc.core.service.crawl.CrawlProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Drops paragraphs that repeat an earlier one almost word for word.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ParagraphDeduplicator {

    private final CrawlProperties crawlProperties;

    public List<String> deduplicate(List<String> paragraphs) {
        List<String> kept = new ArrayList<>();
        List<Set<String>> keptWords = new ArrayList<>();
        if (paragraphs == null) {
            return kept;
        }
        for (String paragraph : paragraphs) {
            Set<String> words = words(paragraph);
            if (words.isEmpty() || isNearDuplicate(words, keptWords)) {
                continue;
            }
            kept.add(paragraph);
            keptWords.add(words);
        }
        return kept;
    }

    static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private boolean isNearDuplicate(Set<String> words, List<Set<String>> keptWords) {
        for (Set<String> existing : keptWords) {
            if (jaccard(words, existing) > crawlProperties.getDuplicateThreshold()) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> words(String paragraph) {
        Set<String> words = new HashSet<>();
        for (String token : paragraph.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!token.isEmpty()) {
                words.add(token);
            }
        }
        return words;
    }

}
