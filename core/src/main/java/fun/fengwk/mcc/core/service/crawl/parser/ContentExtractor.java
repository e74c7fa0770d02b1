package fun.fengwk.mcc.core.service.crawl.parser;

import fun.fengwk.mcc.core.service.crawl.model.ExtractedPage;
import fun.fengwk.mcc.core.service.crawl.model.PageLink;
import fun.fengwk.mcc.core.service.crawl.support.CrawlUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Pulls the main readable text and same-origin links out of a page.
 *
 * @author fengwk
 */
@Component
public class ContentExtractor {

    static final int MIN_BLOCK_CHARS = 200;

    private static final String BOILERPLATE_TAGS = "script, style, noscript, nav, header, footer, aside, template, iframe, svg, form";

    private static final List<String> MAIN_CANDIDATE_SELECTORS = List.of(
        "article",
        "main",
        "[role=main]",
        "[class*=content]",
        "[class*=post]",
        "[class*=article]"
    );

    private static final List<String> SKIPPED_HREF_PREFIXES = List.of(
        "#",
        "javascript:",
        "mailto:",
        "tel:"
    );

    public ExtractedPage extract(String html, String url) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        document.select(BOILERPLATE_TAGS).remove();
        return ExtractedPage.builder()
            .text(extractText(document))
            .links(extractLinks(document, url))
            .build();
    }

    String extractText(Document document) {
        for (String selector : MAIN_CANDIDATE_SELECTORS) {
            String text = joinOutermost(document.select(selector));
            if (StringUtils.hasText(text)) {
                return text;
            }
        }

        Element body = document.body();
        if (body != null) {
            String text = renderText(body);
            if (StringUtils.hasText(text)) {
                return text;
            }
        }

        Element largest = findLargestTextBlock(document);
        if (largest != null) {
            return renderText(largest);
        }
        return renderText(document);
    }

    List<PageLink> extractLinks(Document document, String url) {
        String pageOrigin = CrawlUrlUtils.originOf(url);
        if (pageOrigin == null) {
            return List.of();
        }

        Map<String, PageLink> deduplicated = new LinkedHashMap<>();
        for (Element anchor : document.select("a[href]")) {
            String rawHref = anchor.attr("href").trim();
            if (rawHref.isEmpty() || isSkippedHref(rawHref)) {
                continue;
            }
            String sanitized = CrawlUrlUtils.sanitize(anchor.attr("abs:href"));
            if (sanitized == null || !pageOrigin.equals(CrawlUrlUtils.originOf(sanitized))) {
                continue;
            }
            deduplicated.putIfAbsent(sanitized, new PageLink(sanitized, rawHref, anchor.text().trim()));
        }
        return new ArrayList<>(deduplicated.values());
    }

    private String joinOutermost(Elements matches) {
        if (matches.isEmpty()) {
            return "";
        }
        Set<Element> matched = Collections.newSetFromMap(new IdentityHashMap<>());
        matched.addAll(matches);
        StringJoiner joiner = new StringJoiner("\n");
        for (Element element : matches) {
            if (hasMatchedAncestor(element, matched)) {
                continue;
            }
            String text = renderText(element);
            if (!text.isEmpty()) {
                joiner.add(text);
            }
        }
        return joiner.toString();
    }

    private boolean hasMatchedAncestor(Element element, Set<Element> matched) {
        for (Element parent = element.parent(); parent != null; parent = parent.parent()) {
            if (matched.contains(parent)) {
                return true;
            }
        }
        return false;
    }

    Element findLargestTextBlock(Document document) {
        Element body = document.body();
        if (body == null) {
            return null;
        }
        Element largest = null;
        int largestLength = MIN_BLOCK_CHARS;
        for (Element element : body.getAllElements()) {
            int length = element.ownText().length();
            if (length > largestLength) {
                largest = element;
                largestLength = length;
            }
        }
        return largest;
    }

    /**
     * Renders text with a line break at every block boundary, one paragraph per line.
     */
    static String renderText(Element root) {
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    sb.append(textNode.text());
                } else if (node instanceof Element element
                    && (element.isBlock() || element.normalName().equals("br"))) {
                    sb.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && element.isBlock()) {
                    sb.append('\n');
                }
            }
        }, root);

        StringJoiner joiner = new StringJoiner("\n");
        for (String line : sb.toString().split("\n")) {
            String normalized = line.replaceAll("\\s+", " ").trim();
            if (!normalized.isEmpty()) {
                joiner.add(normalized);
            }
        }
        return joiner.toString();
    }

    private boolean isSkippedHref(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        for (String prefix : SKIPPED_HREF_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

}
