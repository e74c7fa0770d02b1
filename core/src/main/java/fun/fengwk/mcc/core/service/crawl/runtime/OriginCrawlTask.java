package fun.fengwk.mcc.core.service.crawl.runtime;

import fun.fengwk.mcc.core.service.crawl.fetch.FetchStrategyChain;
import fun.fengwk.mcc.core.service.crawl.model.CrawlState;
import fun.fengwk.mcc.core.service.crawl.model.ExtractedPage;
import fun.fengwk.mcc.core.service.crawl.model.FetchResult;
import fun.fengwk.mcc.core.service.crawl.model.FrontierEntry;
import fun.fengwk.mcc.core.service.crawl.model.PageLink;
import fun.fengwk.mcc.core.service.crawl.model.PageVisit;
import fun.fengwk.mcc.core.service.crawl.parser.ContentExtractor;
import fun.fengwk.mcc.core.service.crawl.relevance.TopicRelevanceFilter;
import fun.fengwk.mcc.core.service.crawl.support.CrawlUrlUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Breadth-first crawl of a single origin.
 *
 * <p>The frontier is a FIFO queue processed by one thread, so pages are visited in depth
 * order. Visited urls and the page budget live in the shared {@link CrawlSession}.
 *
 * @author fengwk
 */
@Slf4j
public class OriginCrawlTask implements Callable<CrawlState> {

    @Getter
    private final String origin;

    private final List<String> seedUrls;
    private final CrawlSession session;
    private final FetchStrategyChain fetchStrategyChain;
    private final ContentExtractor contentExtractor;
    private final TopicRelevanceFilter topicRelevanceFilter;

    private final List<String> paragraphs = new ArrayList<>();
    private final List<PageVisit> visits = new ArrayList<>();
    private volatile CrawlState state = CrawlState.IDLE;

    public OriginCrawlTask(String origin, List<String> seedUrls, CrawlSession session,
                           FetchStrategyChain fetchStrategyChain, ContentExtractor contentExtractor,
                           TopicRelevanceFilter topicRelevanceFilter) {
        this.origin = origin;
        this.seedUrls = List.copyOf(seedUrls);
        this.session = session;
        this.fetchStrategyChain = fetchStrategyChain;
        this.contentExtractor = contentExtractor;
        this.topicRelevanceFilter = topicRelevanceFilter;
    }

    @Override
    public CrawlState call() {
        state = CrawlState.RUNNING;
        Deque<FrontierEntry> frontier = new ArrayDeque<>();
        for (String seedUrl : seedUrls) {
            frontier.addLast(new FrontierEntry(seedUrl, 0));
        }

        try {
            state = crawl(frontier);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("origin crawl interrupted, origin={}", origin);
            state = CrawlState.EXHAUSTED;
        }
        log.info("origin crawl finished, origin={}, state={}, pagesFetched={}",
            origin, state, session.pagesFetched(origin));
        return state;
    }

    private CrawlState crawl(Deque<FrontierEntry> frontier) throws InterruptedException {
        String topic = session.getTopic();
        int maxDepth = session.getMaxDepth();
        while (true) {
            if (session.isCancelled() || Thread.currentThread().isInterrupted()) {
                log.info("origin crawl cancelled, origin={}, remaining={}", origin, frontier.size());
                return CrawlState.EXHAUSTED;
            }

            FrontierEntry entry = frontier.pollFirst();
            if (entry == null) {
                return CrawlState.COMPLETED;
            }
            if (!session.markVisited(entry.url())) {
                continue;
            }
            if (entry.depth() > maxDepth) {
                continue;
            }

            FetchResult result = fetchStrategyChain.fetch(entry.url(), origin, topic, session);
            addVisit(PageVisit.builder()
                .url(entry.url())
                .depth(entry.depth())
                .strategy(result.getStrategyUsed())
                .budgetUnits(result.getBudgetUnits())
                .build());
            if (result.isBudgetDenied()) {
                log.info("budget exhausted, origin={}, url={}, remaining={}", origin, entry.url(), frontier.size());
                return CrawlState.EXHAUSTED;
            }
            if (!result.isSuccess()) {
                continue;
            }

            ExtractedPage page = contentExtractor.extract(result.getHtml(), entry.url());
            String text = topicRelevanceFilter.filterText(page.getText(), topic);
            addParagraphs(TopicRelevanceFilter.splitParagraphs(text));

            if (entry.depth() < maxDepth) {
                enqueueLinks(frontier, topicRelevanceFilter.filterLinks(page.getLinks(), topic), entry.depth() + 1);
            }
        }
    }

    private void enqueueLinks(Deque<FrontierEntry> frontier, List<PageLink> links, int depth) {
        for (PageLink link : links) {
            if (!origin.equals(CrawlUrlUtils.originOf(link.url()))) {
                continue;
            }
            if (!session.hasCapacity(origin) || session.isVisited(link.url())) {
                continue;
            }
            frontier.addLast(new FrontierEntry(link.url(), depth));
        }
    }

    public CrawlState getState() {
        return state;
    }

    public List<String> snapshotParagraphs() {
        synchronized (paragraphs) {
            return new ArrayList<>(paragraphs);
        }
    }

    public List<PageVisit> snapshotVisits() {
        synchronized (visits) {
            return new ArrayList<>(visits);
        }
    }

    private void addParagraphs(List<String> newParagraphs) {
        synchronized (paragraphs) {
            paragraphs.addAll(newParagraphs);
        }
    }

    private void addVisit(PageVisit visit) {
        synchronized (visits) {
            visits.add(visit);
        }
    }

}
