package fun.fengwk.mcc.core.service.crawl.impl;

import fun.fengwk.mcc.core.service.crawl.ContentCrawlService;
import fun.fengwk.mcc.core.service.crawl.CrawlProperties;
import fun.fengwk.mcc.core.service.crawl.fetch.FetchStrategyChain;
import fun.fengwk.mcc.core.service.crawl.model.CrawlRequest;
import fun.fengwk.mcc.core.service.crawl.model.CrawlResponse;
import fun.fengwk.mcc.core.service.crawl.model.CrawlState;
import fun.fengwk.mcc.core.service.crawl.model.OriginCorpus;
import fun.fengwk.mcc.core.service.crawl.parser.ContentExtractor;
import fun.fengwk.mcc.core.service.crawl.relevance.ParagraphDeduplicator;
import fun.fengwk.mcc.core.service.crawl.relevance.TopicRelevanceFilter;
import fun.fengwk.mcc.core.service.crawl.runtime.CrawlSession;
import fun.fengwk.mcc.core.service.crawl.runtime.OriginCrawlTask;
import fun.fengwk.mcc.core.service.crawl.support.CrawlUrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Content crawl service implementation.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentCrawlServiceImpl implements ContentCrawlService {

    private static final long TERMINATION_WAIT_MS = 2000;

    private final CrawlProperties crawlProperties;
    private final FetchStrategyChain fetchStrategyChain;
    private final ContentExtractor contentExtractor;
    private final TopicRelevanceFilter topicRelevanceFilter;
    private final ParagraphDeduplicator paragraphDeduplicator;

    @Override
    public CrawlResponse crawl(CrawlRequest request) {
        long startAt = System.currentTimeMillis();
        validateRequest(request);
        String topic = request.getTopic().trim();
        int maxDepth = resolve(request.getMaxDepth(), crawlProperties.getMaxDepth());
        int maxPages = resolve(request.getMaxPages(), crawlProperties.getMaxPages());
        int perOriginCap = resolve(request.getPerOriginCap(), crawlProperties.getPerOriginCap());
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        if (maxPages <= 0 || perOriginCap <= 0) {
            throw new IllegalArgumentException("maxPages and perOriginCap must be positive");
        }

        CrawlSession session = new CrawlSession(topic, maxDepth, maxPages, perOriginCap);
        List<OriginCrawlTask> tasks = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : groupSeedsByOrigin(request.getSeedUrls()).entrySet()) {
            tasks.add(new OriginCrawlTask(entry.getKey(), entry.getValue(), session,
                fetchStrategyChain, contentExtractor, topicRelevanceFilter));
        }
        log.info("crawl started, topic={}, origins={}, maxDepth={}, maxPages={}, perOriginCap={}",
            topic, tasks.size(), maxDepth, maxPages, perOriginCap);

        if (!tasks.isEmpty()) {
            runTasks(tasks, session);
        }

        CrawlResponse response = buildResponse(topic, tasks, session);
        response.setElapsedMs(System.currentTimeMillis() - startAt);
        log.info("crawl finished, topic={}, state={}, pagesCrawled={}, wordCount={}, elapsedMs={}",
            topic, response.getState(), response.getPagesCrawled(), response.getWordCount(), response.getElapsedMs());
        return response;
    }

    private void runTasks(List<OriginCrawlTask> tasks, CrawlSession session) {
        int poolSize = Math.max(1, Math.min(crawlProperties.getConcurrency(), tasks.size()));
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("mcc-crawl-worker-");
        threadFactory.setDaemon(true);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, threadFactory);
        List<Future<CrawlState>> futures = new ArrayList<>();
        try {
            for (OriginCrawlTask task : tasks) {
                futures.add(executor.submit(task));
            }
            awaitAll(futures, session);
        } finally {
            executor.shutdownNow();
            awaitTermination(executor);
        }
    }

    private void awaitAll(List<Future<CrawlState>> futures, CrawlSession session) {
        long deadlineMs = crawlProperties.getDeadlineMs();
        long deadlineAt = deadlineMs > 0 ? System.currentTimeMillis() + deadlineMs : Long.MAX_VALUE;
        for (Future<CrawlState> future : futures) {
            try {
                if (deadlineMs > 0) {
                    long remaining = Math.max(0, deadlineAt - System.currentTimeMillis());
                    future.get(remaining, TimeUnit.MILLISECONDS);
                } else {
                    future.get();
                }
            } catch (TimeoutException ex) {
                log.warn("crawl deadline reached, deadlineMs={}", deadlineMs);
                cancelAll(futures, session);
                return;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("crawl interrupted, cancelling origin tasks");
                cancelAll(futures, session);
                return;
            } catch (ExecutionException ex) {
                cancelAll(futures, session);
                Throwable cause = ex.getCause();
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw new IllegalStateException("origin crawl failed", cause);
            }
        }
    }

    private void cancelAll(List<Future<CrawlState>> futures, CrawlSession session) {
        session.cancel();
        for (Future<CrawlState> future : futures) {
            future.cancel(true);
        }
    }

    private void awaitTermination(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(TERMINATION_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("origin tasks still running after shutdown");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private CrawlResponse buildResponse(String topic, List<OriginCrawlTask> tasks, CrawlSession session) {
        List<OriginCorpus> origins = new ArrayList<>();
        StringJoiner corpus = new StringJoiner("\n\n");
        boolean exhausted = false;
        for (OriginCrawlTask task : tasks) {
            CrawlState state = task.getState().isTerminal() ? task.getState() : CrawlState.EXHAUSTED;
            exhausted |= state == CrawlState.EXHAUSTED;

            List<String> paragraphs = paragraphDeduplicator.deduplicate(task.snapshotParagraphs());
            String text = truncateWords(String.join("\n", paragraphs), crawlProperties.getMaxWordsPerOrigin());
            if (!text.isEmpty()) {
                corpus.add(text);
            }
            origins.add(OriginCorpus.builder()
                .origin(task.getOrigin())
                .text(text)
                .wordCount(countWords(text))
                .pagesFetched(session.pagesFetched(task.getOrigin()))
                .state(state)
                .visits(task.snapshotVisits())
                .build());
        }

        String corpusText = corpus.toString();
        return CrawlResponse.builder()
            .topic(topic)
            .corpus(corpusText)
            .wordCount(countWords(corpusText))
            .state(exhausted ? CrawlState.EXHAUSTED : CrawlState.COMPLETED)
            .pagesCrawled(session.pagesCrawled())
            .origins(origins)
            .build();
    }

    private Map<String, List<String>> groupSeedsByOrigin(List<String> seedUrls) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        int accepted = 0;
        for (String seedUrl : seedUrls) {
            String sanitized = CrawlUrlUtils.sanitize(seedUrl);
            if (sanitized == null) {
                log.warn("malformed seed url dropped, url={}", seedUrl);
                continue;
            }
            if (accepted >= crawlProperties.getMaxSeeds()) {
                log.info("seed limit reached, url={}, maxSeeds={}", sanitized, crawlProperties.getMaxSeeds());
                continue;
            }
            accepted++;
            grouped.computeIfAbsent(CrawlUrlUtils.originOf(sanitized), key -> new ArrayList<>()).add(sanitized);
        }
        return grouped;
    }

    private void validateRequest(CrawlRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        if (!StringUtils.hasText(request.getTopic())) {
            throw new IllegalArgumentException("topic is blank");
        }
        if (request.getSeedUrls() == null || request.getSeedUrls().isEmpty()) {
            throw new IllegalArgumentException("seedUrls is empty");
        }
    }

    private static int resolve(Integer requested, int fallback) {
        return requested != null ? requested : fallback;
    }

    static String truncateWords(String text, int maxWords) {
        if (maxWords <= 0 || text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        int words = 0;
        for (String line : text.split("\n")) {
            String[] tokens = line.trim().split("\\s+");
            if (words + tokens.length <= maxWords) {
                appendLine(sb, line.trim());
                words += tokens.length;
                continue;
            }
            int room = maxWords - words;
            if (room > 0) {
                appendLine(sb, String.join(" ", List.of(tokens).subList(0, room)));
            }
            break;
        }
        return sb.toString();
    }

    static int countWords(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static void appendLine(StringBuilder sb, String line) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(line);
    }

}
