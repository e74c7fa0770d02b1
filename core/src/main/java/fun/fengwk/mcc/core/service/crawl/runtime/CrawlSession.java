package fun.fengwk.mcc.core.service.crawl.runtime;

import lombok.Getter;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one crawl invocation shared by its origin tasks.
 *
 * <p>The visited set and the page budget share a single lock. A session is created per
 * crawl and never reused, so nothing leaks between runs.
 *
 * @author fengwk
 */
public class CrawlSession {

    @Getter
    private final String topic;

    @Getter
    private final int maxDepth;

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> visited = new HashSet<>();
    private final BudgetTracker budget;
    private volatile boolean cancelled = false;

    public CrawlSession(String topic, int maxDepth, int maxPages, int perOriginCap) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        this.topic = topic;
        this.maxDepth = maxDepth;
        this.budget = new BudgetTracker(maxPages, perOriginCap, lock);
    }

    /**
     * @return true when the url was not visited before
     */
    public boolean markVisited(String url) {
        lock.lock();
        try {
            return visited.add(url);
        } finally {
            lock.unlock();
        }
    }

    public boolean isVisited(String url) {
        lock.lock();
        try {
            return visited.contains(url);
        } finally {
            lock.unlock();
        }
    }

    public int visitedCount() {
        lock.lock();
        try {
            return visited.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean tryReserve(String origin) {
        return budget.tryReserve(origin);
    }

    public boolean hasCapacity(String origin) {
        return budget.hasCapacity(origin);
    }

    public int pagesCrawled() {
        return budget.pagesCrawled();
    }

    public int pagesFetched(String origin) {
        return budget.pagesFetched(origin);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

}
