package fun.fengwk.mcc.core.service.crawl.runtime;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Global and per-origin page budget.
 *
 * <p>Both counters are only read and written while holding the lock handed in by the
 * owning {@link CrawlSession}, so a reservation is never half applied and two tasks can
 * not both take the last unit.
 *
 * @author fengwk
 */
public class BudgetTracker {

    private final int maxPages;
    private final int perOriginCap;
    private final Lock lock;
    private final Map<String, Integer> pagesFetched = new HashMap<>();
    private int pagesCrawled = 0;

    public BudgetTracker(int maxPages, int perOriginCap, Lock lock) {
        if (maxPages < 0) {
            throw new IllegalArgumentException("maxPages must be >= 0");
        }
        if (perOriginCap < 0) {
            throw new IllegalArgumentException("perOriginCap must be >= 0");
        }
        this.maxPages = maxPages;
        this.perOriginCap = perOriginCap;
        this.lock = Objects.requireNonNull(lock, "lock");
    }

    /**
     * Takes one unit of both the global and the origin budget.
     *
     * @return false, with nothing changed, when either budget is used up
     */
    public boolean tryReserve(String origin) {
        lock.lock();
        try {
            int fetched = pagesFetched.getOrDefault(origin, 0);
            if (pagesCrawled >= maxPages || fetched >= perOriginCap) {
                return false;
            }
            pagesCrawled++;
            pagesFetched.put(origin, fetched + 1);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasCapacity(String origin) {
        lock.lock();
        try {
            return pagesCrawled < maxPages && pagesFetched.getOrDefault(origin, 0) < perOriginCap;
        } finally {
            lock.unlock();
        }
    }

    public int pagesCrawled() {
        lock.lock();
        try {
            return pagesCrawled;
        } finally {
            lock.unlock();
        }
    }

    public int pagesFetched(String origin) {
        lock.lock();
        try {
            return pagesFetched.getOrDefault(origin, 0);
        } finally {
            lock.unlock();
        }
    }

    public int getMaxPages() {
        return maxPages;
    }

    public int getPerOriginCap() {
        return perOriginCap;
    }

}
