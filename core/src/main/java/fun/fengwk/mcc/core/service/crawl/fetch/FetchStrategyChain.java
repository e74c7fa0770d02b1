package fun.fengwk.mcc.core.service.crawl.fetch;

import fun.fengwk.mcc.core.service.crawl.identity.IdentityPool;
import fun.fengwk.mcc.core.service.crawl.model.FetchResult;
import fun.fengwk.mcc.core.service.crawl.model.FetchStrategyType;
import fun.fengwk.mcc.core.service.crawl.runtime.CrawlSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tries each fetch strategy in order until one yields markup.
 *
 * <p>Every step reserves one budget unit before it runs. A refused reservation aborts
 * the chain, so a url may consume up to one unit per strategy.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class FetchStrategyChain {

    private final List<FetchStrategy> strategies;
    private final FetchProperties fetchProperties;
    private final IdentityPool identityPool;

    public FetchStrategyChain(List<FetchStrategy> strategies, FetchProperties fetchProperties,
                              IdentityPool identityPool) {
        List<FetchStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparingInt(strategy -> strategy.type().ordinal()));
        this.strategies = List.copyOf(ordered);
        this.fetchProperties = fetchProperties;
        this.identityPool = identityPool;
    }

    public FetchResult fetch(String url, String origin, String topic, CrawlSession session) throws InterruptedException {
        int units = 0;
        for (FetchStrategy strategy : strategies) {
            if (strategy.type() == FetchStrategyType.ARCHIVED && !fetchProperties.isArchiveEnabled()) {
                continue;
            }
            if (!session.tryReserve(origin)) {
                log.info("budget denied, url={}, strategy={}, pagesCrawled={}",
                    url, strategy.type().getValue(), session.pagesCrawled());
                return FetchResult.builder()
                    .origin(origin)
                    .budgetDenied(true)
                    .budgetUnits(units)
                    .build();
            }
            units++;
            identityPool.pace(origin);

            String html = attempt(strategy, url, topic);
            if (html != null) {
                identityPool.recordOutcome(origin, true);
                log.debug("fetch succeeded, url={}, strategy={}", url, strategy.type().getValue());
                return FetchResult.builder()
                    .html(html)
                    .strategyUsed(strategy.type())
                    .origin(origin)
                    .budgetUnits(units)
                    .build();
            }
        }

        identityPool.recordOutcome(origin, false);
        log.warn("all fetch strategies failed, url={}, budgetUnits={}", url, units);
        return FetchResult.builder()
            .origin(origin)
            .budgetUnits(units)
            .build();
    }

    List<FetchStrategy> getStrategies() {
        return strategies;
    }

    private String attempt(FetchStrategy strategy, String url, String topic) throws InterruptedException {
        try {
            return strategy.attempt(url, topic);
        } catch (NetworkUnavailableException | InterruptedException ex) {
            throw ex;
        } catch (Exception ex) {
            log.warn("fetch strategy failed, url={}, strategy={}, error={}",
                url, strategy.type().getValue(), ex.getMessage());
            return null;
        }
    }

}
