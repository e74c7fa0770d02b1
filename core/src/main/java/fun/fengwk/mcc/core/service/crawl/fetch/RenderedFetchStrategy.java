package fun.fengwk.mcc.core.service.crawl.fetch;

import fun.fengwk.mcc.core.service.browser.runtime.BrowserIdentity;
import fun.fengwk.mcc.core.service.browser.runtime.BrowserTaskExecutor;
import fun.fengwk.mcc.core.service.crawl.identity.IdentityPool;
import fun.fengwk.mcc.core.service.crawl.model.FetchStrategyType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Renders the page in a throwaway headless browser context.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class RenderedFetchStrategy implements FetchStrategy {

    private final BrowserTaskExecutor browserTaskExecutor;
    private final FetchProperties fetchProperties;
    private final IdentityPool identityPool;

    @Override
    public FetchStrategyType type() {
        return FetchStrategyType.RENDERED;
    }

    @Override
    public String attempt(String url, String topic) throws Exception {
        Map<String, String> headers = identityPool.nextHeaders(topic, url);
        BrowserIdentity identity = BrowserIdentity.builder()
            .userAgent(headers.get("User-Agent"))
            .headers(headers)
            .build();
        String html = browserTaskExecutor.execute(identity, new RenderPageTask(url, fetchProperties.getRenderTimeoutMs()));
        return StringUtils.hasText(html) ? html : null;
    }

}
