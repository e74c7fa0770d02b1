package fun.fengwk.mcc.core.service.crawl.fetch;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.mcc.core.service.browser.runtime.BrowserRuntimeContext;
import fun.fengwk.mcc.core.service.browser.runtime.BrowserTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Navigates to a page and returns its rendered markup.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class RenderPageTask implements BrowserTask<String> {

    private static final double NETWORK_IDLE_TIMEOUT_MS = 5000;

    private final String url;
    private final int navigateTimeoutMs;

    @Override
    public String execute(BrowserRuntimeContext context) {
        Page page = context.getPage();
        Response response = page.navigate(url,
            new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout((double) navigateTimeoutMs)
        );
        if (response != null && response.status() >= 400) {
            log.debug("render rejected, url={}, statusCode={}", url, response.status());
            return null;
        }
        waitForNetworkIdleBestEffort(page);
        return page.content();
    }

    private void waitForNetworkIdleBestEffort(Page page) {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE,
                new Page.WaitForLoadStateOptions().setTimeout(NETWORK_IDLE_TIMEOUT_MS));
        } catch (PlaywrightException ex) {
            log.debug("network idle not reached, url={}, error={}", url, ex.getMessage());
        }
    }

}
