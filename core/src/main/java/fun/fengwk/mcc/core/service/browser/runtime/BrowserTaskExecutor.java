package fun.fengwk.mcc.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import fun.fengwk.mcc.core.service.browser.BrowserProperties;
import fun.fengwk.mcc.core.service.browser.BrowserStealthSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs browser tasks in isolated, throwaway browser contexts.
 *
 * <p>Every task gets its own Playwright instance, browser and context, so no cookies or
 * storage leak between renders. Playwright objects are not thread-safe, which is why they
 * are never shared; a semaphore bounds how many browsers run at once.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BrowserTaskExecutor {

    private final BrowserProperties browserProperties;
    private final Semaphore renderSlots;

    public BrowserTaskExecutor(BrowserProperties browserProperties) {
        this.browserProperties = browserProperties;
        this.renderSlots = new Semaphore(Math.max(1, browserProperties.getMaxConcurrentRenders()), true);
    }

    public <T> T execute(BrowserIdentity identity, BrowserTask<T> task) throws Exception {
        boolean acquired = renderSlots.tryAcquire(browserProperties.getRenderSlotTimeoutMs(), TimeUnit.MILLISECONDS);
        if (!acquired) {
            log.warn("no free render slot, maxConcurrentRenders={}", browserProperties.getMaxConcurrentRenders());
            throw new IllegalStateException("browser render pool is busy");
        }
        try {
            return doExecute(identity, task);
        } finally {
            renderSlots.release();
        }
    }

    private <T> T doExecute(BrowserIdentity identity, BrowserTask<T> task) throws Exception {
        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().launch(buildLaunchOptions());
            try (BrowserContext context = browser.newContext(buildContextOptions(identity))) {
                if (BrowserStealthSupport.apply(context, browserProperties)) {
                    log.debug("stealth script installed");
                }
                Page page = context.newPage();
                BrowserRuntimeContext runtimeContext = BrowserRuntimeContext.builder()
                    .browserContext(context)
                    .page(page)
                    .build();
                return task.execute(runtimeContext);
            } finally {
                browser.close();
            }
        }
    }

    BrowserType.LaunchOptions buildLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());
        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (browserProperties.getIgnoreDefaultArgs() != null && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        return options;
    }

    Browser.NewContextOptions buildContextOptions(BrowserIdentity identity) {
        Browser.NewContextOptions options = new Browser.NewContextOptions();
        if (identity != null && StringUtils.hasText(identity.getUserAgent())) {
            options.setUserAgent(identity.getUserAgent());
        }
        if (identity != null && identity.getHeaders() != null && !identity.getHeaders().isEmpty()) {
            Map<String, String> headers = new LinkedHashMap<>(identity.getHeaders());
            // Playwright rejects a user agent passed as an extra header.
            headers.keySet().removeIf(name -> name.equalsIgnoreCase("User-Agent"));
            options.setExtraHTTPHeaders(headers);
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }
        return options;
    }

}
