package fun.fengwk.mcc.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import org.springframework.util.StringUtils;

/**
 * Stealth script helper for browser context.
 *
 * @author fengwk
 */
public final class BrowserStealthSupport {

    static final String DEFAULT_STEALTH_SCRIPT = """
        (() => {
          try {
            Object.defineProperty(navigator, 'webdriver', { get: () => undefined });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'languages', { get: () => ['en-US', 'en'] });
          } catch (e) {}
          try {
            Object.defineProperty(navigator, 'plugins', { get: () => [1, 2, 3, 4, 5] });
          } catch (e) {}
          try {
            window.chrome = window.chrome || { runtime: {} };
          } catch (e) {}
        })();
        """;

    private BrowserStealthSupport() {
    }

    /**
     * @return true when a script was installed
     */
    public static boolean apply(BrowserContext context, BrowserProperties properties) {
        String script = properties.resolveStealthScript();
        if (!StringUtils.hasText(script)) {
            return false;
        }
        context.addInitScript(script);
        return true;
    }

}
