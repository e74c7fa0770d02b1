package fun.fengwk.mcc.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Headless browser configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcc.browser")
public class BrowserProperties {

    /**
     * Whether render workers run in headless mode.
     */
    private boolean headless = true;

    /**
     * Max browsers rendering at the same time.
     */
    private int maxConcurrentRenders = 2;

    /**
     * Timeout when waiting for a free render slot.
     */
    private long renderSlotTimeoutMs = 60000;

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of("--disable-blink-features=AutomationControlled");

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    /**
     * Optional locale for browser context.
     */
    private String locale = "en-US";

    /**
     * Optional timezone id for browser context.
     */
    private String timezoneId = "";

    /**
     * Whether to enable stealth script.
     */
    private boolean stealthEnabled = true;

    /**
     * Optional stealth script, empty uses default.
     */
    private String stealthScript = "";

    public String resolveStealthScript() {
        if (!stealthEnabled) {
            return "";
        }
        if (StringUtils.hasText(stealthScript)) {
            return stealthScript;
        }
        return BrowserStealthSupport.DEFAULT_STEALTH_SCRIPT;
    }

}
