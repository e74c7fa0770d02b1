package fun.fengwk.mcc.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import fun.fengwk.mcc.core.service.browser.BrowserProperties;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class BrowserTaskExecutorTest {

    @Test
    public void shouldLaunchHeadlessWithoutAutomationFlag() {
        BrowserTaskExecutor executor = new BrowserTaskExecutor(new BrowserProperties());

        BrowserType.LaunchOptions options = executor.buildLaunchOptions();

        assertThat(options.headless).isTrue();
        assertThat(options.args).containsExactly("--disable-blink-features=AutomationControlled");
        assertThat(options.ignoreDefaultArgs).containsExactly("--enable-automation");
        assertThat(options.executablePath).isNull();
    }

    @Test
    public void shouldBuildContextFromIdentity() {
        BrowserProperties properties = new BrowserProperties();
        properties.setTimezoneId("Europe/Berlin");
        BrowserTaskExecutor executor = new BrowserTaskExecutor(properties);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", "test-agent");
        headers.put("Referer", "https://www.google.com/search?q=widgets");

        Browser.NewContextOptions options = executor.buildContextOptions(BrowserIdentity.builder()
            .userAgent("test-agent")
            .headers(headers)
            .build());

        assertThat(options.userAgent).isEqualTo("test-agent");
        assertThat(options.extraHTTPHeaders).containsOnlyKeys("Referer");
        assertThat(options.locale).isEqualTo("en-US");
        assertThat(options.timezoneId).isEqualTo("Europe/Berlin");
        assertThat(headers).containsKey("User-Agent");
    }

    @Test
    public void shouldSkipEmptyLaunchSettings() {
        BrowserProperties properties = new BrowserProperties();
        properties.setLaunchArgs(List.of());
        properties.setIgnoreDefaultArgs(List.of());
        properties.setHeadless(false);

        BrowserType.LaunchOptions options = new BrowserTaskExecutor(properties).buildLaunchOptions();

        assertThat(options.headless).isFalse();
        assertThat(options.args).isNull();
        assertThat(options.ignoreDefaultArgs).isNull();
    }

}
