package fun.fengwk.mcc.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class BrowserStealthSupportTest {

    @Mock
    private BrowserContext context;

    @Test
    public void shouldInstallDefaultScriptHidingWebdriver() {
        BrowserProperties properties = new BrowserProperties();

        assertThat(BrowserStealthSupport.apply(context, properties)).isTrue();

        verify(context).addInitScript(BrowserStealthSupport.DEFAULT_STEALTH_SCRIPT);
        assertThat(BrowserStealthSupport.DEFAULT_STEALTH_SCRIPT).contains("navigator, 'webdriver'");
    }

    @Test
    public void shouldPreferCustomScript() {
        BrowserProperties properties = new BrowserProperties();
        properties.setStealthScript("window.custom = true;");

        BrowserStealthSupport.apply(context, properties);

        verify(context).addInitScript("window.custom = true;");
    }

    @Test
    public void shouldSkipWhenDisabled() {
        BrowserProperties properties = new BrowserProperties();
        properties.setStealthEnabled(false);

        assertThat(BrowserStealthSupport.apply(context, properties)).isFalse();
        verify(context, never()).addInitScript(anyString());
    }

}
