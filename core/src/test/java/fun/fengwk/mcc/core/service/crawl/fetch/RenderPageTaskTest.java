package fun.fengwk.mcc.core.service.crawl.fetch;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import fun.fengwk.mcc.core.service.browser.runtime.BrowserRuntimeContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class RenderPageTaskTest {

    @Mock
    private Page page;

    @Mock
    private Response response;

    private BrowserRuntimeContext context() {
        return BrowserRuntimeContext.builder().page(page).build();
    }

    @Test
    public void shouldReturnRenderedContent() {
        when(page.navigate(eq("https://example.com/a"), any(Page.NavigateOptions.class))).thenReturn(response);
        when(response.status()).thenReturn(200);
        when(page.content()).thenReturn("<p>widgets</p>");

        String html = new RenderPageTask("https://example.com/a", 1000).execute(context());

        assertThat(html).isEqualTo("<p>widgets</p>");
        verify(page).waitForLoadState(eq(LoadState.NETWORKIDLE), any(Page.WaitForLoadStateOptions.class));
    }

    @Test
    public void shouldIgnoreNetworkIdleTimeout() {
        when(page.navigate(eq("https://example.com/a"), any(Page.NavigateOptions.class))).thenReturn(response);
        when(response.status()).thenReturn(200);
        doThrow(new TimeoutError("idle timeout"))
            .when(page).waitForLoadState(eq(LoadState.NETWORKIDLE), any(Page.WaitForLoadStateOptions.class));
        when(page.content()).thenReturn("<p>widgets</p>");

        assertThat(new RenderPageTask("https://example.com/a", 1000).execute(context())).isEqualTo("<p>widgets</p>");
    }

    @Test
    public void shouldFailOnErrorStatus() {
        when(page.navigate(eq("https://example.com/a"), any(Page.NavigateOptions.class))).thenReturn(response);
        when(response.status()).thenReturn(403);

        assertThat(new RenderPageTask("https://example.com/a", 1000).execute(context())).isNull();
        verify(page, never()).content();
    }

}
