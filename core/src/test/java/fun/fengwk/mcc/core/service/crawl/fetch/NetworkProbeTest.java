package fun.fengwk.mcc.core.service.crawl.fetch;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class NetworkProbeTest {

    @Test
    public void shouldPassWhenHostResolves() {
        FetchProperties properties = new FetchProperties();
        properties.setNetworkProbeHost("probe.invalid");

        assertThatCode(() -> new NetworkProbe(properties).checkAfterFailure("localhost", new IOException("reset")))
            .doesNotThrowAnyException();
    }

    @Test
    public void shouldPassWhenOnlyTargetHostIsUnknown() {
        FetchProperties properties = new FetchProperties();
        properties.setNetworkProbeHost("localhost");

        assertThatCode(() -> new NetworkProbe(properties).checkAfterFailure("gone.invalid", new IOException("dns")))
            .doesNotThrowAnyException();
    }

    @Test
    public void shouldPassWhenProbeDisabled() {
        FetchProperties properties = new FetchProperties();
        properties.setNetworkProbeHost("");

        assertThatCode(() -> new NetworkProbe(properties).checkAfterFailure("gone.invalid", new IOException("dns")))
            .doesNotThrowAnyException();
    }

    @Test
    public void shouldRaiseWhenNothingResolves() {
        FetchProperties properties = new FetchProperties();
        properties.setNetworkProbeHost("probe.invalid");
        IOException failure = new IOException("dns");

        assertThatThrownBy(() -> new NetworkProbe(properties).checkAfterFailure("gone.invalid", failure))
            .isInstanceOf(NetworkUnavailableException.class)
            .hasCause(failure);
    }

}
