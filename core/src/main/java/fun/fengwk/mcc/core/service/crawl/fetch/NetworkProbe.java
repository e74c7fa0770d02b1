package fun.fengwk.mcc.core.service.crawl.fetch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Tells a single unknown host apart from a resolver that is down.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NetworkProbe {

    private final FetchProperties fetchProperties;

    public boolean isResolvable(String host) {
        if (!StringUtils.hasText(host)) {
            return false;
        }
        try {
            InetAddress.getByName(host);
            return true;
        } catch (UnknownHostException ex) {
            return false;
        }
    }

    /**
     * Called after a request to {@code host} failed. Returns normally unless both the host and
     * the probe host fail to resolve.
     *
     * @throws NetworkUnavailableException when name resolution is down altogether
     */
    public void checkAfterFailure(String host, Throwable failure) {
        if (isResolvable(host)) {
            return;
        }
        String probeHost = fetchProperties.getNetworkProbeHost();
        if (!StringUtils.hasText(probeHost)) {
            log.debug("host not resolvable, probe disabled, host={}", host);
            return;
        }
        if (isResolvable(probeHost)) {
            log.debug("host not resolvable, network is up, host={}, probeHost={}", host, probeHost);
            return;
        }
        log.error("network unavailable, host={}, probeHost={}", host, probeHost);
        throw new NetworkUnavailableException(
            "cannot resolve " + host + " nor probe host " + probeHost, failure);
    }

}
