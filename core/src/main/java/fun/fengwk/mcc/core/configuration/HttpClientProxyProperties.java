package fun.fengwk.mcc.core.configuration;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.util.List;

/**
 * Proxy configuration for the crawler HttpClient.
 *
 * @author fengwk
 */
@Slf4j
@Data
@ConfigurationProperties(prefix = "mcc.http.proxy")
public class HttpClientProxyProperties {

    /**
     * HTTP proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpProxy;

    /**
     * HTTPS proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpsProxy;

    /**
     * Builds a selector routing each scheme to its configured proxy.
     *
     * @return null when no proxy is configured
     */
    public ProxySelector toProxySelector() {
        Proxy http = parseProxy(httpProxy);
        Proxy https = parseProxy(httpsProxy);
        if (http == null && https == null) {
            return null;
        }
        if (http != null) {
            log.info("http proxy configured: {}", httpProxy);
        }
        if (https != null) {
            log.info("https proxy configured: {}", httpsProxy);
        }
        return new SchemeProxySelector(http, https);
    }

    Proxy parseProxy(String proxyStr) {
        if (!StringUtils.hasText(proxyStr)) {
            return null;
        }
        try {
            String uriStr = proxyStr.trim();
            if (!uriStr.contains("://")) {
                uriStr = "http://" + uriStr;
            }
            URI uri = new URI(uriStr);
            String scheme = uri.getScheme();
            Proxy.Type type = scheme != null && scheme.toLowerCase().startsWith("socks")
                ? Proxy.Type.SOCKS
                : Proxy.Type.HTTP;
            String host = uri.getHost();
            int port = uri.getPort();
            if (host == null) {
                String[] parts = proxyStr.split(":");
                host = parts[0];
                port = parts.length > 1 ? Integer.parseInt(parts[1]) : 80;
            }
            if (port == -1) {
                port = 80;
            }
            return new Proxy(type, InetSocketAddress.createUnresolved(host, port));
        } catch (Exception ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxyStr, ex);
        }
    }

    static class SchemeProxySelector extends ProxySelector {

        private final Proxy http;
        private final Proxy https;

        SchemeProxySelector(Proxy http, Proxy https) {
            this.http = http;
            this.https = https;
        }

        @Override
        public List<Proxy> select(URI uri) {
            boolean secure = uri != null && "https".equalsIgnoreCase(uri.getScheme());
            Proxy proxy = secure ? (https != null ? https : http) : (http != null ? http : https);
            return List.of(proxy == null ? Proxy.NO_PROXY : proxy);
        }

        @Override
        public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
            log.warn("proxy connect failed, uri={}, proxy={}, error={}", uri, sa, ioe.getMessage());
        }

    }

}
