package fun.fengwk.mcc.core.service.crawl.support;

import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;

/**
 * URL sanitizing and origin helpers shared by the crawl runtime.
 *
 * @author fengwk
 */
public final class CrawlUrlUtils {

    /**
     * Query parameters that only carry tracking information.
     */
    private static final Set<String> TRACKING_PARAMS = Set.of(
        "utm_source",
        "utm_medium",
        "utm_campaign",
        "utm_term",
        "utm_content",
        "ref",
        "text"
    );

    private CrawlUrlUtils() {
    }

    /**
     * Normalizes an absolute http(s) url: lower-cased scheme and host, default port
     * removed, empty path turned into "/", fragment and tracking parameters dropped.
     *
     * @return normalized url, or null when the input is not an absolute http(s) url
     */
    public static String sanitize(String url) {
        if (!StringUtils.hasText(url)) {
            return null;
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException ex) {
            return null;
        }
        String scheme = uri.getScheme();
        String host = uri.getHost();
        if (scheme == null || host == null) {
            return null;
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return null;
        }

        int port = uri.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
        if (port != -1) {
            sb.append(':').append(port);
        }
        String path = uri.getRawPath();
        sb.append(StringUtils.hasLength(path) ? path : "/");
        String query = filterQuery(uri.getRawQuery());
        if (StringUtils.hasLength(query)) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * Origin of an url as scheme://host[:port], or null when the url has no host.
     */
    public static String originOf(String url) {
        String sanitized = sanitize(url);
        if (sanitized == null) {
            return null;
        }
        URI uri = URI.create(sanitized);
        String origin = uri.getScheme() + "://" + uri.getHost();
        return uri.getPort() == -1 ? origin : origin + ":" + uri.getPort();
    }

    public static String hostOf(String url) {
        String sanitized = sanitize(url);
        return sanitized == null ? "" : URI.create(sanitized).getHost();
    }

    private static String filterQuery(String rawQuery) {
        if (!StringUtils.hasLength(rawQuery)) {
            return null;
        }
        StringJoiner joiner = new StringJoiner("&");
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            if (TRACKING_PARAMS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            joiner.add(pair);
        }
        return joiner.toString();
    }

}
