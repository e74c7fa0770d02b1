package fun.fengwk.mcc.core.service.browser.runtime;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Identity a fresh browser context presents to the site.
 *
 * @author fengwk
 */
@Data
@Builder
public class BrowserIdentity {

    private String userAgent;

    /**
     * Extra request headers, user agent excluded.
     */
    private Map<String, String> headers;

}
