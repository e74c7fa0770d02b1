package fun.fengwk.mcc.core.service.crawl.fetch;

/**
 * Thrown when name resolution fails for every host, so no crawl can make progress.
 *
 * @author fengwk
 */
public class NetworkUnavailableException extends RuntimeException {

    public NetworkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

}
