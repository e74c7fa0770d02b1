package fun.fengwk.mcc.core.service.crawl.identity;

/**
 * Blocking delay hook.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = millis -> {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(long millis) throws InterruptedException;

}
