package fun.fengwk.scraper.core.service.scrape.runtime;

import java.time.Duration;

/**
 * The single suspension point between two page fetches.
 *
 * @author fengwk
 */
public interface RequestPacer {

    /**
     * Block the calling thread for the given delay.
     *
     * @throws ScrapeCancelledException if the pacer is cancelled before or during the wait
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void pause(Duration delay) throws InterruptedException;

    /**
     * Release any pending pause. The run stops before its next fetch.
     */
    void cancel();

    boolean isCancelled();

}
