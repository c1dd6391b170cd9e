package fun.fengwk.scraper.core.service.scrape.runtime;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Pacer waiting on a latch so that {@link #cancel()} wakes a pending pause.
 *
 * @author fengwk
 */
@Slf4j
public class LatchRequestPacer implements RequestPacer {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    @Override
    public void pause(Duration delay) throws InterruptedException {
        if (isCancelled()) {
            throw new ScrapeCancelledException("scrape cancelled before pause");
        }
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        if (cancelled.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
            log.debug("request pause cancelled, delayMs={}", delay.toMillis());
            throw new ScrapeCancelledException("scrape cancelled during pause");
        }
    }

    @Override
    public void cancel() {
        cancelled.countDown();
    }

    @Override
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

}
