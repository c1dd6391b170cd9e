package fun.fengwk.scraper.core.service.scrape.runtime;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class LatchRequestPacerTest {

    @Test
    public void shouldWaitForDelay() throws Exception {
        LatchRequestPacer pacer = new LatchRequestPacer();

        long startAt = System.nanoTime();
        pacer.pause(Duration.ofMillis(120));

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startAt)).isGreaterThanOrEqualTo(100);
    }

    @Test
    public void shouldReturnImmediatelyForZeroDelay() throws Exception {
        LatchRequestPacer pacer = new LatchRequestPacer();

        long startAt = System.nanoTime();
        pacer.pause(Duration.ZERO);
        pacer.pause(null);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startAt)).isLessThan(1000);
    }

    @Test
    public void shouldReleasePendingPauseOnCancel() throws Exception {
        LatchRequestPacer pacer = new LatchRequestPacer();

        CompletableFuture<Void> paused = CompletableFuture.runAsync(() -> {
            try {
                pacer.pause(Duration.ofMinutes(5));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        Thread.sleep(50);
        pacer.cancel();

        assertThatThrownBy(() -> paused.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(ScrapeCancelledException.class);
        assertThat(pacer.isCancelled()).isTrue();
    }

    @Test
    public void shouldRejectPauseAfterCancel() {
        LatchRequestPacer pacer = new LatchRequestPacer();
        pacer.cancel();

        long startAt = System.nanoTime();
        assertThatThrownBy(() -> pacer.pause(Duration.ofMinutes(5))).isInstanceOf(ScrapeCancelledException.class);
        assertThatThrownBy(() -> pacer.pause(Duration.ZERO)).isInstanceOf(ScrapeCancelledException.class);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startAt)).isLessThan(1000);
    }

    @Test
    public void shouldWaitForSubMillisecondDelay() throws Exception {
        LatchRequestPacer pacer = new LatchRequestPacer();

        long startAt = System.nanoTime();
        pacer.pause(Duration.ofNanos(300_000));

        assertThat(System.nanoTime() - startAt).isGreaterThanOrEqualTo(300_000);
    }

}
