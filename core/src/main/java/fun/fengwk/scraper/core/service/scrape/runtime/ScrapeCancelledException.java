package fun.fengwk.scraper.core.service.scrape.runtime;

/**
 * Thrown when the run is cancelled through its {@link RequestPacer}.
 *
 * @author fengwk
 */
public class ScrapeCancelledException extends ScrapeException {

    public ScrapeCancelledException(String message) {
        super(message);
    }

}
