package fun.fengwk.scraper.core.service.scrape.runtime;

/**
 * Base of every error that aborts a scrape run.
 *
 * @author fengwk
 */
public class ScrapeException extends RuntimeException {

    public ScrapeException(String message) {
        super(message);
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }

}
