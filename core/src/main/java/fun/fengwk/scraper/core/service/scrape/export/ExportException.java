package fun.fengwk.scraper.core.service.scrape.export;

import fun.fengwk.scraper.core.service.scrape.runtime.ScrapeException;

/**
 * Thrown when the result set cannot be written. No output file is left behind.
 *
 * @author fengwk
 */
public class ExportException extends ScrapeException {

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }

}
