package fun.fengwk.scraper.core.service.scrape.config;

import fun.fengwk.scraper.core.service.scrape.runtime.ScrapeException;

/**
 * Invalid or incomplete scrape configuration. Always raised before any network activity.
 *
 * @author fengwk
 */
public class ConfigException extends ScrapeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

}
