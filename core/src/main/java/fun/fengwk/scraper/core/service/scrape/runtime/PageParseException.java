package fun.fengwk.scraper.core.service.scrape.runtime;

import lombok.Getter;

/**
 * Thrown when a fetched body cannot be parsed as an html document.
 *
 * @author fengwk
 */
@Getter
public class PageParseException extends ScrapeException {

    private final String url;

    public PageParseException(String url, String message) {
        super("parse failed, url=" + url + ", error=" + message);
        this.url = url;
    }

    public PageParseException(String url, Throwable cause) {
        super("parse failed, url=" + url + ", error=" + cause.getMessage(), cause);
        this.url = url;
    }

}
