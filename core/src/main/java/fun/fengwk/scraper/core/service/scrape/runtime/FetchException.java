package fun.fengwk.scraper.core.service.scrape.runtime;

import lombok.Getter;

/**
 * Thrown when a page cannot be fetched or the server answers with a non-success status.
 *
 * @author fengwk
 */
@Getter
public class FetchException extends ScrapeException {

    /**
     * Status code reported by the server, -1 when no response was received.
     */
    private final int statusCode;

    private final String url;

    public FetchException(String url, int statusCode) {
        super("fetch failed, url=" + url + ", status=" + statusCode);
        this.url = url;
        this.statusCode = statusCode;
    }

    public FetchException(String url, Throwable cause) {
        super("fetch failed, url=" + url + ", error=" + cause.getMessage(), cause);
        this.url = url;
        this.statusCode = -1;
    }

}
