package fun.fengwk.scraper.core.service.scrape.support;

import org.jsoup.nodes.Document;

/**
 * Fetches and parses one page.
 *
 * @author fengwk
 */
public interface PageFetcher {

    /**
     * Fetch the url and parse the body. The returned document carries the page url as base uri.
     *
     * @throws fun.fengwk.scraper.core.service.scrape.runtime.FetchException on transport failure or non-success status
     * @throws fun.fengwk.scraper.core.service.scrape.runtime.PageParseException when the body is not a parsable document
     */
    Document fetch(String url);

}
