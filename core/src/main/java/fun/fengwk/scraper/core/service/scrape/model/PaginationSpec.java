package fun.fengwk.scraper.core.service.scrape.model;

/**
 * Next page discovery rule.
 *
 * @param nextPageSelector selector of the "next" link, only the first match is followed
 * @param linkAttribute    attribute holding the link target
 * @param maxPages         upper bound of fetched pages, always positive
 * @author fengwk
 */
public record PaginationSpec(String nextPageSelector, String linkAttribute, int maxPages) {

    public static final String DEFAULT_LINK_ATTRIBUTE = "href";

}
