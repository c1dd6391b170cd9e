package fun.fengwk.scraper.core.service.scrape.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;

/**
 * Raw scrape config as written by the user, checked by {@link ScrapeConfigValidator}.
 *
 * @author fengwk
 */
@Data
public class ScrapeConfigDocument {

    /**
     * First page to fetch, absolute http/https url.
     */
    @JsonProperty("start_url")
    private String startUrl;

    /**
     * Selector of the repeated item block.
     */
    @JsonProperty("item_selector")
    private String itemSelector;

    /**
     * Field rules keyed by output field name, declaration order is the output column order.
     */
    @JsonProperty("fields")
    private LinkedHashMap<String, FieldDocument> fields;

    @JsonProperty("pagination")
    private PaginationDocument pagination;

    /**
     * Pause between two page requests, default 0.
     */
    @JsonProperty("delay_seconds")
    private Double delaySeconds;

    @Data
    public static class FieldDocument {

        @JsonProperty("selector")
        private String selector;

        /**
         * Attribute to read instead of the text content.
         */
        @JsonProperty("attribute")
        @JsonAlias("attr")
        private String attribute;

        @JsonProperty("multiple")
        private Boolean multiple;

    }

    @Data
    public static class PaginationDocument {

        @JsonProperty("next_page_selector")
        private String nextPageSelector;

        @JsonProperty("max_pages")
        private Integer maxPages;

        /**
         * Attribute of the next link holding the target, default href.
         */
        @JsonProperty("link_attribute")
        private String linkAttribute;

    }

}
