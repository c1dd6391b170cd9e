package fun.fengwk.scraper.core.service.scrape;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine level tunables, the per-site rules live in the scrape config document.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {

    private Http http = new Http();

    private Pagination pagination = new Pagination();

    private Csv csv = new Csv();

    @Data
    public static class Http {

        /**
         * Connect timeout in milliseconds.
         */
        private int connectTimeoutMs = 15000;

        /**
         * Whole request timeout in milliseconds.
         */
        private int requestTimeoutMs = 10000;

        /**
         * User-Agent header sent with every page request.
         */
        private String userAgent =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    }

    @Data
    public static class Pagination {

        /**
         * Page bound used when pagination is configured without max_pages.
         */
        private int defaultMaxPages = 50;

    }

    @Data
    public static class Csv {

        /**
         * Delimiter used to flatten multi-valued fields into one cell.
         */
        private String multiValueDelimiter = ", ";

    }

}
