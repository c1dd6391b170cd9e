package fun.fengwk.scraper.core.service.scrape;

import fun.fengwk.scraper.core.service.scrape.config.ScrapeConfigDocument;
import fun.fengwk.scraper.core.service.scrape.config.ScrapeConfigValidator;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeConfig;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeResult;
import fun.fengwk.scraper.core.service.scrape.parser.PageProcessor;
import fun.fengwk.scraper.core.service.scrape.runtime.LatchRequestPacer;
import fun.fengwk.scraper.core.service.scrape.runtime.PaginationDriver;
import fun.fengwk.scraper.core.service.scrape.runtime.RequestPacer;
import fun.fengwk.scraper.core.service.scrape.support.PageFetcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Extraction engine entry, every run gets its own {@link PaginationDriver}.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ScrapeEngine {

    private final ScrapeConfigValidator configValidator;
    private final PageFetcher pageFetcher;
    private final PageProcessor pageProcessor;

    /**
     * Validate the raw config and run it. Validation errors surface before any fetch.
     */
    public ScrapeResult run(ScrapeConfigDocument document) {
        return run(configValidator.validate(document));
    }

    public ScrapeResult run(ScrapeConfig config) {
        return run(config, new LatchRequestPacer());
    }

    /**
     * Run with a caller owned pacer, so the caller can cancel the pause between pages.
     */
    public ScrapeResult run(ScrapeConfig config, RequestPacer requestPacer) {
        return new PaginationDriver(config, pageFetcher, pageProcessor, requestPacer).drive();
    }

}
