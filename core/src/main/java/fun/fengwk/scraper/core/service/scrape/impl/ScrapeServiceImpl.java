package fun.fengwk.scraper.core.service.scrape.impl;

import fun.fengwk.scraper.core.service.scrape.ScrapeEngine;
import fun.fengwk.scraper.core.service.scrape.ScrapeService;
import fun.fengwk.scraper.core.service.scrape.config.ScrapeConfigDocument;
import fun.fengwk.scraper.core.service.scrape.config.ScrapeConfigLoader;
import fun.fengwk.scraper.core.service.scrape.config.ScrapeConfigValidator;
import fun.fengwk.scraper.core.service.scrape.export.ResultExporter;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeConfig;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeResult;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Scrape service implementation.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeServiceImpl implements ScrapeService {

    private final ScrapeConfigLoader configLoader;
    private final ScrapeConfigValidator configValidator;
    private final ScrapeEngine scrapeEngine;
    private final ResultExporter resultExporter;

    @Override
    public ScrapeSummary scrape(Path configPath, Path outputBase) {
        long startAt = System.currentTimeMillis();
        ScrapeConfigDocument document = configLoader.load(configPath);
        ScrapeConfig config = configValidator.validate(document);
        log.info("scrape started, config={}, startUrl={}, fields={}, maxPages={}",
            configPath,
            config.startUrl(),
            config.fieldNames(),
            config.maxPages()
        );

        ScrapeResult result = scrapeEngine.run(config);
        List<Path> files = resultExporter.export(result, outputBase);

        return ScrapeSummary.builder()
            .recordCount(result.size())
            .pagesFetched(result.pagesFetched())
            .jsonFile(files.get(0))
            .csvFile(files.get(1))
            .elapsedMs(System.currentTimeMillis() - startAt)
            .build();
    }

}
