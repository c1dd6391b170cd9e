package fun.fengwk.scraper.core.service.scrape;

import fun.fengwk.scraper.core.service.scrape.model.ScrapeSummary;

import java.nio.file.Path;

/**
 * Scrape service entry: load config, run, export.
 *
 * @author fengwk
 */
public interface ScrapeService {

    ScrapeSummary scrape(Path configPath, Path outputBase);

}
