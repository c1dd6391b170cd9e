package fun.fengwk.scraper.core.service.scrape.export;

import fun.fengwk.scraper.core.service.scrape.model.ScrapeResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes a complete result set to one file.
 *
 * @author fengwk
 */
public interface ResultSink {

    /**
     * File extension without the dot.
     */
    String extension();

    void write(ScrapeResult result, Path path) throws IOException;

}
