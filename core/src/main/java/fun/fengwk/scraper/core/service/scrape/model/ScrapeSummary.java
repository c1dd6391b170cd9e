package fun.fengwk.scraper.core.service.scrape.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Outcome of a complete scrape and export.
 *
 * @author fengwk
 */
@Data
@Builder
public class ScrapeSummary {

    private int recordCount;
    private int pagesFetched;
    private Path jsonFile;
    private Path csvFile;
    private long elapsedMs;

}
