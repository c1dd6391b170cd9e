package fun.fengwk.scraper.core.service.scrape.model;

import java.util.List;

/**
 * Records of one page plus the resolved next page url, null when pagination ends here.
 *
 * @author fengwk
 */
public record PageResult(List<ScrapedRecord> records, String nextUrl) {

    public PageResult {
        records = List.copyOf(records);
    }

    public boolean hasNext() {
        return nextUrl != null;
    }

}
