package fun.fengwk.scraper.core.service.scrape.model;

import java.util.List;

/**
 * Ordered records of a whole run, in page-then-item order.
 *
 * @author fengwk
 */
public record ScrapeResult(List<String> fieldNames, List<ScrapedRecord> records, int pagesFetched) {

    public ScrapeResult {
        fieldNames = List.copyOf(fieldNames);
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

}
