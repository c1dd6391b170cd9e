package fun.fengwk.scraper.core.service.scrape.runtime;

import fun.fengwk.scraper.core.service.scrape.model.ScrapeResult;
import fun.fengwk.scraper.core.service.scrape.model.ScrapedRecord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only record accumulator of one run. Keeps crawl order and never deduplicates.
 *
 * @author fengwk
 */
public class ResultAggregator {

    private final List<String> fieldNames;
    private final Set<String> fieldNameSet;
    private final List<ScrapedRecord> records = new ArrayList<>();

    public ResultAggregator(List<String> fieldNames) {
        this.fieldNames = List.copyOf(fieldNames);
        this.fieldNameSet = new LinkedHashSet<>(fieldNames);
    }

    public void append(List<ScrapedRecord> pageRecords) {
        for (ScrapedRecord record : pageRecords) {
            // every record has the same shape for the whole run
            if (!fieldNameSet.equals(record.fieldNames())) {
                throw new IllegalStateException("record fields " + record.fieldNames() + " differ from " + fieldNames);
            }
            records.add(record);
        }
    }

    public int size() {
        return records.size();
    }

    public ScrapeResult result(int pagesFetched) {
        return new ScrapeResult(fieldNames, records, pagesFetched);
    }

}
