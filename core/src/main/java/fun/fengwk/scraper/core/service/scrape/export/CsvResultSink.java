package fun.fengwk.scraper.core.service.scrape.export;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import fun.fengwk.scraper.core.service.scrape.ScraperProperties;
import fun.fengwk.scraper.core.service.scrape.model.FieldValue;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeResult;
import fun.fengwk.scraper.core.service.scrape.model.ScrapedRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one CSV row per record, columns in field declaration order.
 *
 * <p>Multi-valued fields are flattened into one cell joined by {@code scraper.csv.multi-value-delimiter}.
 * The header row is written even when there are no records.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class CsvResultSink implements ResultSink {

    private final CsvMapper csvMapper = new CsvMapper();

    private final ScraperProperties scraperProperties;

    @Override
    public String extension() {
        return "csv";
    }

    @Override
    public void write(ScrapeResult result, Path path) throws IOException {
        List<String> columns = result.fieldNames();
        CsvSchema.Builder schemaBuilder = CsvSchema.builder();
        for (String column : columns) {
            schemaBuilder.addColumn(column);
        }
        CsvSchema schema = schemaBuilder.build().withoutHeader();

        String delimiter = scraperProperties.getCsv().getMultiValueDelimiter();
        try (Writer output = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             SequenceWriter rows = csvMapper.writer(schema).writeValues(output)) {
            Map<String, String> header = new LinkedHashMap<>();
            for (String column : columns) {
                header.put(column, column);
            }
            rows.write(header);
            for (ScrapedRecord record : result.records()) {
                rows.write(toRow(record, columns, delimiter));
            }
        }
    }

    private static Map<String, String> toRow(ScrapedRecord record, List<String> columns, String delimiter) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : columns) {
            FieldValue value = record.get(column);
            row.put(column, value == null ? "" : value.flatten(delimiter));
        }
        return row;
    }

}
