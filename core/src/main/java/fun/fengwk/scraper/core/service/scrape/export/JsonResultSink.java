package fun.fengwk.scraper.core.service.scrape.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes records as a pretty printed JSON array, multi-valued fields kept as arrays.
 *
 * @author fengwk
 */
@Component
public class JsonResultSink implements ResultSink {

    private final ObjectWriter writer;

    public JsonResultSink(ObjectMapper objectMapper) {
        this.writer = objectMapper.writer()
            .with(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String extension() {
        return "json";
    }

    @Override
    public void write(ScrapeResult result, Path path) throws IOException {
        try (Writer output = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.writeValue(output, result.records());
        }
    }

}
