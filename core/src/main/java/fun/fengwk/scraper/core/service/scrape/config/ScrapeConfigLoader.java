package fun.fengwk.scraper.core.service.scrape.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads a scrape config document from a JSON file.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ScrapeConfigLoader {

    private final ObjectReader reader;

    public ScrapeConfigLoader(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(ScrapeConfigDocument.class)
            .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .withFeatures(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    public ScrapeConfigDocument load(Path path) {
        if (path == null) {
            throw new ConfigException("config path is null");
        }
        try (InputStream input = Files.newInputStream(path)) {
            ScrapeConfigDocument document = reader.readValue(input);
            if (document == null) {
                throw new ConfigException("config file is empty: " + path);
            }
            log.debug("config loaded, path={}", path);
            return document;
        } catch (NoSuchFileException ex) {
            throw new ConfigException("config file not found: " + path, ex);
        } catch (IOException ex) {
            throw new ConfigException("config file unreadable: " + path + " (" + ex.getMessage() + ")", ex);
        }
    }

}
