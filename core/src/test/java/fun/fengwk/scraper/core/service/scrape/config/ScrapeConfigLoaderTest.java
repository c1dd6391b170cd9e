package fun.fengwk.scraper.core.service.scrape.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ScrapeConfigLoaderTest {

    private final ScrapeConfigLoader loader = new ScrapeConfigLoader(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    public void shouldLoadConfigKeepingFieldOrder() throws Exception {
        Path path = write("""
            {
              "start_url": "https://quotes.toscrape.com/",
              "item_selector": "div.quote",
              "fields": {
                "text": {"selector": "span.text"},
                "author": {"selector": "small.author"},
                "author_url": {"selector": "span a", "attr": "href"},
                "tags": {"selector": "div.tags a.tag", "multiple": true}
              },
              "pagination": {"next_page_selector": "li.next > a", "max_pages": 5},
              "delay_seconds": 0.5
            }
            """);

        ScrapeConfigDocument document = loader.load(path);

        assertThat(document.getStartUrl()).isEqualTo("https://quotes.toscrape.com/");
        assertThat(document.getFields().keySet()).containsExactly("text", "author", "author_url", "tags");
        assertThat(document.getFields().get("author_url").getAttribute()).isEqualTo("href");
        assertThat(document.getFields().get("tags").getMultiple()).isTrue();
        assertThat(document.getPagination().getMaxPages()).isEqualTo(5);
        assertThat(document.getDelaySeconds()).isEqualTo(0.5);
    }

    @Test
    public void shouldRejectMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("config file not found");
    }

    @Test
    public void shouldRejectMalformedJson() throws Exception {
        Path path = write("{\"start_url\": ");

        assertThatThrownBy(() -> loader.load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("config file unreadable");
    }

    @Test
    public void shouldRejectUnknownProperty() throws Exception {
        Path path = write("{\"start_url\": \"https://a.example/\", \"item_selectr\": \"div\"}");

        assertThatThrownBy(() -> loader.load(path)).isInstanceOf(ConfigException.class);
    }

    @Test
    public void shouldRejectDuplicateFieldNames() throws Exception {
        Path path = write("""
            {"fields": {"text": {"selector": "a"}, "text": {"selector": "b"}}}
            """);

        assertThatThrownBy(() -> loader.load(path)).isInstanceOf(ConfigException.class);
    }

    @Test
    public void shouldRejectEmptyDocument() throws Exception {
        Path path = write("null");

        assertThatThrownBy(() -> loader.load(path))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("config file is empty");
    }

    private Path write(String content) throws Exception {
        Path path = tempDir.resolve("config.json");
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

}
