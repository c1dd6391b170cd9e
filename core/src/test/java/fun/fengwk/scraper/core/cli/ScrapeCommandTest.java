package fun.fengwk.scraper.core.cli;

import fun.fengwk.scraper.core.service.scrape.ScrapeService;
import fun.fengwk.scraper.core.service.scrape.config.ConfigException;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeSummary;
import fun.fengwk.scraper.core.service.scrape.runtime.FetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class ScrapeCommandTest {

    @Mock
    private ScrapeService scrapeService;

    private ScrapeCommand scrapeCommand;

    @BeforeEach
    void setUp() {
        scrapeCommand = new ScrapeCommand(scrapeService);
    }

    @Test
    public void shouldRunWithGivenPaths() {
        when(scrapeService.scrape(Path.of("conf/quotes.json"), Path.of("out/quotes")))
            .thenReturn(ScrapeSummary.builder()
                .recordCount(18)
                .pagesFetched(2)
                .jsonFile(Path.of("out/quotes.json"))
                .csvFile(Path.of("out/quotes.csv"))
                .build());

        scrapeCommand.run(new DefaultApplicationArguments("--config=conf/quotes.json", "--output-base=out/quotes"));

        assertThat(scrapeCommand.getExitCode()).isZero();
    }

    @Test
    public void shouldUseDefaultOutputBase() {
        when(scrapeService.scrape(Path.of("quotes.json"), Path.of(ScrapeCommand.DEFAULT_OUTPUT_BASE)))
            .thenReturn(ScrapeSummary.builder().build());

        scrapeCommand.run(new DefaultApplicationArguments("--config=quotes.json"));

        verify(scrapeService).scrape(Path.of("quotes.json"), Path.of("output/data"));
        assertThat(scrapeCommand.getExitCode()).isZero();
    }

    @Test
    public void shouldAcceptSpaceSeparatedConfigOption() {
        when(scrapeService.scrape(Path.of("cfg.json"), Path.of("output/data")))
            .thenReturn(ScrapeSummary.builder().build());

        scrapeCommand.run(new DefaultApplicationArguments("--config", "cfg.json"));

        assertThat(scrapeCommand.getExitCode()).isZero();
    }

    @Test
    public void shouldAcceptShortOptions() {
        when(scrapeService.scrape(Path.of("cfg.json"), Path.of("out/quotes")))
            .thenReturn(ScrapeSummary.builder().build());

        scrapeCommand.run(new DefaultApplicationArguments("-c", "cfg.json", "-o=out/quotes"));

        verify(scrapeService).scrape(Path.of("cfg.json"), Path.of("out/quotes"));
        assertThat(scrapeCommand.getExitCode()).isZero();
    }

    @Test
    public void shouldFailWhenConfigOptionHasNoValue() {
        scrapeCommand.run(new DefaultApplicationArguments("--config", "--output-base=out/quotes"));

        assertThat(scrapeCommand.getExitCode()).isEqualTo(ScrapeCommand.EXIT_INVALID_CONFIG);
        verify(scrapeService, never()).scrape(any(), any());
    }

    @Test
    public void shouldFailWithoutConfigOption() {
        scrapeCommand.run(new DefaultApplicationArguments("--output-base=out/quotes"));

        assertThat(scrapeCommand.getExitCode()).isEqualTo(ScrapeCommand.EXIT_INVALID_CONFIG);
        verify(scrapeService, never()).scrape(any(), any());
    }

    @Test
    public void shouldMapConfigErrorToExitCodeTwo() {
        when(scrapeService.scrape(any(), any())).thenThrow(new ConfigException("fields is missing"));

        scrapeCommand.run(new DefaultApplicationArguments("--config=quotes.json"));

        assertThat(scrapeCommand.getExitCode()).isEqualTo(2);
    }

    @Test
    public void shouldMapFetchErrorToExitCodeOne() {
        when(scrapeService.scrape(any(), any())).thenThrow(new FetchException("https://quotes.example/page/2/", 503));

        scrapeCommand.run(new DefaultApplicationArguments("--config=quotes.json"));

        assertThat(scrapeCommand.getExitCode()).isEqualTo(1);
    }

}
