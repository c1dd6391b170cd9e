package fun.fengwk.scraper.core.cli;

import fun.fengwk.scraper.core.service.scrape.ScrapeService;
import fun.fengwk.scraper.core.service.scrape.config.ConfigException;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeSummary;
import fun.fengwk.scraper.core.service.scrape.runtime.ScrapeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line runner: {@code --config=<path> [--output-base=<path>]}. The space separated form
 * {@code --config <path>} and the short options {@code -c}/{@code -o} are accepted too.
 *
 * <p>Exit code 0 on success, 2 on an invalid config, 1 on any other failure. A failed run writes no file.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeCommand implements ApplicationRunner, ExitCodeGenerator {

    static final String OPTION_CONFIG = "config";
    static final String OPTION_OUTPUT_BASE = "output-base";
    static final String SHORT_OPTION_CONFIG = "c";
    static final String SHORT_OPTION_OUTPUT_BASE = "o";
    static final String DEFAULT_OUTPUT_BASE = "output/data";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_CONFIG = 2;

    private static final String USAGE = "usage: --config=<path to json config> [--output-base=<path without extension>], or -c <path> [-o <path>]";

    private final ScrapeService scrapeService;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        String config = optionValue(args, OPTION_CONFIG, SHORT_OPTION_CONFIG);
        if (!StringUtils.hasText(config)) {
            log.error("config option is missing, {}", USAGE);
            exitCode = EXIT_INVALID_CONFIG;
            return;
        }
        String outputBase = optionValue(args, OPTION_OUTPUT_BASE, SHORT_OPTION_OUTPUT_BASE);
        if (!StringUtils.hasText(outputBase)) {
            outputBase = DEFAULT_OUTPUT_BASE;
        }

        try {
            ScrapeSummary summary = scrapeService.scrape(toPath(config), toPath(outputBase));
            log.info("scrape completed, records={}, pages={}, json={}, csv={}, elapsedMs={}",
                summary.getRecordCount(),
                summary.getPagesFetched(),
                summary.getJsonFile(),
                summary.getCsvFile(),
                summary.getElapsedMs()
            );
            exitCode = EXIT_OK;
        } catch (ConfigException ex) {
            log.error("invalid config, config={}, error={}", config, ex.getMessage());
            exitCode = EXIT_INVALID_CONFIG;
        } catch (ScrapeException ex) {
            log.error("scrape failed, config={}, error={}", config, ex.getMessage(), ex);
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static String optionValue(ApplicationArguments args, String longName, String shortName) {
        List<String> values = args.getOptionValues(longName);
        if (values != null && !values.isEmpty() && StringUtils.hasText(values.get(0))) {
            return values.get(0).trim();
        }

        // --name <value>, -n <value> and -n=<value> are not parsed by spring
        String[] sourceArgs = args.getSourceArgs();
        String longFlag = "--" + longName;
        String shortFlag = "-" + shortName;
        for (int i = 0; i < sourceArgs.length; i++) {
            String arg = sourceArgs[i];
            if (arg.startsWith(shortFlag + "=")) {
                return arg.substring(shortFlag.length() + 1).trim();
            }
            if ((arg.equals(longFlag) || arg.equals(shortFlag))
                && i + 1 < sourceArgs.length
                && !sourceArgs[i + 1].startsWith("-")) {
                return sourceArgs[i + 1].trim();
            }
        }
        return null;
    }

    private static Path toPath(String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException ex) {
            throw new ConfigException("invalid path: " + value, ex);
        }
    }

}
