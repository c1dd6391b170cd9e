package fun.fengwk.scraper.core.service.scrape.runtime;

import fun.fengwk.scraper.core.service.scrape.model.PageResult;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeConfig;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeResult;
import fun.fengwk.scraper.core.service.scrape.parser.PageProcessor;
import fun.fengwk.scraper.core.service.scrape.support.PageFetcher;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;

/**
 * Sequential fetch loop of one run: {@code IDLE -> FETCHING -> PROCESSING -> (DELAYING -> FETCHING) | DONE}.
 *
 * <p>One page is in flight at a time. A fetch or parse failure, or a cancelled {@link RequestPacer}, aborts
 * the run and the records collected so far are dropped together with this driver. A driver instance runs once.
 *
 * @author fengwk
 */
@Slf4j
public class PaginationDriver {

    public enum State {
        IDLE,
        FETCHING,
        PROCESSING,
        DELAYING,
        DONE,
        FAILED
    }

    private final ScrapeConfig config;
    private final PageFetcher pageFetcher;
    private final PageProcessor pageProcessor;
    private final RequestPacer requestPacer;
    private final ResultAggregator aggregator;

    private State state = State.IDLE;
    private String currentUrl;
    private int pageCount;

    public PaginationDriver(ScrapeConfig config,
                            PageFetcher pageFetcher,
                            PageProcessor pageProcessor,
                            RequestPacer requestPacer) {
        this.config = config;
        this.pageFetcher = pageFetcher;
        this.pageProcessor = pageProcessor;
        this.requestPacer = requestPacer;
        this.aggregator = new ResultAggregator(config.fieldNames());
    }

    public ScrapeResult drive() {
        if (state != State.IDLE) {
            throw new IllegalStateException("pagination driver already used, state=" + state);
        }
        currentUrl = config.startUrl();
        try {
            while (true) {
                if (requestPacer.isCancelled()) {
                    throw new ScrapeCancelledException("scrape cancelled before fetch");
                }
                state = State.FETCHING;
                log.info("fetching page, pageIndex={}, url={}", pageCount + 1, currentUrl);
                Document document = pageFetcher.fetch(currentUrl);

                state = State.PROCESSING;
                pageCount++;
                PageResult page = pageProcessor.process(document, config);
                aggregator.append(page.records());
                log.info("page scraped, pageIndex={}, items={}, total={}", pageCount, page.records().size(), aggregator.size());

                String nextUrl = nextUrl(page);
                if (nextUrl == null) {
                    break;
                }
                pauseBeforeNextPage();
                currentUrl = nextUrl;
            }
        } catch (ScrapeException ex) {
            state = State.FAILED;
            log.warn("scrape aborted, pageIndex={}, url={}, discardedRecords={}, error={}",
                pageCount + 1,
                currentUrl,
                aggregator.size(),
                ex.getMessage()
            );
            throw ex;
        }

        state = State.DONE;
        log.info("scrape finished, pages={}, records={}", pageCount, aggregator.size());
        return aggregator.result(pageCount);
    }

    private String nextUrl(PageResult page) {
        if (!config.hasPagination()) {
            return null;
        }
        if (pageCount >= config.maxPages()) {
            log.info("max pages reached, maxPages={}", config.maxPages());
            return null;
        }
        if (!page.hasNext()) {
            log.info("no next page link, pageIndex={}", pageCount);
            return null;
        }
        if (page.nextUrl().equals(currentUrl)) {
            log.info("next page link points to current page, url={}", currentUrl);
            return null;
        }
        return page.nextUrl();
    }

    private void pauseBeforeNextPage() {
        if (config.delay().isZero()) {
            return;
        }
        state = State.DELAYING;
        try {
            requestPacer.pause(config.delay());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ScrapeException("scrape interrupted while waiting for next page", ex);
        }
    }

    public State getState() {
        return state;
    }

    public int getPageCount() {
        return pageCount;
    }

}
