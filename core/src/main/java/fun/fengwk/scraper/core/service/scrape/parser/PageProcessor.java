package fun.fengwk.scraper.core.service.scrape.parser;

import fun.fengwk.scraper.core.service.scrape.model.PageResult;
import fun.fengwk.scraper.core.service.scrape.model.PaginationSpec;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeConfig;
import fun.fengwk.scraper.core.service.scrape.model.ScrapedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns one fetched document into its records and the next page url.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageProcessor {

    private final SelectorResolver selectorResolver;
    private final FieldExtractor fieldExtractor;

    public PageResult process(Document document, ScrapeConfig config) {
        Elements items = selectorResolver.select(document, config.itemSelector());
        List<ScrapedRecord> records = new ArrayList<>(items.size());
        for (Element item : items) {
            records.add(fieldExtractor.extract(item, config.fields()));
        }
        log.debug("page processed, url={}, items={}", document.location(), items.size());

        String nextUrl = config.hasPagination() ? resolveNextUrl(document, config.pagination()) : null;
        return new PageResult(records, nextUrl);
    }

    /**
     * Follow the first "next" candidate only. A missing link, a missing attribute or a target that does not
     * resolve to an absolute http(s) url ends pagination.
     */
    String resolveNextUrl(Document document, PaginationSpec pagination) {
        Optional<Element> link = selectorResolver.selectFirst(document, pagination.nextPageSelector());
        if (link.isEmpty()) {
            return null;
        }
        String raw = selectorResolver.readAttribute(link.get(), pagination.linkAttribute()).orElse("");
        if (!StringUtils.hasText(raw)) {
            log.debug("next link has no target, url={}, attribute={}", document.location(), pagination.linkAttribute());
            return null;
        }
        String resolved = link.get().absUrl(pagination.linkAttribute());
        if (!isAbsoluteHttpUrl(resolved)) {
            log.debug("next link unresolvable, url={}, href={}", document.location(), raw);
            return null;
        }
        return resolved;
    }

    private static boolean isAbsoluteHttpUrl(String url) {
        if (!StringUtils.hasText(url)) {
            return false;
        }
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            return (scheme.equals("http") || scheme.equals("https")) && StringUtils.hasText(uri.getHost());
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

}
