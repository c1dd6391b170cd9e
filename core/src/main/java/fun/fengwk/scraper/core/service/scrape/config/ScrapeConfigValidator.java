package fun.fengwk.scraper.core.service.scrape.config;

import fun.fengwk.scraper.core.service.scrape.ScraperProperties;
import fun.fengwk.scraper.core.service.scrape.model.FieldSpec;
import fun.fengwk.scraper.core.service.scrape.model.PaginationSpec;
import fun.fengwk.scraper.core.service.scrape.model.ScrapeConfig;
import fun.fengwk.scraper.core.service.scrape.parser.SelectorResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a raw config document into a typed {@link ScrapeConfig}, failing fast with {@link ConfigException}.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ScrapeConfigValidator {

    private final SelectorResolver selectorResolver;
    private final ScraperProperties scraperProperties;

    public ScrapeConfig validate(ScrapeConfigDocument document) {
        if (document == null) {
            throw new ConfigException("config is null");
        }
        String startUrl = validateStartUrl(document.getStartUrl());

        if (!StringUtils.hasText(document.getItemSelector())) {
            throw new ConfigException("item_selector is missing");
        }
        String itemSelector = document.getItemSelector().trim();
        validateSelector("item_selector", itemSelector);

        Map<String, FieldSpec> fields = validateFields(document.getFields());
        PaginationSpec pagination = validatePagination(document.getPagination());
        Duration delay = validateDelay(document.getDelaySeconds());

        return new ScrapeConfig(startUrl, itemSelector, fields, pagination, delay);
    }

    private String validateStartUrl(String startUrl) {
        if (!StringUtils.hasText(startUrl)) {
            throw new ConfigException("start_url is missing");
        }
        String trimmed = startUrl.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (Exception ex) {
            throw new ConfigException("start_url is not a valid url: " + trimmed, ex);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ConfigException("start_url must be an absolute http/https url: " + trimmed);
        }
        if (!StringUtils.hasText(uri.getHost())) {
            throw new ConfigException("start_url has no host: " + trimmed);
        }
        return trimmed;
    }

    private Map<String, FieldSpec> validateFields(Map<String, ScrapeConfigDocument.FieldDocument> fields) {
        if (fields == null) {
            throw new ConfigException("fields is missing");
        }
        if (fields.isEmpty()) {
            throw new ConfigException("fields is empty");
        }
        Map<String, FieldSpec> specs = new LinkedHashMap<>();
        for (Map.Entry<String, ScrapeConfigDocument.FieldDocument> entry : fields.entrySet()) {
            String name = entry.getKey();
            if (!StringUtils.hasText(name)) {
                throw new ConfigException("field name is blank");
            }
            ScrapeConfigDocument.FieldDocument field = entry.getValue();
            if (field == null || !StringUtils.hasText(field.getSelector())) {
                throw new ConfigException("selector of field '" + name + "' is missing");
            }
            String selector = field.getSelector().trim();
            validateSelector("field '" + name + "'", selector);

            String attribute = field.getAttribute();
            if (attribute != null) {
                if (!StringUtils.hasText(attribute)) {
                    throw new ConfigException("attribute of field '" + name + "' is blank");
                }
                attribute = attribute.trim();
            }
            boolean multiple = Boolean.TRUE.equals(field.getMultiple());
            specs.put(name, new FieldSpec(selector, attribute, multiple));
        }
        return specs;
    }

    private PaginationSpec validatePagination(ScrapeConfigDocument.PaginationDocument pagination) {
        if (pagination == null) {
            return null;
        }
        if (!StringUtils.hasText(pagination.getNextPageSelector())) {
            throw new ConfigException("pagination.next_page_selector is missing");
        }
        String nextPageSelector = pagination.getNextPageSelector().trim();
        validateSelector("pagination.next_page_selector", nextPageSelector);

        int maxPages;
        if (pagination.getMaxPages() == null) {
            maxPages = scraperProperties.getPagination().getDefaultMaxPages();
        } else if (pagination.getMaxPages() <= 0) {
            throw new ConfigException("pagination.max_pages must be positive: " + pagination.getMaxPages());
        } else {
            maxPages = pagination.getMaxPages();
        }

        String linkAttribute = PaginationSpec.DEFAULT_LINK_ATTRIBUTE;
        if (pagination.getLinkAttribute() != null) {
            if (!StringUtils.hasText(pagination.getLinkAttribute())) {
                throw new ConfigException("pagination.link_attribute is blank");
            }
            linkAttribute = pagination.getLinkAttribute().trim();
        }
        return new PaginationSpec(nextPageSelector, linkAttribute, maxPages);
    }

    private Duration validateDelay(Double delaySeconds) {
        if (delaySeconds == null) {
            return Duration.ZERO;
        }
        if (delaySeconds.isNaN() || delaySeconds.isInfinite() || delaySeconds < 0) {
            throw new ConfigException("delay_seconds must be a non-negative number: " + delaySeconds);
        }
        if (delaySeconds == 0) {
            return Duration.ZERO;
        }
        // a positive delay never rounds down to zero
        return Duration.ofNanos(Math.max(1L, Math.round(delaySeconds * 1_000_000_000d)));
    }

    private void validateSelector(String owner, String selector) {
        try {
            selectorResolver.validate(selector);
        } catch (ConfigException ex) {
            throw new ConfigException(owner + ": " + ex.getMessage(), ex);
        }
    }

}
