package fun.fengwk.scraper.core.service.scrape.parser;

import fun.fengwk.scraper.core.service.scrape.config.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.QueryParser;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Thin layer over jsoup css selection.
 *
 * <p>Selection never fails: selector syntax is checked once by {@link #validate(String)} before a run starts,
 * so a blank or malformed selector that slips through simply matches nothing.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class SelectorResolver {

    /**
     * Select matching nodes under the scope in document order. The scope may be a whole document or one element.
     */
    public Elements select(Element scope, String selector) {
        if (scope == null || !StringUtils.hasText(selector)) {
            return new Elements();
        }
        try {
            return scope.select(selector);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            log.debug("select failed, selector={}, error={}", selector, ex.getMessage());
            return new Elements();
        }
    }

    public Optional<Element> selectFirst(Element scope, String selector) {
        Elements elements = select(scope, selector);
        return elements.isEmpty() ? Optional.empty() : Optional.of(elements.first());
    }

    /**
     * Normalized text content, inner whitespace collapsed and trimmed.
     */
    public String readText(Element element) {
        return element == null ? "" : element.text().trim();
    }

    /**
     * Trimmed attribute value, empty when the element does not carry the attribute.
     */
    public Optional<String> readAttribute(Element element, String name) {
        if (element == null || !StringUtils.hasText(name) || !element.hasAttr(name)) {
            return Optional.empty();
        }
        return Optional.of(element.attr(name).trim());
    }

    /**
     * Check selector syntax.
     *
     * @param selector css selector
     * @throws ConfigException when the selector is blank or cannot be parsed
     */
    public void validate(String selector) {
        if (!StringUtils.hasText(selector)) {
            throw new ConfigException("selector is blank");
        }
        try {
            QueryParser.parse(selector);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            throw new ConfigException("malformed selector: " + selector + " (" + ex.getMessage() + ")", ex);
        }
    }

}
