package fun.fengwk.scraper.core.service.scrape.parser;

import fun.fengwk.scraper.core.service.scrape.config.ConfigException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class SelectorResolverTest {

    private final SelectorResolver selectorResolver = new SelectorResolver();

    private final Document document = Jsoup.parse("""
        <html><body>
        <ul id="first"><li class="item">  one  </li><li class="item">two
           words</li></ul>
        <ul id="second"><li class="item">three</li></ul>
        <a id="link" href=" /next ">next</a>
        </body></html>
        """, "https://example.com/");

    @Test
    public void shouldSelectInDocumentOrder() {
        Elements items = selectorResolver.select(document, "li.item");

        assertThat(items).extracting(Element::text).containsExactly("one", "two words", "three");
    }

    @Test
    public void shouldScopeSelectionToElement() {
        Element second = document.getElementById("second");

        assertThat(selectorResolver.select(second, "li.item")).extracting(Element::text).containsExactly("three");
    }

    @Test
    public void shouldReturnEmptyForBlankOrMalformedSelector() {
        assertThat(selectorResolver.select(document, " ")).isEmpty();
        assertThat(selectorResolver.select(document, "li[")).isEmpty();
        assertThat(selectorResolver.select(null, "li")).isEmpty();
    }

    @Test
    public void shouldReadNormalizedText() {
        Element item = selectorResolver.select(document, "li.item").get(1);

        assertThat(selectorResolver.readText(item)).isEqualTo("two words");
        assertThat(selectorResolver.readText(null)).isEmpty();
    }

    @Test
    public void shouldReadTrimmedAttributeOrEmpty() {
        Element link = document.getElementById("link");

        assertThat(selectorResolver.readAttribute(link, "href")).contains("/next");
        assertThat(selectorResolver.readAttribute(link, "title")).isEmpty();
    }

    @Test
    public void shouldRejectMalformedSelectorOnValidation() {
        assertThatThrownBy(() -> selectorResolver.validate("div[class"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("malformed selector");
        assertThatThrownBy(() -> selectorResolver.validate(""))
            .isInstanceOf(ConfigException.class)
            .hasMessage("selector is blank");
    }

    @Test
    public void shouldAcceptValidSelector() {
        selectorResolver.validate("div.quote > span.text, a[href]");
    }

}
