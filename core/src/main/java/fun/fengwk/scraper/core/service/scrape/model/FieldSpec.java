package fun.fengwk.scraper.core.service.scrape.model;

/**
 * Extraction rule for one named field of an item block.
 *
 * @param selector  css selector evaluated inside the item block
 * @param attribute attribute to read, null means text content
 * @param multiple  collect every match instead of the first one
 * @author fengwk
 */
public record FieldSpec(String selector, String attribute, boolean multiple) {

    public boolean hasAttribute() {
        return attribute != null;
    }

}
