package fun.fengwk.scraper.core.service.scrape.parser;

import fun.fengwk.scraper.core.service.scrape.model.FieldSpec;
import fun.fengwk.scraper.core.service.scrape.model.FieldValue;
import fun.fengwk.scraper.core.service.scrape.model.ScrapedRecord;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps one item block to a record.
 *
 * <p>Missing data degrades to an empty value: a field whose selector matches nothing becomes {@code ""},
 * or {@code []} for a multi-valued field. An attribute absent on a matched element reads as {@code ""}.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class FieldExtractor {

    private final SelectorResolver selectorResolver;

    public ScrapedRecord extract(Element item, Map<String, FieldSpec> fields) {
        Map<String, FieldValue> values = new LinkedHashMap<>();
        for (Map.Entry<String, FieldSpec> entry : fields.entrySet()) {
            values.put(entry.getKey(), extractField(item, entry.getValue()));
        }
        return new ScrapedRecord(values);
    }

    FieldValue extractField(Element item, FieldSpec spec) {
        Elements matched = selectorResolver.select(item, spec.selector());
        if (spec.multiple()) {
            List<String> values = new ArrayList<>(matched.size());
            for (Element element : matched) {
                values.add(read(element, spec));
            }
            return FieldValue.multiple(values);
        }
        return matched.isEmpty() ? FieldValue.single("") : FieldValue.single(read(matched.first(), spec));
    }

    private String read(Element element, FieldSpec spec) {
        if (spec.hasAttribute()) {
            return selectorResolver.readAttribute(element, spec.attribute()).orElse("");
        }
        return selectorResolver.readText(element);
    }

}
