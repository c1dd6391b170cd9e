package fun.fengwk.scraper.core.service.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One extracted item, field order follows the config declaration order.
 *
 * @author fengwk
 */
public record ScrapedRecord(Map<String, FieldValue> values) {

    public ScrapedRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public FieldValue get(String fieldName) {
        return values.get(fieldName);
    }

    public Set<String> fieldNames() {
        return values.keySet();
    }

    @JsonValue
    public Map<String, FieldValue> toJsonValue() {
        return values;
    }

}
