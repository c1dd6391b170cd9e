package fun.fengwk.scraper.core.service.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Value of one record field: a single string or an ordered list of strings.
 *
 * @author fengwk
 */
public record FieldValue(boolean multiple, List<String> values) {

    private static final FieldValue EMPTY_SINGLE = new FieldValue(false, List.of(""));

    public FieldValue {
        values = List.copyOf(values);
        if (!multiple && values.size() != 1) {
            throw new IllegalArgumentException("single field value must hold exactly one string");
        }
    }

    public static FieldValue single(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY_SINGLE;
        }
        return new FieldValue(false, List.of(value));
    }

    public static FieldValue multiple(List<String> values) {
        return new FieldValue(true, values);
    }

    /**
     * Single string form, multiple values are joined with the delimiter.
     */
    public String flatten(String delimiter) {
        return multiple ? String.join(delimiter, values) : values.get(0);
    }

    @JsonValue
    public Object toJsonValue() {
        return multiple ? values : values.get(0);
    }

}
