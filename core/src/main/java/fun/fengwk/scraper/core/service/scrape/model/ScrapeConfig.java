package fun.fengwk.scraper.core.service.scrape.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable description of one scrape run.
 *
 * @author fengwk
 */
public record ScrapeConfig(
    String startUrl,
    String itemSelector,
    Map<String, FieldSpec> fields,
    PaginationSpec pagination,
    Duration delay
) {

    public ScrapeConfig {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        delay = delay == null ? Duration.ZERO : delay;
    }

    public boolean hasPagination() {
        return pagination != null;
    }

    /**
     * Page bound of the run, a config without pagination always fetches a single page.
     */
    public int maxPages() {
        return pagination == null ? 1 : pagination.maxPages();
    }

    /**
     * Field names in declaration order.
     */
    public List<String> fieldNames() {
        return Collections.unmodifiableList(new ArrayList<>(fields.keySet()));
    }

}
