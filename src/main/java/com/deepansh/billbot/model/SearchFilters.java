package com.deepansh.billbot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filters understood by the search tools. Bill-only and executive-action-only
 * fields live side by side; {@link #forContentType} picks the applicable ones.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SearchFilters {

    // bills
    private String chamber;
    private List<String> status;
    private Integer congress;
    private List<String> sponsor;
    private String committee;
    private List<String> topics;

    private DateRange dateRange;

    // executive actions
    private String actionType;
    private String administration;
    private List<String> agencies;

    public static SearchFilters empty() {
        return new SearchFilters();
    }

    /** Tool argument map restricted to the fields the given tool accepts. */
    public Map<String, Object> forContentType(ContentType type) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (type == ContentType.BILL) {
            putIfPresent(out, "chamber", chamber);
            putIfPresent(out, "status", status);
            putIfPresent(out, "congress", congress);
            putIfPresent(out, "sponsor", sponsor);
            putIfPresent(out, "committee", committee);
            putIfPresent(out, "topics", topics);
        } else {
            putIfPresent(out, "actionType", actionType);
            putIfPresent(out, "administration", administration);
            // executive action tool takes a single status
            if (status != null && !status.isEmpty()) out.put("status", status.get(0));
            putIfPresent(out, "agencies", agencies);
        }
        if (dateRange != null) {
            Map<String, Object> range = new LinkedHashMap<>();
            putIfPresent(range, "start", dateRange.getStart());
            putIfPresent(range, "end", dateRange.getEnd());
            if (!range.isEmpty()) out.put("dateRange", range);
        }
        return out;
    }

    public boolean isEmpty() {
        return chamber == null && isBlank(status) && congress == null && isBlank(sponsor)
                && committee == null && isBlank(topics) && dateRange == null
                && actionType == null && administration == null && isBlank(agencies);
    }

    private static boolean isBlank(List<?> list) {
        return list == null || list.isEmpty();
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value == null) return;
        if (value instanceof List<?> l && l.isEmpty()) return;
        if (value instanceof String s && s.isBlank()) return;
        map.put(key, value);
    }
}
