package com.ioms.inventoryservice.query;

import com.ioms.inventoryservice.query.filter.FilterValues;
import lombok.Builder;
import lombok.Getter;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Raw parameters of a related-entity query, grouped by purpose.
 */
@Getter
@Builder
public class RelatedQueryRequest {

    private static final Pattern BRACKETED = Pattern.compile("^(filter|fields)\\[([^\\]]+)]$");

    private final List<String> joins;
    /** Entity name to comma-separated clauses. */
    private final Map<String, String> filters;
    /** Lower-case entity name to projected field names, in request order. */
    private final Map<String, List<String>> fields;
    private final String ordering;
    private final boolean distinct;
    /** Null when absent or not a non-negative integer. */
    private final Integer limit;

    public static RelatedQueryRequest fromParameters(Map<String, String> params) {
        MultiValueMap<String, String> multi = new LinkedMultiValueMap<>();
        multi.setAll(params);
        return fromParameters(multi);
    }

    /**
     * Repeated list parameters ({@code join}, {@code filter[..]}, {@code fields[..]}, {@code ordering})
     * are joined with commas in request order; {@code distinct} and {@code limit} take their first value.
     */
    public static RelatedQueryRequest fromParameters(MultiValueMap<String, String> params) {
        List<String> joins = new ArrayList<>();
        Map<String, String> filters = new LinkedHashMap<>();
        Map<String, List<String>> fields = new LinkedHashMap<>();

        for (Map.Entry<String, List<String>> param : params.entrySet()) {
            String value = joinValues(param.getValue());
            Matcher matcher = BRACKETED.matcher(param.getKey());
            if (param.getKey().equals("join")) {
                splitList(value).forEach(joins::add);
            } else if (matcher.matches()) {
                String entity = matcher.group(2).trim();
                if (matcher.group(1).equals("filter")) {
                    filters.merge(entity, value, (earlier, later) -> earlier + "," + later);
                } else {
                    fields.merge(entity.toLowerCase(Locale.ROOT), splitList(value), RelatedQueryRequest::concat);
                }
            }
        }

        return RelatedQueryRequest.builder()
                .joins(joins)
                .filters(filters)
                .fields(fields)
                .ordering(params.containsKey("ordering") ? joinValues(params.get("ordering")) : null)
                .distinct("true".equalsIgnoreCase(firstValue(params, "distinct", "").trim()))
                .limit(parseLimit(firstValue(params, "limit", null)))
                .build();
    }

    private static String joinValues(List<String> values) {
        if (values == null) {
            return "";
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .collect(Collectors.joining(","));
    }

    private static String firstValue(MultiValueMap<String, String> params, String name, String fallback) {
        String value = params.getFirst(name);
        return value == null ? fallback : value;
    }

    private static List<String> concat(List<String> earlier, List<String> later) {
        List<String> all = new ArrayList<>(earlier);
        all.addAll(later);
        return all;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .toList();
    }

    private static Integer parseLimit(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (!FilterValues.isDigits(trimmed) || trimmed.length() > 9) {
            return null;
        }
        return Integer.valueOf(trimmed);
    }
}
