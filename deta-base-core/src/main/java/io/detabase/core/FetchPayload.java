package io.detabase.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@code POST /query} payload.
 *
 * <p>Shape: {@code {"limit": n, "last": cursor|null, "query": [filter, ...]}}; the
 * {@code query} field is omitted when no filter is given.
 */
public final class FetchPayload {
    private FetchPayload() {}

    /**
     * Builds the payload for one page.
     *
     * @param query a filter mapping, a list of filter mappings, or {@code null}
     * @param limit maximum page size
     * @param last continuation cursor; anything but a string (a boolean, typically) counts as absent
     * @return the payload
     */
    public static Map<String, Object> encode(Object query, int limit, Object last) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(Protocol.Q_LIMIT, limit);
        payload.put(Protocol.Q_LAST, cursor(last));

        List<Object> filters = filters(query);
        if (!filters.isEmpty()) {
            payload.put(Protocol.Q_QUERY, filters);
        }
        return payload;
    }

    static String cursor(Object last) {
        return last instanceof String ? (String) last : null;
    }

    static List<Object> filters(Object query) {
        if (query == null) return List.of();
        if (query instanceof Collection) {
            return new ArrayList<>((Collection<?>) query);
        }
        if (query instanceof Map && ((Map<?, ?>) query).isEmpty()) {
            return List.of();
        }
        List<Object> single = new ArrayList<>(1);
        single.add(query);
        return single;
    }
}
