package io.detabase.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One page of fetch results.
 *
 * <p>{@link #last()} holds the cursor to pass to the next fetch; it is empty on the last page.
 */
public final class FetchResponse implements Iterable<Map<String, Object>> {

    private final int count;
    private final String last;
    private final List<Map<String, Object>> items;

    public FetchResponse(int count, String last, List<Map<String, Object>> items) {
        this.count = count;
        this.last = last;
        this.items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    /**
     * Decodes the {@code POST /query} response body.
     *
     * <p>{@code paging.size} becomes the count, {@code paging.last} the cursor and
     * {@code items} the page (empty if absent). Entries that are not objects are skipped.
     *
     * @param body the decoded JSON body
     * @return the page
     */
    public static FetchResponse decode(Object body) {
        Map<?, ?> root = body instanceof Map ? (Map<?, ?>) body : Map.of();
        Map<?, ?> paging = root.get(Protocol.Q_PAGING) instanceof Map
                ? (Map<?, ?>) root.get(Protocol.Q_PAGING)
                : Map.of();

        Object size = paging.get(Protocol.Q_SIZE);
        int count = size instanceof Number ? ((Number) size).intValue() : 0;
        String last = FetchPayload.cursor(paging.get(Protocol.Q_LAST));

        List<Map<String, Object>> items = new ArrayList<>();
        Object raw = root.get(Protocol.F_ITEMS);
        if (raw instanceof List) {
            for (Object o : (List<?>) raw) {
                if (o instanceof Map) {
                    items.add(Items.wrap(o));
                }
            }
        }
        return new FetchResponse(count, last, items);
    }

    public int count() {
        return count;
    }

    public Optional<String> last() {
        return Optional.ofNullable(last);
    }

    public boolean hasMore() {
        return last != null;
    }

    public List<Map<String, Object>> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    @Override
    public Iterator<Map<String, Object>> iterator() {
        return items.iterator();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof FetchResponse)) return false;
        FetchResponse o = (FetchResponse) other;
        return count == o.count && Objects.equals(last, o.last) && items.equals(o.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, last, items);
    }

    @Override
    public String toString() {
        return "FetchResponse{count=" + count + ", last=" + last + ", items=" + items.size() + "}";
    }
}
