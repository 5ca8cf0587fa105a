package io.detabase.client;

import io.detabase.core.BaseException;
import io.detabase.core.Protocol;

import java.util.List;
import java.util.Map;

/**
 * Parameters of a single fetch call.
 *
 * @param query a filter mapping, a list of filter mappings (OR), or {@code null} for all items
 * @param limit maximum number of items in the page
 * @param last cursor returned by the previous page, or {@code null} for the first page
 */
public record FetchRequest(Object query, int limit, String last) {

    public FetchRequest {
        if (query != null && !(query instanceof Map) && !(query instanceof List)) {
            throw new BaseException.InvalidArgument("query must be a map or a list of maps");
        }
    }

    public static FetchRequest all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Same query and limit, continuing after {@code cursor}.
     */
    public FetchRequest after(String cursor) {
        return new FetchRequest(query, limit, cursor);
    }

    public static final class Builder {
        private Object query;
        private int limit = Protocol.DEFAULT_FETCH_LIMIT;
        private String last;

        private Builder() {}

        public Builder query(Map<String, ?> filter) {
            this.query = filter;
            return this;
        }

        public Builder queries(List<? extends Map<String, ?>> filters) {
            this.query = filters;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder last(String last) {
            this.last = last;
            return this;
        }

        public FetchRequest build() {
            return new FetchRequest(query, limit, last);
        }
    }
}
