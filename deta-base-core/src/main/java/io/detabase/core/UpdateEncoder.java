package io.detabase.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sorts an update mapping into the five buckets of the PATCH payload.
 *
 * <p>Output shape: {@code {"set": {}, "increment": {}, "append": {}, "prepend": {}, "delete": []}}.
 * All five fields are always present.
 */
public final class UpdateEncoder {
    private UpdateEncoder() {}

    public static Map<String, Object> encode(Map<String, ?> updates, Expiration expiration, Clock clock) {
        Map<String, Object> set = new LinkedHashMap<>();
        Map<String, Object> increment = new LinkedHashMap<>();
        Map<String, Object> append = new LinkedHashMap<>();
        Map<String, Object> prepend = new LinkedHashMap<>();
        List<String> delete = new ArrayList<>();

        if (updates != null) {
            for (Map.Entry<String, ?> e : updates.entrySet()) {
                String attr = e.getKey();
                Object value = e.getValue();
                if (!(value instanceof UpdateOperation)) {
                    set.put(attr, value);
                    continue;
                }
                UpdateOperation op = (UpdateOperation) value;
                switch (op.kind()) {
                    case TRIM:
                        delete.add(attr);
                        break;
                    case INCREMENT:
                        increment.put(attr, ((UpdateOperation.Increment) op).delta());
                        break;
                    case APPEND:
                        append.put(attr, ((UpdateOperation.Append) op).values());
                        break;
                    case PREPEND:
                        prepend.put(attr, ((UpdateOperation.Prepend) op).values());
                        break;
                    default:
                        throw new IllegalStateException("unhandled update operation: " + op.kind());
                }
            }
        }

        TtlNormalizer.apply(set, Protocol.TTL_ATTRIBUTE, expiration, clock);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(Protocol.U_SET, set);
        payload.put(Protocol.U_INCREMENT, increment);
        payload.put(Protocol.U_APPEND, append);
        payload.put(Protocol.U_PREPEND, prepend);
        payload.put(Protocol.U_DELETE, delete);
        return payload;
    }
}
