package io.detabase.core;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shapes caller data into item payloads for insert, put and put_many.
 */
public final class Items {
    private Items() {}

    /**
     * Copies a mapping into a new item, or wraps any other value as {@code {"value": data}}.
     * The caller's mapping is never modified.
     */
    public static Map<String, Object> wrap(Object data) {
        Map<String, Object> item = new LinkedHashMap<>();
        if (data instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) data).entrySet()) {
                item.put(String.valueOf(e.getKey()), e.getValue());
            }
        } else {
            item.put(Protocol.F_VALUE, data);
        }
        return item;
    }

    /**
     * Builds the item sent to the server: wrapped data, explicit key if non-empty, expiration attribute.
     *
     * @param data a mapping or a single value
     * @param key key overriding any key in {@code data}, ignored when {@code null} or empty
     * @param expiration requested expiration
     * @param clock clock used for relative expirations
     * @return a new item
     */
    public static Map<String, Object> prepare(Object data, String key, Expiration expiration, Clock clock) {
        Map<String, Object> item = wrap(data);
        if (key != null && !key.isEmpty()) {
            item.put(Protocol.F_KEY, key);
        }
        TtlNormalizer.apply(item, Protocol.TTL_ATTRIBUTE, expiration, clock);
        return item;
    }

    /**
     * Returns the item's {@code key} attribute as a string, or {@code null} if absent.
     */
    public static String keyOf(Map<String, ?> item) {
        Object key = item == null ? null : item.get(Protocol.F_KEY);
        return key == null ? null : key.toString();
    }
}
