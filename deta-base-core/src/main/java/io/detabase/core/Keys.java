package io.detabase.core;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Key validation and path encoding.
 */
public final class Keys {
    private Keys() {}

    public static String requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new BaseException.InvalidArgument("parameter 'key' must be a non-empty string");
        }
        return key;
    }

    /**
     * Percent-encodes a key as a single path segment. No character is left unescaped
     * apart from unreserved ones, so {@code /} becomes {@code %2F} and a space {@code %20}.
     */
    public static String encode(String key) {
        // form encoding differs from path encoding on these three
        return URLEncoder.encode(key, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    public static String itemPath(String key) {
        return Protocol.PATH_ITEMS + "/" + encode(requireKey(key));
    }
}
