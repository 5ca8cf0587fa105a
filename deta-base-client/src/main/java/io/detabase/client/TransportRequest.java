package io.detabase.client;

import java.util.Objects;

/**
 * A request handed to a {@link BaseTransport}.
 *
 * @param method the HTTP method
 * @param path path relative to the Base root, e.g. {@code /items/abc}
 * @param body the payload tree to encode, or {@code null}
 * @param contentType content type of the body, or {@code null} when there is none
 */
public record TransportRequest(String method, String path, Object body, String contentType) {
    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
    }
}
