package io.detabase.json.spi;

/**
 * Base exception for JSON encoding and decoding errors.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
