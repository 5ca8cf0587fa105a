package io.detabase.core;

/**
 * Base class for Deta Base client errors.
 *
 * <p>Local validation failures are raised before any request is sent. Remote failures
 * carry enough of the server answer (key, status, decoded body) for diagnostics.
 */
public abstract class BaseException extends RuntimeException {

    protected BaseException(String message) {
        super(message);
    }

    protected BaseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised locally when an argument is rejected: empty key, conflicting expiration,
     * oversized batch or an unsupported expiration type.
     */
    public static class InvalidArgument extends BaseException {
        public InvalidArgument(String message) {
            super(message);
        }
    }

    /**
     * Raised when the server reports that a key does not exist.
     */
    public static class NotFound extends BaseException {
        private final String key;

        public NotFound(String key) {
            super("key '" + key + "' not found");
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    /**
     * Raised when an insert targets a key that is already stored.
     */
    public static class AlreadyExists extends BaseException {
        private final String key;

        public AlreadyExists(String key) {
            super("item with key '" + key + "' already exists");
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    /**
     * Raised for any other unexpected status code, or for a success status whose body
     * does not have the expected shape.
     */
    public static class RequestFailure extends BaseException {
        private final int status;
        private final transient Object body;

        public RequestFailure(String operation, int status, Object body) {
            this(status, body, operation + " failed with status " + status + (body == null ? "" : ": " + body));
        }

        private RequestFailure(int status, Object body, String message) {
            super(message);
            this.status = status;
            this.body = body;
        }

        public static RequestFailure unexpectedBody(String operation, int status, Object body) {
            String shape = body == null ? "no body" : body.getClass().getSimpleName() + " body: " + body;
            return new RequestFailure(status, body, operation + " returned status " + status + " with " + shape);
        }

        public int status() {
            return status;
        }

        /**
         * Decoded error body as returned by the transport, possibly {@code null}.
         *
         * @return the error body
         */
        public Object body() {
            return body;
        }
    }
}
