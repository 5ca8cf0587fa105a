package io.detabase.client;

/**
 * Exception thrown when a request cannot be carried out at the transport level
 * (connection failure, timeout, interruption, undecodable body).
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
