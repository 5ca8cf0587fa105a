package io.detabase.client;

/**
 * Performs one signed HTTP call against the Base API and returns the status with the decoded body.
 *
 * <p>Implementations own URL resolution, headers, credentials, JSON encoding and timeouts.
 * They must be thread-safe. Status codes are not interpreted here: every response that
 * arrives is returned.
 */
public interface BaseTransport {
    TransportResponse request(TransportRequest request) throws TransportException;
}
