package io.detabase.client;

/**
 * A decoded transport response.
 *
 * @param status the HTTP status code
 * @param body the decoded body: a map, list, scalar, string, or {@code null} when empty
 */
public record TransportResponse(int status, Object body) {}
