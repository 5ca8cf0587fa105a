package io.detabase.client;

import io.detabase.core.Protocol;
import io.detabase.json.spi.JsonCodec;
import io.detabase.json.spi.JsonException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Transport implementation using {@link java.net.http.HttpClient}.
 *
 * <p>Requests go to {@code https://{host}/v1/{projectId}/{baseName}{path}} with the project key
 * in {@code X-API-Key}. JSON responses are decoded through the {@link JsonCodec}; other
 * non-empty bodies are returned as strings.
 */
public final class JdkHttpTransport implements BaseTransport {
    private final HttpClient http;
    private final BaseConfig config;
    private final JsonCodec json;
    private final String root;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     * @param config connection settings
     * @param json codec for request and response bodies
     */
    public JdkHttpTransport(HttpClient http, BaseConfig config, JsonCodec json) {
        this(http, config, json, "https://" + config.host());
    }

    /**
     * Creates a transport against an explicit scheme and authority, e.g. {@code http://localhost:8080}.
     */
    JdkHttpTransport(HttpClient http, BaseConfig config, JsonCodec json, String origin) {
        this.http = Objects.requireNonNull(http, "http");
        this.config = Objects.requireNonNull(config, "config");
        this.json = Objects.requireNonNull(json, "json");
        this.root = origin + "/v1/" + config.projectId() + "/" + config.baseName();
    }

    @Override
    public TransportResponse request(TransportRequest request) throws TransportException {
        HttpRequest req = buildRequest(request);
        HttpResponse<byte[]> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new TransportException(request.method() + " " + request.path() + " timed out after " + config.timeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request interrupted", e);
        } catch (IOException e) {
            throw new TransportException(request.method() + " " + request.path() + " failed", e);
        }

        String contentType = resp.headers().firstValue(Protocol.H_CONTENT_TYPE).orElse("");
        return new TransportResponse(resp.statusCode(), decodeBody(resp.body(), contentType));
    }

    private HttpRequest buildRequest(TransportRequest request) throws TransportException {
        HttpRequest.BodyPublisher body = HttpRequest.BodyPublishers.noBody();
        if (request.body() != null) {
            try {
                body = HttpRequest.BodyPublishers.ofByteArray(json.encode(request.body()));
            } catch (JsonException e) {
                throw new TransportException("Failed to encode body of " + request.method() + " " + request.path(), e);
            }
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(root + request.path()))
                .method(request.method(), body)
                .timeout(config.timeout())
                .header(Protocol.H_API_KEY, config.projectKey());

        if (request.body() != null) {
            String contentType = request.contentType() == null ? Protocol.CT_JSON : request.contentType();
            builder.header(Protocol.H_CONTENT_TYPE, contentType);
        }
        return builder.build();
    }

    private Object decodeBody(byte[] body, String contentType) throws TransportException {
        if (body == null || body.length == 0) {
            return null;
        }
        if (contentType.toLowerCase(Locale.ROOT).startsWith(Protocol.CT_JSON)) {
            try {
                return json.decode(body);
            } catch (JsonException e) {
                throw new TransportException("Failed to decode response body", e);
            }
        }
        return new String(body, StandardCharsets.UTF_8);
    }
}
