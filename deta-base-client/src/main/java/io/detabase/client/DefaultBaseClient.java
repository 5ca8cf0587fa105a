package io.detabase.client;

import io.detabase.core.BaseException;
import io.detabase.core.Expiration;
import io.detabase.core.FetchPayload;
import io.detabase.core.FetchResponse;
import io.detabase.core.Items;
import io.detabase.core.Keys;
import io.detabase.core.Protocol;
import io.detabase.core.UpdateEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link BaseClient} that shapes payloads locally and delegates each call to a {@link BaseTransport}.
 */
public final class DefaultBaseClient implements BaseClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultBaseClient.class);

    private final BaseConfig config;
    private final BaseTransport transport;
    private final Clock clock;

    public DefaultBaseClient(BaseConfig config, BaseTransport transport, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BaseConfig config() {
        return config;
    }

    @Override
    public Map<String, Object> get(String key) throws TransportException {
        TransportResponse resp = send(Protocol.GET, Keys.itemPath(key), null);
        if (resp.status() == Protocol.STATUS_NOT_FOUND) {
            throw new BaseException.NotFound(key);
        }
        requireSuccess("get", resp);
        return requireObject("get", resp);
    }

    @Override
    public void delete(String key) throws TransportException {
        TransportResponse resp = send(Protocol.DELETE, Keys.itemPath(key), null);
        requireSuccess("delete", resp);
    }

    @Override
    public Map<String, Object> insert(Object data, String key, Expiration expiration) throws TransportException {
        Map<String, Object> item = Items.prepare(data, key, expiration, clock);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(Protocol.F_ITEM, item);

        TransportResponse resp = send(Protocol.POST, Protocol.PATH_ITEMS, payload);
        if (resp.status() == Protocol.STATUS_CONFLICT) {
            throw new BaseException.AlreadyExists(key != null && !key.isEmpty() ? key : Items.keyOf(item));
        }
        requireSuccess("insert", resp);
        return requireObject("insert", resp);
    }

    @Override
    public Optional<Map<String, Object>> put(Object data, String key, Expiration expiration) throws TransportException {
        Map<String, Object> item = Items.prepare(data, key, expiration, clock);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(Protocol.F_ITEMS, List.of(item));

        TransportResponse resp = send(Protocol.PUT, Protocol.PATH_ITEMS, payload);
        requireSuccess("put", resp);
        if (resp.status() != Protocol.STATUS_MULTI_STATUS) {
            return Optional.empty();
        }
        Optional<Map<String, Object>> stored = firstProcessed(resp.body());
        if (stored.isEmpty()) {
            log.debug("put of key '{}' was not processed by the server", Items.keyOf(item));
        }
        return stored;
    }

    @Override
    public Map<String, Object> putMany(List<?> items, Expiration expiration) throws TransportException {
        Objects.requireNonNull(items, "items");
        if (items.size() > Protocol.MAX_PUT_MANY) {
            throw new BaseException.InvalidArgument(
                    "cannot put more than " + Protocol.MAX_PUT_MANY + " items at a time, got " + items.size());
        }

        List<Map<String, Object>> batch = new ArrayList<>(items.size());
        for (Object item : items) {
            batch.add(Items.prepare(item, null, expiration, clock));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(Protocol.F_ITEMS, batch);

        TransportResponse resp = send(Protocol.PUT, Protocol.PATH_ITEMS, payload);
        requireSuccess("put_many", resp);
        return requireObject("put_many", resp);
    }

    @Override
    public void update(String key, Map<String, ?> updates, Expiration expiration) throws TransportException {
        String path = Keys.itemPath(key);
        Map<String, Object> payload = UpdateEncoder.encode(updates, expiration, clock);

        TransportResponse resp = send(Protocol.PATCH, path, payload);
        if (resp.status() == Protocol.STATUS_NOT_FOUND) {
            throw new BaseException.NotFound(key);
        }
        requireSuccess("update", resp);
    }

    @Override
    public FetchResponse fetch(FetchRequest request) throws TransportException {
        Objects.requireNonNull(request, "request");
        Map<String, Object> payload = FetchPayload.encode(request.query(), request.limit(), request.last());

        TransportResponse resp = send(Protocol.POST, Protocol.PATH_QUERY, payload);
        requireSuccess("fetch", resp);
        return FetchResponse.decode(resp.body());
    }

    private TransportResponse send(String method, String path, Object body) throws TransportException {
        String contentType = body == null ? null : Protocol.CT_JSON;
        TransportResponse resp = transport.request(new TransportRequest(method, path, body, contentType));
        log.debug("{} {}{} -> {}", method, config.baseName(), path, resp.status());
        return resp;
    }

    private static void requireSuccess(String operation, TransportResponse resp) {
        if (!Protocol.isSuccess(resp.status())) {
            log.warn("{} failed with status {}", operation, resp.status());
            throw new BaseException.RequestFailure(operation, resp.status(), resp.body());
        }
    }

    /**
     * Returns the decoded body of a successful response, which must be a JSON object.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> requireObject(String operation, TransportResponse resp) {
        if (resp.body() instanceof Map) {
            return (Map<String, Object>) resp.body();
        }
        log.warn("{} returned status {} without an object body", operation, resp.status());
        throw BaseException.RequestFailure.unexpectedBody(operation, resp.status(), resp.body());
    }

    private static Optional<Map<String, Object>> firstProcessed(Object body) {
        Map<String, Object> root = asMap(body);
        Map<String, Object> processed = asMap(root.get(Protocol.F_PROCESSED));
        Object items = processed.get(Protocol.F_ITEMS);
        if (items instanceof List && !((List<?>) items).isEmpty()) {
            Object first = ((List<?>) items).get(0);
            if (first instanceof Map) {
                return Optional.of(asMap(first));
            }
        }
        return Optional.empty();
    }

    // Navigates optional parts of a put response; absent or malformed parts read as empty.
    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object body) {
        if (body instanceof Map) {
            return (Map<String, Object>) body;
        }
        return Map.of();
    }
}
