package io.detabase.client;

import io.detabase.core.Expiration;
import io.detabase.core.FetchResponse;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for one Deta Base.
 *
 * <p>Every call is a single blocking request. Local validation errors are raised as
 * {@link io.detabase.core.BaseException.InvalidArgument} before anything is sent; remote
 * failures surface as the other {@link io.detabase.core.BaseException} subtypes, and
 * I/O failures as {@link TransportException}.
 */
public interface BaseClient {

    /**
     * Retrieves an item.
     *
     * @throws io.detabase.core.BaseException.NotFound if the key does not exist
     */
    Map<String, Object> get(String key) throws TransportException;

    void delete(String key) throws TransportException;

    /**
     * Creates an item, failing if the key is already taken.
     *
     * @param data a mapping, or any other value stored as {@code {"value": data}}
     * @param key key to store under; when {@code null} the item's own key or a server-generated one is used
     * @param expiration when the item expires
     * @return the created item as stored by the server
     * @throws io.detabase.core.BaseException.AlreadyExists if the key is already taken
     */
    Map<String, Object> insert(Object data, String key, Expiration expiration) throws TransportException;

    /**
     * Stores an item, overwriting any item with the same key.
     *
     * @return the stored item, or empty when the server reports it did not process the item
     */
    Optional<Map<String, Object>> put(Object data, String key, Expiration expiration) throws TransportException;

    /**
     * Stores up to 25 items in one request. The server's per-item result is returned as is.
     */
    Map<String, Object> putMany(List<?> items, Expiration expiration) throws TransportException;

    /**
     * Applies a partial update. Values that are {@link io.detabase.core.UpdateOperation}s are
     * applied as operations; any other value replaces the attribute.
     *
     * @throws io.detabase.core.BaseException.NotFound if the key does not exist
     */
    void update(String key, Map<String, ?> updates, Expiration expiration) throws TransportException;

    /**
     * Fetches one page. Pass {@link FetchResponse#last()} back through {@link FetchRequest#after}
     * to read the next page.
     */
    FetchResponse fetch(FetchRequest request) throws TransportException;

    default Map<String, Object> insert(Object data) throws TransportException {
        return insert(data, null, Expiration.never());
    }

    default Map<String, Object> insert(Object data, String key) throws TransportException {
        return insert(data, key, Expiration.never());
    }

    default Optional<Map<String, Object>> put(Object data) throws TransportException {
        return put(data, null, Expiration.never());
    }

    default Optional<Map<String, Object>> put(Object data, String key) throws TransportException {
        return put(data, key, Expiration.never());
    }

    default Map<String, Object> putMany(List<?> items) throws TransportException {
        return putMany(items, Expiration.never());
    }

    default void update(String key, Map<String, ?> updates) throws TransportException {
        update(key, updates, Expiration.never());
    }

    default FetchResponse fetch() throws TransportException {
        return fetch(FetchRequest.all());
    }

    default FetchResponse fetch(Map<String, ?> query) throws TransportException {
        return fetch(FetchRequest.builder().query(query).build());
    }

    /**
     * Fetches every page matching {@code request}, starting at its cursor.
     */
    default List<Map<String, Object>> fetchAll(FetchRequest request) throws TransportException {
        return new FetchAllLoop(this, request).run();
    }

    default List<Map<String, Object>> fetchAll(Map<String, ?> query) throws TransportException {
        return fetchAll(FetchRequest.builder().query(query).build());
    }

    static BaseClient create(String projectKey, String baseName) {
        return builder().projectKey(projectKey).baseName(baseName).build();
    }

    static BaseClientBuilder builder() {
        return new BaseClientBuilder();
    }
}
