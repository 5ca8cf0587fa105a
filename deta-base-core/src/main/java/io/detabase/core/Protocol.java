package io.detabase.core;

/**
 * Deta Base protocol constants (paths, payload field names and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings. It only models the
 * wire-level concerns shared by the client and its transports.
 */
public final class Protocol {
    private Protocol() {}

    // Paths
    public static final String PATH_ITEMS = "/items";
    public static final String PATH_QUERY = "/query";

    // HTTP methods
    public static final String GET = "GET";
    public static final String PUT = "PUT";
    public static final String POST = "POST";
    public static final String PATCH = "PATCH";
    public static final String DELETE = "DELETE";

    // HTTP headers
    public static final String H_API_KEY = "X-API-Key";
    public static final String H_CONTENT_TYPE = "Content-Type";

    // Content types
    public static final String CT_JSON = "application/json";

    // Item fields
    public static final String F_KEY = "key";
    public static final String F_VALUE = "value";
    public static final String F_ITEM = "item";
    public static final String F_ITEMS = "items";
    public static final String F_PROCESSED = "processed";

    // Update payload buckets, in wire order
    public static final String U_SET = "set";
    public static final String U_INCREMENT = "increment";
    public static final String U_APPEND = "append";
    public static final String U_PREPEND = "prepend";
    public static final String U_DELETE = "delete";

    // Query payload / response fields
    public static final String Q_LIMIT = "limit";
    public static final String Q_LAST = "last";
    public static final String Q_QUERY = "query";
    public static final String Q_PAGING = "paging";
    public static final String Q_SIZE = "size";

    /** Reserved attribute holding the item expiration in epoch seconds. */
    public static final String TTL_ATTRIBUTE = "__expires";

    /** Maximum number of items accepted by a single put_many call. */
    public static final int MAX_PUT_MANY = 25;

    /** Default page size for fetch. */
    public static final int DEFAULT_FETCH_LIMIT = 1000;

    // Status codes the client interprets
    public static final int STATUS_OK = 200;
    public static final int STATUS_CREATED = 201;
    public static final int STATUS_MULTI_STATUS = 207;
    public static final int STATUS_NOT_FOUND = 404;
    public static final int STATUS_CONFLICT = 409;

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
