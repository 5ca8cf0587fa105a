package io.detabase.client;

import io.detabase.json.jackson.JacksonJsonCodec;
import io.detabase.json.spi.JsonCodec;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Builder for {@link BaseClient}.
 *
 * <p>Allows configuring the connection settings and the transport layer (JDK HttpClient or custom).
 */
public final class BaseClientBuilder {
    private final BaseConfig.Builder config = BaseConfig.builder();
    private BaseTransport transport;
    private HttpClient httpClient;
    private JsonCodec json;
    private Clock clock;

    public BaseClientBuilder projectKey(String projectKey) {
        config.projectKey(projectKey);
        return this;
    }

    public BaseClientBuilder projectId(String projectId) {
        config.projectId(projectId);
        return this;
    }

    public BaseClientBuilder host(String host) {
        config.host(host);
        return this;
    }

    public BaseClientBuilder baseName(String baseName) {
        config.baseName(baseName);
        return this;
    }

    public BaseClientBuilder timeout(Duration timeout) {
        config.timeout(timeout);
        return this;
    }

    /**
     * Sets a custom transport implementation. The JDK HttpClient and codec settings are then ignored.
     *
     * @param transport the transport to use
     * @return this builder
     */
    public BaseClientBuilder transport(BaseTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    /**
     * Uses the default JDK HttpClient transport with a provided HttpClient instance.
     *
     * @param httpClient the JDK HttpClient to use
     * @return this builder
     */
    public BaseClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    public BaseClientBuilder jsonCodec(JsonCodec json) {
        this.json = Objects.requireNonNull(json, "json");
        return this;
    }

    /**
     * Clock used to resolve relative expirations. Defaults to the system UTC clock.
     */
    public BaseClientBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Builds the client.
     *
     * <p>If no transport is configured, a JDK HttpClient transport with a Jackson codec is created.
     *
     * @return the new client instance
     */
    public BaseClient build() {
        BaseConfig resolvedConfig = config.build();
        BaseTransport resolved = transport;
        if (resolved == null) {
            resolved = new JdkHttpTransport(
                    httpClient == null ? HttpClient.newHttpClient() : httpClient,
                    resolvedConfig,
                    json == null ? new JacksonJsonCodec() : json);
        }
        return new DefaultBaseClient(resolvedConfig, resolved, clock == null ? Clock.systemUTC() : clock);
    }
}
