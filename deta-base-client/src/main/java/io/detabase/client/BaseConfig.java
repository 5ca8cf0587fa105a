package io.detabase.client;

import io.detabase.core.BaseException;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable connection settings captured when a client is built.
 *
 * @param projectKey the project key sent as {@code X-API-Key}
 * @param projectId the project id, part of every request path
 * @param host the API host, without scheme
 * @param baseName the name of the Base (collection) the client targets
 * @param timeout per-request timeout handed to the transport
 */
public record BaseConfig(String projectKey, String projectId, String host, String baseName, Duration timeout) {

    public static final String DEFAULT_HOST = "database.deta.sh";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    public BaseConfig {
        if (projectKey == null || projectKey.isBlank()) {
            throw new BaseException.InvalidArgument("parameter 'projectKey' must be a non-empty string");
        }
        if (baseName == null || baseName.isEmpty()) {
            throw new BaseException.InvalidArgument("parameter 'name' must be a non-empty string");
        }
        if (projectId == null || projectId.isEmpty()) {
            projectId = projectIdOf(projectKey);
        }
        if (host == null || host.isEmpty()) {
            host = DEFAULT_HOST;
        }
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new BaseException.InvalidArgument("timeout must be positive");
        }
    }

    /**
     * The project id is the part of the project key before the first underscore.
     */
    static String projectIdOf(String projectKey) {
        int i = projectKey.indexOf('_');
        return i < 0 ? projectKey : projectKey.substring(0, i);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "BaseConfig[projectId=" + projectId + ", host=" + host + ", baseName=" + baseName
                + ", timeout=" + timeout + "]";
    }

    public static final class Builder {
        private String projectKey;
        private String projectId;
        private String host;
        private String baseName;
        private Duration timeout;

        private Builder() {}

        public Builder projectKey(String projectKey) {
            this.projectKey = projectKey;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder baseName(String baseName) {
            this.baseName = baseName;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public BaseConfig build() {
            return new BaseConfig(projectKey, projectId, host, baseName, timeout);
        }
    }
}
