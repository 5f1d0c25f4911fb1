package io.github.drompincen.polarionclient.client;

import io.github.drompincen.polarionclient.runtime.retry.RetryPolicy;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable client settings. Use {@link #builder(String, String)}.
 *
 * @param baseUrl        REST root, e.g. {@code https://host/polarion/rest/v1}, without trailing slash
 * @param batchSize      max work items per create request
 * @param pageSize       default page size of queries
 * @param maxContentSize max request body size in bytes
 */
public record ClientConfig(
        String baseUrl,
        String bearerToken,
        int batchSize,
        int pageSize,
        int maxContentSize,
        RetryPolicy retryPolicy,
        Duration requestTimeout,
        Duration connectTimeout,
        OversizedItemPolicy oversizedItemPolicy
) {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int DEFAULT_MAX_CONTENT_SIZE = 2 * 1024 * 1024;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public ClientConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(bearerToken, "bearerToken");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(oversizedItemPolicy, "oversizedItemPolicy");
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        URI parsed = URI.create(baseUrl);
        if (parsed.getScheme() == null || parsed.getHost() == null) {
            throw new IllegalArgumentException("baseUrl must be an absolute http(s) URL: " + baseUrl);
        }
        if (bearerToken.isBlank()) {
            throw new IllegalArgumentException("bearerToken must not be blank");
        }
        requirePositive("batchSize", batchSize);
        requirePositive("pageSize", pageSize);
        requirePositive("maxContentSize", maxContentSize);
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static Builder builder(String baseUrl, String bearerToken) {
        return new Builder(baseUrl, bearerToken);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    @Override
    public String toString() {
        return "ClientConfig{baseUrl=" + baseUrl + ", batchSize=" + batchSize + ", pageSize=" + pageSize
                + ", maxContentSize=" + maxContentSize + ", retryPolicy=" + retryPolicy.maxRetries() + " retries"
                + ", requestTimeout=" + requestTimeout + ", oversizedItemPolicy=" + oversizedItemPolicy + '}';
    }

    public static final class Builder {
        private final String baseUrl;
        private final String bearerToken;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private int maxContentSize = DEFAULT_MAX_CONTENT_SIZE;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private OversizedItemPolicy oversizedItemPolicy = OversizedItemPolicy.SKIP_AND_REPORT;

        private Builder(String baseUrl, String bearerToken) {
            this.baseUrl = baseUrl;
            this.bearerToken = bearerToken;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder maxContentSize(int maxContentSize) {
            this.maxContentSize = maxContentSize;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.retryPolicy = retryPolicy.withMaxRetries(maxRetries);
            return this;
        }

        public Builder retryWaits(Duration min, Duration max) {
            this.retryPolicy = retryPolicy.withWaits(min, max);
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder oversizedItemPolicy(OversizedItemPolicy policy) {
            this.oversizedItemPolicy = policy;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(baseUrl, bearerToken, batchSize, pageSize, maxContentSize,
                    retryPolicy, requestTimeout, connectTimeout, oversizedItemPolicy);
        }
    }
}
