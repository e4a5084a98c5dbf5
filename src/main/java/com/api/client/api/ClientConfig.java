package com.api.client.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable scalar configuration of an {@link ApiClient}, materialised from its options.
 *
 * @param requestsPerSecond maximum request start rate, also the burst size
 * @param apiKeyName        name of the query parameter carrying the API key
 * @param apiKeyValue       API key; empty means no key is injected
 * @param baseUrl           host override applied to every request; empty means use {@link ApiConfig#host()}
 * @param requestTimeout    per-request HTTP timeout, or {@code null} for none
 */
public record ClientConfig(
        int requestsPerSecond,
        String apiKeyName,
        String apiKeyValue,
        String baseUrl,
        Duration requestTimeout
) {

    public static final int DEFAULT_REQUESTS_PER_SECOND = 10;

    public ClientConfig {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0, got " + requestsPerSecond);
        }
        Objects.requireNonNull(apiKeyName, "apiKeyName must not be null");
        Objects.requireNonNull(apiKeyValue, "apiKeyValue must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        if (!apiKeyValue.isEmpty() && apiKeyName.isBlank()) {
            throw new IllegalArgumentException("apiKeyName must not be blank when an API key is set");
        }
        if (requestTimeout != null && (requestTimeout.isZero() || requestTimeout.isNegative())) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    /**
     * Default configuration: 10 requests/second, no API key, no base URL, no request timeout.
     */
    public static ClientConfig defaults() {
        return new ClientConfig(DEFAULT_REQUESTS_PER_SECOND, "", "", "", null);
    }

    public boolean hasApiKey() {
        return !apiKeyValue.isEmpty();
    }

    public boolean hasBaseUrl() {
        return !baseUrl.isEmpty();
    }

    @Override
    public String toString() {
        return "ClientConfig{" +
                "requestsPerSecond=" + requestsPerSecond +
                ", apiKeyName='" + apiKeyName + '\'' +
                ", apiKeyValue='" + maskKey(apiKeyValue) + '\'' +
                ", baseUrl='" + baseUrl + '\'' +
                ", requestTimeout=" + requestTimeout +
                '}';
    }

    static String maskKey(String key) {
        if (key.isEmpty()) return "";
        if (key.length() <= 8) return "****";
        return key.substring(0, 4) + "****";
    }
}
