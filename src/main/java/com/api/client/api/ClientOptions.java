package com.api.client.api;

import com.api.client.exception.ClientConstructionException;
import com.api.client.metrics.MetricsService;
import com.api.client.tracing.TracingService;
import com.api.client.transport.HttpTransport;
import com.api.client.transport.JdkHttpTransport;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Factory methods for the standard {@link ClientOption}s.
 *
 * <pre>
 * ApiClient client = ApiClient.create(
 *         ClientOptions.withApiKey("key", System.getenv("MAPS_API_KEY")),
 *         ClientOptions.withRateLimit(50));
 * </pre>
 */
public final class ClientOptions {

    private ClientOptions() {
    }

    /**
     * Sends requests through the given JDK HTTP client.
     */
    public static ClientOption withHttpClient(HttpClient httpClient) {
        return settings -> {
            if (httpClient == null) {
                throw new ClientConstructionException("httpClient must not be null");
            }
            settings.transport(new JdkHttpTransport(httpClient));
        };
    }

    /**
     * Sends requests through a custom transport. It is instrumented unless it already is.
     */
    public static ClientOption withTransport(HttpTransport transport) {
        return settings -> {
            if (transport == null) {
                throw new ClientConstructionException("transport must not be null");
            }
            settings.transport(transport);
        };
    }

    /**
     * Adds {@code name=value} to the query string of every request. An empty value disables it.
     */
    public static ClientOption withApiKey(String name, String value) {
        return settings -> {
            if (name == null || value == null) {
                throw new ClientConstructionException("API key name and value must not be null");
            }
            settings.apiKey(name, value);
        };
    }

    /**
     * Overrides the default limit of 10 requests per second.
     */
    public static ClientOption withRateLimit(int requestsPerSecond) {
        return settings -> {
            if (requestsPerSecond <= 0) {
                throw new ClientConstructionException(
                        "Rate limit must be a positive number of requests per second, got " + requestsPerSecond);
            }
            settings.requestsPerSecond(requestsPerSecond);
        };
    }

    /**
     * Sends every request to this host instead of {@link ApiConfig#host()}. Useful for proxies and tests.
     */
    public static ClientOption withBaseUrl(String baseUrl) {
        return settings -> {
            if (baseUrl == null) {
                throw new ClientConstructionException("baseUrl must not be null");
            }
            settings.baseUrl(baseUrl);
        };
    }

    public static ClientOption withRequestTimeout(Duration timeout) {
        return settings -> {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new ClientConstructionException("Request timeout must be positive, got " + timeout);
            }
            settings.requestTimeout(timeout);
        };
    }

    /**
     * Decodes JSON responses with the given mapper instead of the default one.
     */
    public static ClientOption withObjectMapper(ObjectMapper objectMapper) {
        return settings -> {
            if (objectMapper == null) {
                throw new ClientConstructionException("objectMapper must not be null");
            }
            settings.objectMapper(objectMapper);
        };
    }

    public static ClientOption withMetrics(MetricsService metricsService) {
        return settings -> {
            if (metricsService == null) {
                throw new ClientConstructionException("metricsService must not be null");
            }
            settings.metricsService(metricsService);
        };
    }

    public static ClientOption withTracing(TracingService tracingService) {
        return settings -> {
            if (tracingService == null) {
                throw new ClientConstructionException("tracingService must not be null");
            }
            settings.tracingService(tracingService);
        };
    }
}
