package com.api.client.api;

import com.api.client.metrics.MetricsService;
import com.api.client.metrics.NoOpMetricsService;
import com.api.client.tracing.NoOpTracingService;
import com.api.client.tracing.TracingService;
import com.api.client.transport.HttpTransport;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;

/**
 * Mutable state that {@link ClientOption}s write to while an {@link ApiClient} is being built.
 * Later writes replace earlier ones.
 */
public class ClientSettings {

    private int requestsPerSecond = ClientConfig.DEFAULT_REQUESTS_PER_SECOND;
    private String apiKeyName = "";
    private String apiKeyValue = "";
    private String baseUrl = "";
    private Duration requestTimeout;
    private HttpTransport transport;
    private ObjectMapper objectMapper;
    private MetricsService metricsService = new NoOpMetricsService();
    private TracingService tracingService = new NoOpTracingService();

    ClientSettings() {
    }

    public ClientSettings requestsPerSecond(int requestsPerSecond) {
        this.requestsPerSecond = requestsPerSecond;
        return this;
    }

    public ClientSettings apiKey(String name, String value) {
        this.apiKeyName = name;
        this.apiKeyValue = value;
        return this;
    }

    public ClientSettings baseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
        return this;
    }

    public ClientSettings requestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public ClientSettings transport(HttpTransport transport) {
        this.transport = transport;
        return this;
    }

    public ClientSettings objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    public ClientSettings metricsService(MetricsService metricsService) {
        this.metricsService = metricsService;
        return this;
    }

    public ClientSettings tracingService(TracingService tracingService) {
        this.tracingService = tracingService;
        return this;
    }

    public int getRequestsPerSecond() { return requestsPerSecond; }
    public String getApiKeyName() { return apiKeyName; }
    public String getApiKeyValue() { return apiKeyValue; }
    public String getBaseUrl() { return baseUrl; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public HttpTransport getTransport() { return transport; }
    public ObjectMapper getObjectMapper() { return objectMapper; }
    public MetricsService getMetricsService() { return metricsService; }
    public TracingService getTracingService() { return tracingService; }

    /**
     * Validates the scalar settings.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    ClientConfig toConfig() {
        return new ClientConfig(requestsPerSecond, apiKeyName, apiKeyValue, baseUrl, requestTimeout);
    }
}
