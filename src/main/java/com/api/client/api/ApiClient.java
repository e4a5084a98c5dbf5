package com.api.client.api;

import com.api.client.context.RequestContext;
import com.api.client.exception.ApiClientException;
import com.api.client.exception.ClientConstructionException;
import com.api.client.exception.RequestCancelledException;
import com.api.client.exception.ResponseDecodeException;
import com.api.client.exception.TransportException;
import com.api.client.logging.LogContext;
import com.api.client.metrics.MetricsService;
import com.api.client.ratelimit.RateLimiter;
import com.api.client.ratelimit.TokenBucketRateLimiter;
import com.api.client.transport.HttpTransport;
import com.api.client.transport.InstrumentedTransport;
import com.api.client.transport.JdkHttpTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rate-limited GET client meant to be embedded in a concrete API client.
 *
 * <p>Any number of threads may call {@link #getJson} and {@link #getBinary} at once. Every call
 * first takes a token from the client's {@link TokenBucketRateLimiter}, so at most
 * {@code requestsPerSecond} requests start per second after an initial burst of the same size.
 * Waiting for a token and the HTTP exchange both end early when the caller's
 * {@link RequestContext} is cancelled or expires.</p>
 *
 * <pre>
 * public class GeocodingClient implements AutoCloseable {
 *     private static final ApiConfig GEOCODE = new ApiConfig("https://maps.example.com", "/geocode/json");
 *     private final ApiClient apiClient;
 *
 *     public GeocodingClient(String apiKey) {
 *         this.apiClient = ApiClient.create(ClientOptions.withApiKey("key", apiKey));
 *     }
 *
 *     public GeocodeResult geocode(RequestContext ctx, GeocodeRequest request) {
 *         return apiClient.getJson(ctx, GEOCODE, request, GeocodeResult.class);
 *     }
 *
 *     public void close() {
 *         apiClient.close();
 *     }
 * }
 * </pre>
 *
 * <p>A client owns one background refill thread; {@link #close()} stops it.</p>
 */
public class ApiClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ApiClient.class);

    private final ClientConfig config;
    private final HttpTransport transport;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ApiClient(ClientConfig config, ClientSettings settings) {
        this.config = config;
        this.metricsService = settings.getMetricsService();
        this.transport = InstrumentedTransport.wrap(settings.getTransport(),
                settings.getMetricsService(), settings.getTracingService());
        this.objectMapper = settings.getObjectMapper() != null
                ? settings.getObjectMapper() : defaultObjectMapper();
        this.rateLimiter = new TokenBucketRateLimiter(config.requestsPerSecond());

        log.info("ApiClient initialized: {}", config);
    }

    /**
     * Builds a client from the given options, applied in order after the defaults.
     *
     * @throws ClientConstructionException if any option fails or the resulting configuration is invalid
     */
    public static ApiClient create(ClientOption... options) {
        ClientSettings settings = new ClientSettings();
        if (options != null) {
            for (ClientOption option : options) {
                apply(option, settings);
            }
        }

        ClientConfig config;
        try {
            config = settings.toConfig();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ClientConstructionException("Invalid client configuration: " + e.getMessage(), e);
        }
        if (settings.getTransport() == null) {
            settings.transport(JdkHttpTransport.createDefault());
        }
        if (settings.getMetricsService() == null || settings.getTracingService() == null) {
            throw new ClientConstructionException("metricsService and tracingService must not be null");
        }
        return new ApiClient(config, settings);
    }

    private static void apply(ClientOption option, ClientSettings settings) {
        if (option == null) {
            throw new ClientConstructionException("Client option must not be null");
        }
        try {
            option.apply(settings);
        } catch (ClientConstructionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ClientConstructionException("Client option failed: " + e.getMessage(), e);
        }
    }

    /**
     * Sends a rate-limited GET and decodes the JSON body into a new instance of {@code type}.
     * The body is closed before this method returns. The HTTP status code is not inspected.
     *
     * @throws RequestCancelledException if the context ends before the response arrives
     * @throws TransportException        on network failure
     * @throws ResponseDecodeException   if the body is not JSON or does not fit {@code type}
     */
    public <T> T getJson(RequestContext context, ApiConfig apiConfig, ApiRequest apiRequest, Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return dispatchAndDecode(context, apiConfig, apiRequest, body -> objectMapper.readValue(body, type));
    }

    /**
     * Same as {@link #getJson(RequestContext, ApiConfig, ApiRequest, Class)} for generic targets.
     */
    public <T> T getJson(RequestContext context, ApiConfig apiConfig, ApiRequest apiRequest,
                         TypeReference<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return dispatchAndDecode(context, apiConfig, apiRequest, body -> objectMapper.readValue(body, type));
    }

    /**
     * Decodes the JSON body into an existing caller-owned object, overwriting the properties
     * present in the response.
     */
    public void getJsonInto(RequestContext context, ApiConfig apiConfig, ApiRequest apiRequest, Object target) {
        Objects.requireNonNull(target, "target must not be null");
        dispatchAndDecode(context, apiConfig, apiRequest, body -> objectMapper.readerForUpdating(target).<Object>readValue(body));
    }

    /**
     * Sends a rate-limited GET and returns the response with its body still open.
     * The caller must close the returned {@link BinaryResponse}.
     *
     * @throws RequestCancelledException if the context ends before the response arrives
     * @throws TransportException        on network failure
     */
    public BinaryResponse getBinary(RequestContext context, ApiConfig apiConfig, ApiRequest apiRequest) {
        HttpResponse<InputStream> response = get(context, apiConfig, apiRequest);
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        return new BinaryResponse(response.statusCode(), contentType, response.body());
    }

    private <T> T dispatchAndDecode(RequestContext context, ApiConfig apiConfig, ApiRequest apiRequest,
                                    BodyDecoder<T> decoder) {
        HttpResponse<InputStream> response = get(context, apiConfig, apiRequest);
        try (InputStream body = response.body()) {
            return decoder.decode(body);
        } catch (JsonProcessingException e) {
            metricsService.incrementDecodeFailure(apiConfig.path());
            throw new ResponseDecodeException("Failed to decode JSON response from " + apiConfig.path()
                    + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TransportException("Failed to read response body from " + apiConfig.path(), e);
        }
    }

    /**
     * Takes a token, then sends an authenticated GET to {@code host + path}.
     * A context that is already done consumes no token. A consumed token is never returned,
     * even if the request later fails.
     */
    HttpResponse<InputStream> get(RequestContext context, ApiConfig apiConfig, ApiRequest apiRequest) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(apiConfig, "apiConfig must not be null");
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        ensureOpen();

        try (LogContext logContext = LogContext.forRequest(LogContext.generateCorrelationId(), apiConfig.path())) {
            acquireToken(context);

            String host = config.hasBaseUrl() ? config.baseUrl() : apiConfig.host();
            HttpRequest request = buildRequest(host, apiConfig.path(), authenticatedQuery(apiRequest.params()));
            log.debug("request.dispatch host={} path={}", host, apiConfig.path());
            return transport.send(request, context);
        }
    }

    /**
     * Copies the request parameters, sets the API key when one is configured, and form-encodes the result.
     */
    String authenticatedQuery(QueryParams params) {
        QueryParams query = params != null ? params.copy() : new QueryParams();
        if (config.hasApiKey()) {
            query.set(config.apiKeyName(), config.apiKeyValue());
        }
        return query.encode();
    }

    private void acquireToken(RequestContext context) {
        long start = System.nanoTime();
        try {
            rateLimiter.acquire(context);
        } catch (RequestCancelledException e) {
            metricsService.incrementCancelled(MetricsService.STAGE_ACQUIRE);
            log.debug("request.cancelled stage=acquire reason={}", e.getReason());
            throw e;
        }
        metricsService.recordRateLimitWait(Duration.ofNanos(System.nanoTime() - start));
    }

    private HttpRequest buildRequest(String host, String path, String query) {
        String url = query.isEmpty() ? host + path : host + path + "?" + query;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url)).GET();
            if (config.requestTimeout() != null) {
                builder.timeout(config.requestTimeout());
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ApiClientException("Invalid request URL: " + host + path, e);
        }
    }

    public ClientConfig config() {
        return config;
    }

    RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops the rate limiter's refill thread. Calls made after closing fail with {@link IllegalStateException}.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            rateLimiter.close();
            log.info("ApiClient closed");
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("ApiClient is closed");
        }
    }

    private static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @FunctionalInterface
    private interface BodyDecoder<T> {
        T decode(InputStream body) throws IOException;
    }
}
