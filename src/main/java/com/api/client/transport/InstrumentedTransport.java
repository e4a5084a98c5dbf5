package com.api.client.transport;

import com.api.client.context.RequestContext;
import com.api.client.exception.RequestCancelledException;
import com.api.client.exception.TransportException;
import com.api.client.metrics.MetricsService;
import com.api.client.tracing.RequestSpan;
import com.api.client.tracing.TracingService;

import java.io.InputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Decorates another transport with request timing and tracing. Responses and failures pass
 * through unchanged.
 */
public final class InstrumentedTransport implements HttpTransport {

    private final HttpTransport delegate;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private InstrumentedTransport(HttpTransport delegate, MetricsService metricsService,
                                  TracingService tracingService) {
        this.delegate = delegate;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    /**
     * Wraps the transport unless it is already instrumented, in which case it is returned as is.
     */
    public static HttpTransport wrap(HttpTransport transport, MetricsService metricsService,
                                     TracingService tracingService) {
        Objects.requireNonNull(transport, "transport must not be null");
        if (transport instanceof InstrumentedTransport) {
            return transport;
        }
        return new InstrumentedTransport(transport,
                Objects.requireNonNull(metricsService, "metricsService must not be null"),
                Objects.requireNonNull(tracingService, "tracingService must not be null"));
    }

    @Override
    public HttpResponse<InputStream> send(HttpRequest request, RequestContext context) {
        String path = request.uri().getPath() == null || request.uri().getPath().isEmpty()
                ? "/" : request.uri().getPath();
        long start = System.nanoTime();
        try (RequestSpan span = tracingService.startRequestSpan(request.method(), request.uri())) {
            try {
                HttpResponse<InputStream> response = delegate.send(request, context);
                span.recordResponse(response.statusCode());
                record(path, MetricsService.OUTCOME_SUCCESS, start);
                return response;
            } catch (RequestCancelledException e) {
                span.recordFailure(e);
                record(path, MetricsService.OUTCOME_CANCELLED, start);
                metricsService.incrementCancelled(MetricsService.STAGE_TRANSPORT);
                throw e;
            } catch (TransportException e) {
                span.recordFailure(e);
                record(path, MetricsService.OUTCOME_TRANSPORT_ERROR, start);
                throw e;
            }
        }
    }

    HttpTransport delegate() {
        return delegate;
    }

    private void record(String path, String outcome, long startNanos) {
        metricsService.recordRequestDuration(path, outcome, Duration.ofNanos(System.nanoTime() - startNanos));
    }
}
