package com.api.client.tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.net.URI;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Spans are named after the HTTP method and carry the semantic-convention attributes
 * {@code http.request.method}, {@code server.address}, {@code url.full} (without query)
 * and {@code http.response.status_code}. Status codes of 400 and above mark the span as an error.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public RequestSpan startRequestSpan(String method, URI target) {
        Span span = tracer.spanBuilder(method)
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute("http.request.method", method)
                .setAttribute("server.address", String.valueOf(target.getHost()))
                .setAttribute("url.full", withoutQuery(target))
                .startSpan();
        return new OTelRequestSpan(span);
    }

    static String withoutQuery(URI target) {
        String full = target.toString();
        int queryStart = full.indexOf('?');
        return queryStart < 0 ? full : full.substring(0, queryStart);
    }

    private static class OTelRequestSpan implements RequestSpan {

        private final Span span;

        OTelRequestSpan(Span span) {
            this.span = span;
        }

        @Override
        public void recordResponse(int statusCode) {
            span.setAttribute("http.response.status_code", statusCode);
            if (statusCode >= 400) {
                span.setStatus(StatusCode.ERROR);
            }
        }

        @Override
        public void recordFailure(Throwable failure) {
            span.recordException(failure);
            span.setStatus(StatusCode.ERROR, failure.getClass().getSimpleName());
        }

        @Override
        public void close() {
            span.end();
        }
    }
}
