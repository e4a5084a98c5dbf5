package com.api.client.tracing;

/**
 * Trace span covering one outbound HTTP exchange.
 * Implements {@link AutoCloseable} so it can be ended by try-with-resources.
 *
 * <pre>
 * try (RequestSpan span = tracingService.startRequestSpan("GET", uri)) {
 *     HttpResponse&lt;InputStream&gt; response = delegate.send(request, context);
 *     span.recordResponse(response.statusCode());
 * }
 * </pre>
 */
public interface RequestSpan extends AutoCloseable {

    void recordResponse(int statusCode);

    void recordFailure(Throwable failure);

    @Override
    void close();
}
