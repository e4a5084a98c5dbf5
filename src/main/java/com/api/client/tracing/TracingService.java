package com.api.client.tracing;

import java.net.URI;

/**
 * Interface for distributed tracing of outbound requests.
 * The default {@link NoOpTracingService} does nothing, so the client works
 * without any tracing dependencies on the classpath.
 */
public interface TracingService {

    /**
     * Starts a client span for a request. Implementations must not record the query string,
     * which may carry the API key.
     */
    RequestSpan startRequestSpan(String method, URI target);
}
