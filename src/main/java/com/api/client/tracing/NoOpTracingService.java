package com.api.client.tracing;

import java.net.URI;

/**
 * No-op implementation of {@link TracingService}. Always hands out the same inert span.
 */
public class NoOpTracingService implements TracingService {

    private static final RequestSpan NO_OP_SPAN = new NoOpRequestSpan();

    @Override
    public RequestSpan startRequestSpan(String method, URI target) {
        return NO_OP_SPAN;
    }

    private static class NoOpRequestSpan implements RequestSpan {
        @Override
        public void recordResponse(int statusCode) {
        }

        @Override
        public void recordFailure(Throwable failure) {
        }

        @Override
        public void close() {
        }
    }
}
