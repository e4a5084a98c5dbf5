package com.api.client.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRequestDuration(String path, String outcome, Duration duration) {
    }

    @Override
    public void recordRateLimitWait(Duration wait) {
    }

    @Override
    public void incrementCancelled(String stage) {
    }

    @Override
    public void incrementDecodeFailure(String path) {
    }
}
