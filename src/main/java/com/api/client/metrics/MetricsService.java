package com.api.client.metrics;

import java.time.Duration;

/**
 * Interface for recording API client metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the client works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    /** Outcome tag values for {@link #recordRequestDuration}. */
    String OUTCOME_SUCCESS = "success";
    String OUTCOME_CANCELLED = "cancelled";
    String OUTCOME_TRANSPORT_ERROR = "transport_error";

    /** Stage tag values for {@link #incrementCancelled}. */
    String STAGE_ACQUIRE = "acquire";
    String STAGE_TRANSPORT = "transport";

    void recordRequestDuration(String path, String outcome, Duration duration);

    void recordRateLimitWait(Duration wait);

    void incrementCancelled(String stage);

    void incrementDecodeFailure(String path);
}
