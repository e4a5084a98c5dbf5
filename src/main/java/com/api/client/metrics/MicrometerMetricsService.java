package com.api.client.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code apiclient.request.duration} - Timer (tags: path, outcome)</li>
 *   <li>{@code apiclient.ratelimit.wait} - Timer, time spent waiting for a token</li>
 *   <li>{@code apiclient.request.cancelled} - Counter (tag: stage)</li>
 *   <li>{@code apiclient.decode.failure} - Counter (tag: path)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer rateLimitWaitTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.rateLimitWaitTimer = Timer.builder("apiclient.ratelimit.wait")
                .description("Time spent waiting for a rate limit token")
                .register(registry);
    }

    @Override
    public void recordRequestDuration(String path, String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(path + ":" + outcome, k ->
                Timer.builder("apiclient.request.duration")
                        .description("Duration of outbound GET requests")
                        .tag("path", path)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRateLimitWait(Duration wait) {
        rateLimitWaitTimer.record(wait);
    }

    @Override
    public void incrementCancelled(String stage) {
        counterCache.computeIfAbsent("cancelled:" + stage, k ->
                Counter.builder("apiclient.request.cancelled")
                        .description("Requests abandoned because their context ended")
                        .tag("stage", stage)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementDecodeFailure(String path) {
        counterCache.computeIfAbsent("decode:" + path, k ->
                Counter.builder("apiclient.decode.failure")
                        .description("Responses whose JSON body could not be decoded")
                        .tag("path", path)
                        .register(registry))
                .increment();
    }
}
