package com.api.client.ratelimit;

import com.api.client.context.RequestContext;
import com.api.client.exception.RequestCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bursty token bucket backed by a bounded {@link ArrayBlockingQueue}.
 *
 * <p>The bucket starts full, so up to {@code requestsPerSecond} requests may start at once.
 * A single daemon thread waits one second for that burst to drain and then adds one token
 * every {@code 1s / requestsPerSecond}. Tokens offered to a full bucket are dropped.</p>
 *
 * <p>The queue is the only synchronization point: any number of threads may call
 * {@link #acquire(RequestContext)} concurrently. No FIFO ordering is promised between waiters.</p>
 */
public class TokenBucketRateLimiter implements RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private static final Object TOKEN = new Object();
    private static final long ONE_SECOND_NANOS = TimeUnit.SECONDS.toNanos(1);
    // Upper bound on how long a waiter goes without re-checking its context
    private static final long CANCELLATION_CHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(10);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final int requestsPerSecond;
    private final BlockingQueue<Object> tokens;
    private final ScheduledExecutorService refillScheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TokenBucketRateLimiter(int requestsPerSecond) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0, got " + requestsPerSecond);
        }
        this.requestsPerSecond = requestsPerSecond;
        this.tokens = new ArrayBlockingQueue<>(requestsPerSecond);
        for (int i = 0; i < requestsPerSecond; i++) {
            tokens.add(TOKEN);
        }

        long refillPeriodNanos = Math.max(1, ONE_SECOND_NANOS / requestsPerSecond);
        this.refillScheduler = Executors.newSingleThreadScheduledExecutor(refillThreadFactory());
        refillScheduler.scheduleAtFixedRate(this::refill,
                ONE_SECOND_NANOS + refillPeriodNanos, refillPeriodNanos, TimeUnit.NANOSECONDS);

        log.info("Token bucket initialized: {} requests/second, refill every {}us",
                requestsPerSecond, TimeUnit.NANOSECONDS.toMicros(refillPeriodNanos));
    }

    @Override
    public void acquire(RequestContext context) {
        Objects.requireNonNull(context, "context must not be null");
        ensureOpen();
        context.throwIfDone();

        try {
            while (true) {
                long waitNanos = Math.max(0, Math.min(CANCELLATION_CHECK_NANOS, context.remainingNanos()));
                if (tokens.poll(waitNanos, TimeUnit.NANOSECONDS) != null) {
                    return;
                }
                context.throwIfDone();
                ensureOpen();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(RequestCancelledException.Reason.CANCELLED, e);
        }
    }

    @Override
    public int availableTokens() {
        return tokens.size();
    }

    public int capacity() {
        return requestsPerSecond;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            refillScheduler.shutdownNow();
            log.debug("Token bucket closed ({} requests/second)", requestsPerSecond);
        }
    }

    /**
     * Adds one token unless the bucket is already full.
     */
    void refill() {
        tokens.offer(TOKEN);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Rate limiter is closed");
        }
    }

    private static ThreadFactory refillThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "api-client-token-refill-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public String toString() {
        return "TokenBucketRateLimiter{" +
                "requestsPerSecond=" + requestsPerSecond +
                ", availableTokens=" + tokens.size() +
                ", closed=" + closed.get() +
                '}';
    }
}
