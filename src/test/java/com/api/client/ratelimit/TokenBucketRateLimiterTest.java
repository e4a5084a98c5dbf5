package com.api.client.ratelimit;

import com.api.client.context.RequestContext;
import com.api.client.exception.RequestCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {

    private TokenBucketRateLimiter limiter;

    @AfterEach
    void tearDown() {
        if (limiter != null) {
            limiter.close();
        }
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Should reject zero requests per second")
        void rejectsZero() {
            assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(0));
        }

        @Test
        @DisplayName("Should reject negative requests per second")
        void rejectsNegative() {
            assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(-5));
        }

        @Test
        @DisplayName("Bucket starts full with capacity equal to the rate")
        void startsFull() {
            limiter = new TokenBucketRateLimiter(7);
            assertEquals(7, limiter.capacity());
            assertEquals(7, limiter.availableTokens());
        }

        @Test
        @DisplayName("Refill never exceeds capacity")
        void refillCappedAtCapacity() {
            limiter = new TokenBucketRateLimiter(3);
            for (int i = 0; i < 5; i++) {
                limiter.refill();
            }
            assertEquals(3, limiter.availableTokens());

            limiter.acquire(RequestContext.background());
            assertEquals(2, limiter.availableTokens());
            limiter.refill();
            limiter.refill();
            assertEquals(3, limiter.availableTokens());
        }
    }

    @Nested
    @DisplayName("Burst and steady rate")
    class RateTests {

        @Test
        @DisplayName("First N acquisitions proceed without waiting")
        void burstWithoutDelay() {
            limiter = new TokenBucketRateLimiter(20);

            long start = System.nanoTime();
            for (int i = 0; i < 20; i++) {
                limiter.acquire(RequestContext.background());
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMs < 500, "burst should not wait, took " + elapsedMs + "ms");
            assertEquals(0, limiter.availableTokens());
        }

        @Test
        @DisplayName("Concurrent burst of N callers all acquire immediately")
        void concurrentBurst() throws Exception {
            int rate = 16;
            limiter = new TokenBucketRateLimiter(rate);
            ExecutorService executor = Executors.newFixedThreadPool(rate);
            CountDownLatch startLatch = new CountDownLatch(1);
            AtomicInteger acquired = new AtomicInteger();

            try {
                for (int i = 0; i < rate; i++) {
                    executor.submit(() -> {
                        startLatch.await();
                        limiter.acquire(RequestContext.withTimeout(Duration.ofMillis(500)));
                        acquired.incrementAndGet();
                        return null;
                    });
                }
                startLatch.countDown();
                executor.shutdown();
                assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(rate, acquired.get());
        }

        @Test
        @DisplayName("After the burst, acquisitions are spaced by 1/N seconds")
        void steadyRateAfterBurst() {
            int rate = 10;
            limiter = new TokenBucketRateLimiter(rate);

            long start = System.nanoTime();
            for (int i = 0; i < 3 * rate; i++) {
                limiter.acquire(RequestContext.background());
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            // 10 immediate, then one second of drain, then 20 tokens at 100ms each
            assertTrue(elapsedMs >= 2_500, "30 acquisitions at 10/s should take ~2.9s, took " + elapsedMs + "ms");
            assertTrue(elapsedMs < 6_000, "refill stalled, took " + elapsedMs + "ms");
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("Cancelled context consumes no token")
        void cancelledBeforeAcquire() {
            limiter = new TokenBucketRateLimiter(2);
            RequestContext ctx = RequestContext.withCancel();
            ctx.cancel();

            RequestCancelledException e = assertThrows(RequestCancelledException.class, () -> limiter.acquire(ctx));
            assertEquals(RequestCancelledException.Reason.CANCELLED, e.getReason());
            assertEquals(2, limiter.availableTokens());

            limiter.acquire(RequestContext.background());
            limiter.acquire(RequestContext.background());
            assertEquals(0, limiter.availableTokens());
        }

        @Test
        @DisplayName("Expired deadline aborts the wait for a token")
        void deadlineWhileWaiting() {
            limiter = new TokenBucketRateLimiter(1);
            limiter.acquire(RequestContext.background());

            long start = System.nanoTime();
            RequestCancelledException e = assertThrows(RequestCancelledException.class,
                    () -> limiter.acquire(RequestContext.withTimeout(Duration.ofMillis(100))));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(RequestCancelledException.Reason.DEADLINE_EXCEEDED, e.getReason());
            assertTrue(elapsedMs < 900, "should give up before the next refill, took " + elapsedMs + "ms");
        }

        @Test
        @DisplayName("Cancel from another thread releases a blocked waiter")
        void cancelFromAnotherThread() throws Exception {
            limiter = new TokenBucketRateLimiter(1);
            limiter.acquire(RequestContext.background());
            RequestContext ctx = RequestContext.withCancel();
            ExecutorService executor = Executors.newSingleThreadExecutor();

            try {
                Future<?> waiter = executor.submit(() -> limiter.acquire(ctx));
                Thread.sleep(50);
                assertFalse(waiter.isDone());

                ctx.cancel();

                ExecutionException e = assertThrows(ExecutionException.class,
                        () -> waiter.get(500, TimeUnit.MILLISECONDS));
                assertInstanceOf(RequestCancelledException.class, e.getCause());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Interrupt while waiting is reported as cancellation")
        void interruptIsCancellation() throws Exception {
            limiter = new TokenBucketRateLimiter(1);
            limiter.acquire(RequestContext.background());
            AtomicReference<Throwable> failure = new AtomicReference<>();
            AtomicReference<Boolean> interruptFlag = new AtomicReference<>();

            Thread waiter = new Thread(() -> {
                try {
                    limiter.acquire(RequestContext.background());
                } catch (Throwable t) {
                    failure.set(t);
                    interruptFlag.set(Thread.currentThread().isInterrupted());
                }
            });
            waiter.start();
            Thread.sleep(50);
            waiter.interrupt();
            waiter.join(1_000);

            assertInstanceOf(RequestCancelledException.class, failure.get());
            assertTrue(interruptFlag.get());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Close is idempotent and rejects further acquisitions")
        void closeRejectsAcquire() {
            limiter = new TokenBucketRateLimiter(5);
            limiter.close();
            limiter.close();

            assertTrue(limiter.isClosed());
            assertThrows(IllegalStateException.class, () -> limiter.acquire(RequestContext.background()));
        }

        @Test
        @DisplayName("Closed limiter stops refilling")
        void closeStopsRefill() throws Exception {
            limiter = new TokenBucketRateLimiter(50);
            for (int i = 0; i < 50; i++) {
                limiter.acquire(RequestContext.background());
            }
            limiter.close();

            Thread.sleep(1_300);
            assertEquals(0, limiter.availableTokens());
        }
    }
}
