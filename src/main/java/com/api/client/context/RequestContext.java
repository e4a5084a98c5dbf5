package com.api.client.context;

import com.api.client.exception.RequestCancelledException;
import com.api.client.exception.RequestCancelledException.Reason;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-call cancellation signal carried through token acquisition and the HTTP exchange.
 *
 * <p>A context is done once it is cancelled, its deadline passes, or its parent is done.
 * Once done it stays done, and {@link #error()} describes why.</p>
 *
 * <pre>
 * RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(5));
 * Place place = client.getJson(ctx, config, request, Place.class);
 * </pre>
 *
 * <p>Instances are safe to share between threads.</p>
 */
public final class RequestContext {

    private static final RequestContext BACKGROUND = new RequestContext();

    private final long deadlineNanos;
    private final boolean hasDeadline;
    private final boolean cancellable;
    private final CompletableFuture<Reason> done = new CompletableFuture<>();

    private RequestContext() {
        this.deadlineNanos = 0;
        this.hasDeadline = false;
        this.cancellable = false;
    }

    private RequestContext(RequestContext parent, Duration timeout) {
        this.cancellable = true;
        if (timeout != null) {
            long ownDeadline = System.nanoTime() + Math.max(0, timeout.toNanos());
            if (parent.hasDeadline && parent.deadlineNanos - ownDeadline < 0) {
                ownDeadline = parent.deadlineNanos;
            }
            this.deadlineNanos = ownDeadline;
            this.hasDeadline = true;
        } else {
            this.deadlineNanos = parent.deadlineNanos;
            this.hasDeadline = parent.hasDeadline;
        }

        if (parent.cancellable) {
            parent.done.thenAccept(done::complete);
        }
        if (hasDeadline) {
            done.completeOnTimeout(Reason.DEADLINE_EXCEEDED, Math.max(0, remainingNanos()), TimeUnit.NANOSECONDS);
        }
    }

    /**
     * Returns the root context. It is never cancelled and has no deadline.
     */
    public static RequestContext background() {
        return BACKGROUND;
    }

    /**
     * Creates a context that is done only when {@link #cancel()} is called.
     */
    public static RequestContext withCancel() {
        return BACKGROUND.child();
    }

    /**
     * Creates a context that expires after the given timeout, or earlier if cancelled.
     */
    public static RequestContext withTimeout(Duration timeout) {
        return BACKGROUND.childWithTimeout(timeout);
    }

    /**
     * Creates a context that expires at the given instant, or earlier if cancelled.
     */
    public static RequestContext withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline must not be null");
        return BACKGROUND.childWithTimeout(Duration.between(Instant.now(), deadline));
    }

    /**
     * Derives a cancellable child of this context.
     */
    public RequestContext child() {
        return new RequestContext(this, null);
    }

    /**
     * Derives a child of this context with its own timeout. The child never outlives this context.
     */
    public RequestContext childWithTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        return new RequestContext(this, timeout);
    }

    /**
     * Cancels this context and every context derived from it. Has no effect if already done.
     *
     * @throws UnsupportedOperationException on the background context
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("The background context cannot be cancelled");
        }
        done.complete(Reason.CANCELLED);
    }

    public boolean isDone() {
        if (done.isDone()) {
            return true;
        }
        if (hasDeadline && remainingNanos() <= 0) {
            done.complete(Reason.DEADLINE_EXCEEDED);
            return true;
        }
        return false;
    }

    /**
     * Returns a fresh exception describing why this context is done, or {@code null} while it is live.
     */
    public RequestCancelledException error() {
        if (!isDone()) {
            return null;
        }
        return new RequestCancelledException(done.join());
    }

    /**
     * Throws {@link #error()} if this context is already done.
     */
    public void throwIfDone() {
        RequestCancelledException error = error();
        if (error != null) {
            throw error;
        }
    }

    /**
     * Nanoseconds until the deadline, {@link Long#MAX_VALUE} when there is none.
     */
    public long remainingNanos() {
        if (!hasDeadline) {
            return Long.MAX_VALUE;
        }
        return deadlineNanos - System.nanoTime();
    }

    public boolean hasDeadline() {
        return hasDeadline;
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "RequestContext{background}";
        }
        return "RequestContext{done=" + isDone()
                + (hasDeadline ? ", remainingMs=" + TimeUnit.NANOSECONDS.toMillis(remainingNanos()) : "")
                + '}';
    }
}
