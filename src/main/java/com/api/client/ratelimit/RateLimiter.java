package com.api.client.ratelimit;

import com.api.client.context.RequestContext;

/**
 * Bounds how many outbound requests may be started per second.
 * Implementations must be safe for concurrent use without external locking.
 */
public interface RateLimiter extends AutoCloseable {

    /**
     * Blocks until a token is available and consumes it.
     * A context that is already done at entry consumes nothing.
     *
     * @param context cancellation signal for the wait
     * @throws com.api.client.exception.RequestCancelledException if the context ends first
     */
    void acquire(RequestContext context);

    /**
     * Number of tokens that can be consumed right now without waiting.
     */
    int availableTokens();

    /**
     * Stops any background refill. Further {@link #acquire} calls fail.
     */
    @Override
    void close();
}
