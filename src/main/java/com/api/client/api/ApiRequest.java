package com.api.client.api;

/**
 * Anything that can describe itself as query parameters.
 * Concrete request types of an embedding client implement only this.
 */
@FunctionalInterface
public interface ApiRequest {

    /**
     * Returns the query parameters for this request. The client copies them before adding
     * authentication, so implementations may return a shared instance.
     */
    QueryParams params();
}
