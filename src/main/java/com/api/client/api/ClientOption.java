package com.api.client.api;

/**
 * A configuration step applied to {@link ClientSettings} while {@link ApiClient#create} runs.
 * Options are applied in the order given; the first one to throw aborts construction.
 *
 * @see ClientOptions
 */
@FunctionalInterface
public interface ClientOption {

    void apply(ClientSettings settings);
}
