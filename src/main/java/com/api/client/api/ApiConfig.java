package com.api.client.api;

import java.util.Objects;

/**
 * Identifies the endpoint a request is sent to. Supplied by the embedding client per call.
 *
 * @param host scheme and authority, e.g. {@code https://maps.example.com}; may be empty when the
 *             client has a base URL override
 * @param path path appended to the host, e.g. {@code /geocode/json}
 */
public record ApiConfig(String host, String path) {

    public ApiConfig {
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
