package com.api.client.api;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Raw response of a binary GET. The caller owns {@code data} and must close it,
 * either directly or by closing this response.
 *
 * <pre>
 * try (BinaryResponse photo = client.getBinary(ctx, config, request)) {
 *     byte[] bytes = photo.data().readAllBytes();
 * }
 * </pre>
 *
 * @param statusCode  HTTP status code
 * @param contentType value of the {@code Content-Type} header, empty when absent
 * @param data        open response body stream
 */
public record BinaryResponse(int statusCode, String contentType, InputStream data) implements Closeable {

    public BinaryResponse {
        Objects.requireNonNull(contentType, "contentType must not be null");
        Objects.requireNonNull(data, "data must not be null");
    }

    @Override
    public void close() throws IOException {
        data.close();
    }
}
