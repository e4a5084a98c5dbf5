package com.api.client.exception;

import java.io.IOException;

/**
 * Network or HTTP level failure raised by the underlying transport.
 * The original {@link IOException} is always available as the cause.
 */
public class TransportException extends ApiClientException {

    public TransportException(String message, IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
