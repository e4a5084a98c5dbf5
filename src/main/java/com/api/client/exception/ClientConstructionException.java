package com.api.client.exception;

/**
 * Thrown when a client option fails while the client is being assembled.
 * No client instance exists when this is thrown.
 */
public class ClientConstructionException extends ApiClientException {

    public ClientConstructionException(String message) {
        super(message);
    }

    public ClientConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
