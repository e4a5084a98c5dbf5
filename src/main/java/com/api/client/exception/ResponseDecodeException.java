package com.api.client.exception;

/**
 * Thrown when a response body is not valid JSON or does not fit the requested target type.
 */
public class ResponseDecodeException extends ApiClientException {

    public ResponseDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
