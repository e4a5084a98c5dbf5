package com.api.client.exception;

/**
 * Base runtime exception for every failure surfaced by the API client core.
 * Each call ends in either a fully decoded result or exactly one of these.
 */
public class ApiClientException extends RuntimeException {

    public ApiClientException(String message) {
        super(message);
    }

    public ApiClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
