package com.api.client.exception;

/**
 * Thrown when the caller's {@link com.api.client.context.RequestContext} is cancelled
 * or expires, either while waiting for a rate-limit token or during the HTTP exchange.
 */
public class RequestCancelledException extends ApiClientException {

    /**
     * Why the context ended.
     */
    public enum Reason {
        CANCELLED("context canceled"),
        DEADLINE_EXCEEDED("context deadline exceeded");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Reason reason;

    public RequestCancelledException(Reason reason) {
        super(reason.description());
        this.reason = reason;
    }

    public RequestCancelledException(Reason reason, Throwable cause) {
        super(reason.description(), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
