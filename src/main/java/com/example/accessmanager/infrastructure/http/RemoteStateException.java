package com.example.accessmanager.infrastructure.http;

/**
 * Raised when the remote service cannot provide the actual state.
 */
public class RemoteStateException extends RuntimeException {
    private final int status;
    private final boolean retryable;

    public RemoteStateException(String message, int status, boolean retryable, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.retryable = retryable;
    }

    public RemoteStateException(String message) {
        this(message, 0, false, null);
    }

    /** HTTP status of the failed response, or 0 when no response was received. */
    public int getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
