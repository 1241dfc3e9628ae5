package dev.autoresume.exception;

/** Exception thrown when an outbound HTTP call fails. */
public class FetchException extends RuntimeException {

    private final int status;
    private final boolean retryable;

    public FetchException(String message, int status, boolean retryable) {
        super(message);
        this.status = status;
        this.retryable = retryable;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.retryable = true;
    }

    /**
     * HTTP status of the failed response, or 0 when no response was received.
     */
    public int getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
