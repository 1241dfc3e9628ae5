package dev.autoresume.exception;

/** Exception thrown when an explicitly supplied job source cannot be read. */
public class ResolutionException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        IO_ERROR,
        FETCH_FAILED,
        AMBIGUOUS
    }

    private final Reason reason;

    public ResolutionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ResolutionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
