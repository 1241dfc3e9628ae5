package dev.autoresume.exception;

/** Exception thrown when the generative provider cannot produce usable output. */
public class GenerationException extends RuntimeException {

    public enum Kind {
        /** Provider unreachable or answering with an error status. */
        TRANSPORT,
        /** Provider answered, but the answer does not decode into the expected shape. */
        INVALID_OUTPUT
    }

    private final Kind kind;
    private final boolean retryable;

    private GenerationException(Kind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public static GenerationException transport(String message, boolean retryable) {
        return new GenerationException(Kind.TRANSPORT, message, retryable, null);
    }

    public static GenerationException transport(String message, Throwable cause) {
        return new GenerationException(Kind.TRANSPORT, message, true, cause);
    }

    public static GenerationException invalidOutput(String message) {
        return new GenerationException(Kind.INVALID_OUTPUT, message, false, null);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isInvalidOutput() {
        return kind == Kind.INVALID_OUTPUT;
    }
}
