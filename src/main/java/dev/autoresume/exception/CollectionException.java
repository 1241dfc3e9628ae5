package dev.autoresume.exception;

/** Exception thrown when the GitHub profile cannot be collected. */
public class CollectionException extends RuntimeException {

    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
