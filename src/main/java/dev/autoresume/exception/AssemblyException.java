package dev.autoresume.exception;

/** Thrown when the LaTeX source cannot be assembled or edited. */
public class AssemblyException extends RuntimeException {

    public AssemblyException(String message) {
        super(message);
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
