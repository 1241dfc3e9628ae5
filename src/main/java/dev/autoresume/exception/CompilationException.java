package dev.autoresume.exception;

import java.nio.file.Path;

/** Exception thrown by the document compiler, carrying its diagnostic output verbatim. */
public class CompilationException extends RuntimeException {

    private final String diagnostic;
    private final Path preservedSource;

    public CompilationException(String message, String diagnostic) {
        this(message, diagnostic, null, null);
    }

    public CompilationException(String message, String diagnostic, Throwable cause) {
        this(message, diagnostic, null, cause);
    }

    private CompilationException(String message, String diagnostic, Path preservedSource, Throwable cause) {
        super(message, cause);
        this.diagnostic = diagnostic == null ? "" : diagnostic;
        this.preservedSource = preservedSource;
    }

    /**
     * Same failure, annotated with where the offending document source was saved.
     */
    public CompilationException withPreservedSource(Path path) {
        return new CompilationException(getMessage(), diagnostic, path, getCause());
    }

    public String getDiagnostic() {
        return diagnostic;
    }

    public Path getPreservedSource() {
        return preservedSource;
    }
}
