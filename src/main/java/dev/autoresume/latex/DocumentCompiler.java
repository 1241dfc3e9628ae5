package dev.autoresume.latex;

import dev.autoresume.model.AssembledDocument;

/**
 * Turns assembled LaTeX source into a PDF.
 */
public interface DocumentCompiler {

    /**
     * Compile the document and return the PDF bytes.
     * Fails with {@link dev.autoresume.exception.CompilationException} carrying the compiler log.
     */
    byte[] compile(AssembledDocument document);
}
