package dev.autoresume.model;

/**
 * LaTeX source with every dynamic field substituted and escaped.
 */
public record AssembledDocument(String source) {
}
