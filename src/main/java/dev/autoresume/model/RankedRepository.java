package dev.autoresume.model;

/**
 * A repository's position in the ranking. Score is ordinal: 1 is the most relevant.
 */
public record RankedRepository(Repository repository, int score, String rationale) {
}
