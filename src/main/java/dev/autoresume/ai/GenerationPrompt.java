package dev.autoresume.ai;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A schema-constrained request: system instructions, user content and the
 * JSON schema the answer is expected to follow.
 */
public record GenerationPrompt(String systemInstructions, String userContent, JsonNode schema) {

    /**
     * Same prompt with the reason the previous answer was rejected appended.
     */
    public GenerationPrompt withFeedback(String feedback) {
        String corrected = userContent + "\n\nYOUR PREVIOUS ANSWER WAS REJECTED: " + feedback
                + "\nAnswer again with ONLY valid JSON that follows the schema exactly.";
        return new GenerationPrompt(systemInstructions, corrected, schema);
    }
}
