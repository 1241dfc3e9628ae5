package dev.autoresume.ai.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Expected shape of a generative answer: a JSON schema sent to the provider
 * as a hint, and a validator turning the decoded tree into a typed value.
 *
 * @param <T> the domain value produced from a valid answer
 */
public interface OutputSchema<T> {

    /**
     * Short name used in logs and error messages.
     */
    String name();

    JsonNode jsonSchema();

    /**
     * Validate the decoded answer and build the domain value.
     * Throws an INVALID_OUTPUT {@link dev.autoresume.exception.GenerationException}
     * describing the first violation found.
     */
    T validate(JsonNode answer);
}
