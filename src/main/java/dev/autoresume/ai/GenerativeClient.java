package dev.autoresume.ai;

import reactor.core.publisher.Mono;

/**
 * Transport to a generative text provider. Implementations return the raw
 * answer text; decoding and validation happen in {@link StructuredInvoker}.
 */
public interface GenerativeClient {

    /**
     * Name of the provider (e.g., "Gemini", "OpenRouter").
     */
    String getName();

    /**
     * Send the prompt and return the answer text.
     * Fails with a TRANSPORT {@link dev.autoresume.exception.GenerationException}.
     */
    Mono<String> generate(GenerationPrompt prompt);

    /**
     * Check if the provider is configured (API key present).
     */
    boolean isEnabled();
}
