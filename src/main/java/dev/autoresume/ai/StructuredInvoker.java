package dev.autoresume.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.autoresume.ai.schema.OutputSchema;
import dev.autoresume.config.LlmConfig;
import dev.autoresume.exception.GenerationException;
import dev.autoresume.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Schema-constrained call shared by extraction, ranking and generation.
 * The answer is decoded into a JSON tree, then validated into the typed value.
 * A rejected answer is re-prompted with the rejection reason, one attempt at a time.
 */
@Slf4j
@Component
public class StructuredInvoker {

    private final GenerativeClient client;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;
    private final int maxRetries;

    public StructuredInvoker(GenerativeClient client, ObjectMapper objectMapper, LlmConfig llmConfig,
                             PipelineMetrics metrics) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.maxRetries = Math.max(0, llmConfig.getMaxRetries());
    }

    public <T> Mono<T> invoke(String systemInstructions, String userContent, OutputSchema<T> schema) {
        return attempt(new GenerationPrompt(systemInstructions, userContent, schema.jsonSchema()), schema, 0, null);
    }

    private <T> Mono<T> attempt(GenerationPrompt prompt, OutputSchema<T> schema, int attempt, String feedback) {
        GenerationPrompt effective = feedback == null ? prompt : prompt.withFeedback(feedback);
        return Mono.defer(() -> {
                    metrics.recordGenerationAttempt();
                    log.debug("Requesting {} from {} (attempt {})", schema.name(), client.getName(), attempt + 1);
                    return client.generate(effective);
                })
                .map(text -> schema.validate(decode(text)))
                .onErrorResume(e -> e instanceof GenerationException g && g.isInvalidOutput(), e -> {
                    metrics.recordInvalidOutput();
                    if (attempt >= maxRetries) {
                        log.error("{} rejected after {} attempts: {}", schema.name(), attempt + 1, e.getMessage());
                        return Mono.error(GenerationException.invalidOutput(
                                "Invalid " + schema.name() + " after " + (attempt + 1) + " attempts: " + e.getMessage()));
                    }
                    log.warn("Invalid {} (attempt {}), re-prompting: {}", schema.name(), attempt + 1, e.getMessage());
                    return attempt(prompt, schema, attempt + 1, e.getMessage());
                });
    }

    /**
     * Take the outermost JSON object from the answer; models sometimes wrap
     * it in prose or code fences.
     */
    JsonNode decode(String text) {
        if (text == null) {
            throw GenerationException.invalidOutput("empty answer");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw GenerationException.invalidOutput("no JSON object found in answer");
        }
        try {
            return objectMapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw GenerationException.invalidOutput("malformed JSON: " + e.getOriginalMessage());
        }
    }
}
