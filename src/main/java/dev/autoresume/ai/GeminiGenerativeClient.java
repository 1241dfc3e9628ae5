package dev.autoresume.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dev.autoresume.config.FetchConfig;
import dev.autoresume.config.LlmConfig;
import dev.autoresume.exception.GenerationException;
import dev.autoresume.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Google AI Studio (Gemini) REST client. The output schema is sent as
 * {@code responseJsonSchema} so the model answers in JSON directly.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "llm.provider", havingValue = "gemini", matchIfMissing = true)
public class GeminiGenerativeClient extends AbstractGenerativeClient {

    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";
    static final String DEFAULT_MODEL = "gemini-2.0-flash";
    private static final String GENERATE_PATH = "/v1beta/models/%s:generateContent";

    private final WebClient webClient;
    private final String model;

    public GeminiGenerativeClient(WebClient sharedWebClient, LlmConfig llmConfig, FetchConfig fetchConfig,
                                  PipelineMetrics metrics) {
        super(llmConfig, fetchConfig, metrics);
        this.model = orDefault(llmConfig.getModel(), DEFAULT_MODEL);
        this.webClient = sharedWebClient.mutate()
                .baseUrl(orDefault(llmConfig.getBaseUrl(), DEFAULT_BASE_URL))
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public String getName() {
        return "Gemini";
    }

    @Override
    protected Mono<String> call(GenerationPrompt prompt) {
        GeminiRequest request = buildRequest(prompt);
        log.debug("Calling Gemini model {} ({} chars of input)", model, prompt.userContent().length());

        return webClient.post()
                .uri(String.format(GENERATE_PATH, model))
                .header("x-goog-api-key", llmConfig.getApiKey())
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toTransportError)
                .bodyToMono(GeminiResponse.class)
                .map(this::extractContent);
    }

    GeminiRequest buildRequest(GenerationPrompt prompt) {
        return new GeminiRequest(
                List.of(new GeminiRequest.Content("user", List.of(new GeminiRequest.Part(prompt.userContent())))),
                new GeminiRequest.Content(null, List.of(new GeminiRequest.Part(prompt.systemInstructions()))),
                new GeminiRequest.GenerationConfig(llmConfig.getTemperature(), "application/json", prompt.schema()));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            throw GenerationException.invalidOutput("Gemini returned no candidates");
        }

        var candidate = response.candidates().get(0);
        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }
        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            throw GenerationException.invalidOutput("Gemini candidate has no content parts (finish reason: "
                    + candidate.finishReason() + ")");
        }

        StringBuilder text = new StringBuilder();
        for (var part : candidate.content().parts()) {
            if (part.text() != null) {
                text.append(part.text());
            }
        }
        return text.toString();
    }

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GeminiRequest(
            List<Content> contents,
            Content systemInstruction,
            GenerationConfig generationConfig) {

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record Content(String role, List<Part> parts) {
        }

        record Part(String text) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record GenerationConfig(double temperature, String responseMimeType, JsonNode responseJsonSchema) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(Content content, String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
