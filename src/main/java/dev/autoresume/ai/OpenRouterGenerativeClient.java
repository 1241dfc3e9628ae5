package dev.autoresume.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.autoresume.config.FetchConfig;
import dev.autoresume.config.LlmConfig;
import dev.autoresume.exception.GenerationException;
import dev.autoresume.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * OpenRouter client over its OpenAI-compatible chat completions API.
 * JSON mode is requested and the schema travels inside the system message.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "llm.provider", havingValue = "openrouter")
public class OpenRouterGenerativeClient extends AbstractGenerativeClient {

    static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";
    static final String DEFAULT_MODEL = "google/gemini-2.0-flash-001";

    private final WebClient webClient;
    private final String model;

    public OpenRouterGenerativeClient(WebClient sharedWebClient, LlmConfig llmConfig, FetchConfig fetchConfig,
                                      PipelineMetrics metrics) {
        super(llmConfig, fetchConfig, metrics);
        this.model = orDefault(llmConfig.getModel(), DEFAULT_MODEL);
        this.webClient = sharedWebClient.mutate()
                .baseUrl(orDefault(llmConfig.getBaseUrl(), DEFAULT_BASE_URL))
                .defaultHeader("Authorization", "Bearer " + llmConfig.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .defaultHeader("X-Title", "Auto Resume")
                .build();
    }

    @Override
    public String getName() {
        return "OpenRouter";
    }

    @Override
    protected Mono<String> call(GenerationPrompt prompt) {
        log.debug("Calling OpenRouter model {} ({} chars of input)", model, prompt.userContent().length());
        return webClient.post()
                .uri("/chat/completions")
                .bodyValue(buildRequest(prompt))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toTransportError)
                .bodyToMono(OpenRouterResponse.class)
                .map(this::extractContent);
    }

    OpenRouterRequest buildRequest(GenerationPrompt prompt) {
        String system = prompt.systemInstructions()
                + "\n\nRespond ONLY with a JSON object that validates against this JSON schema:\n"
                + prompt.schema().toString();
        return new OpenRouterRequest(
                model,
                List.of(new OpenRouterRequest.Message("system", system),
                        new OpenRouterRequest.Message("user", prompt.userContent())),
                llmConfig.getTemperature(),
                new OpenRouterRequest.ResponseFormat("json_object"));
    }

    private String extractContent(OpenRouterResponse response) {
        if (response == null || response.choices() == null || response.choices().isEmpty()) {
            throw GenerationException.invalidOutput("OpenRouter returned no choices");
        }
        var choice = response.choices().get(0);
        if (choice.message() == null || choice.message().content() == null) {
            throw GenerationException.invalidOutput("OpenRouter choice has no message content (finish reason: "
                    + choice.finishReason() + ")");
        }
        return choice.message().content();
    }

    record OpenRouterRequest(
            String model,
            List<Message> messages,
            double temperature,
            @JsonProperty("response_format") ResponseFormat responseFormat) {
        record Message(String role, String content) {
        }

        record ResponseFormat(String type) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OpenRouterResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Message(String content) {
            }
        }
    }
}
