package dev.autoresume.ai;

import dev.autoresume.config.FetchConfig;
import dev.autoresume.config.LlmConfig;
import dev.autoresume.exception.GenerationException;
import dev.autoresume.fetch.BackoffPolicy;
import dev.autoresume.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

/**
 * Shared transport behaviour: timeout, backoff on transient failures and
 * error classification. Subclasses only build and decode the provider payloads.
 */
@Slf4j
public abstract class AbstractGenerativeClient implements GenerativeClient {

    private static final int MAX_ERROR_DETAIL = 500;

    protected final LlmConfig llmConfig;
    protected final PipelineMetrics metrics;
    private final BackoffPolicy backoffPolicy;

    protected AbstractGenerativeClient(LlmConfig llmConfig, FetchConfig fetchConfig, PipelineMetrics metrics) {
        this.llmConfig = llmConfig;
        this.metrics = metrics;
        this.backoffPolicy = new BackoffPolicy(llmConfig.getMaxRetries(), fetchConfig.getBaseDelay(),
                fetchConfig.getMaxDelay(), AbstractGenerativeClient::isRetryable);

        if (isEnabled()) {
            log.info("{} provider enabled", getName());
        } else {
            log.warn("{} API key is missing! Generation will fail.", getName());
        }
    }

    /**
     * Issue one provider call and return the answer text.
     */
    protected abstract Mono<String> call(GenerationPrompt prompt);

    @Override
    public Mono<String> generate(GenerationPrompt prompt) {
        if (!isEnabled()) {
            return Mono.error(GenerationException.transport("No API key configured for " + getName()
                    + " (set llm.api-key)", false));
        }
        return Mono.defer(() -> call(prompt))
                .timeout(llmConfig.getTimeout())
                .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> GenerationException.transport(getName() + " request failed: " + e.getMessage(), e))
                .retryWhen(backoffPolicy.toRetry(signal -> {
                    metrics.recordRetry("llm");
                    log.info("Retrying {} call (attempt {}): {}", getName(), signal.totalRetries() + 1,
                            signal.failure().getMessage());
                }));
    }

    @Override
    public boolean isEnabled() {
        return llmConfig.getApiKey() != null && !llmConfig.getApiKey().isBlank();
    }

    /**
     * Turn an error status into a transport failure; 429 and 5xx are retryable.
     */
    protected Mono<? extends Throwable> toTransportError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    String detail = body.length() > MAX_ERROR_DETAIL ? body.substring(0, MAX_ERROR_DETAIL) + "..." : body;
                    log.error("{} API error ({}): {}", getName(), status, detail);
                    return GenerationException.transport(getName() + " error " + status + ": " + detail,
                            status == 429 || status >= 500);
                });
    }

    /**
     * Configured value, or the provider default when blank.
     */
    protected static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof GenerationException generationException
                && !generationException.isInvalidOutput()
                && generationException.isRetryable();
    }
}
