package dev.autoresume.metrics;

import dev.autoresume.model.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer metrics for resume pipeline runs.
 */
@Component
public class PipelineMetrics {

    private static final String TAG_SCOPE = "scope";
    private static final String TAG_STAGE = "stage";

    private final MeterRegistry registry;

    private final Counter cacheHitsCounter;
    private final Counter cacheMissesCounter;
    private final Counter networkCallsCounter;
    private final Counter repositoriesCollectedCounter;
    private final Counter generationAttemptsCounter;
    private final Counter invalidOutputsCounter;

    private final ConcurrentHashMap<PipelineStage, Timer> stageTimers = new ConcurrentHashMap<>();

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.cacheHitsCounter = Counter.builder("auto_resume_cache_hits_total")
                .description("Fetches answered from the response cache")
                .register(registry);

        this.cacheMissesCounter = Counter.builder("auto_resume_cache_misses_total")
                .description("Fetches that had to go to the network")
                .register(registry);

        this.networkCallsCounter = Counter.builder("auto_resume_network_calls_total")
                .description("HTTP requests actually sent, retries included")
                .register(registry);

        this.repositoriesCollectedCounter = Counter.builder("auto_resume_repositories_collected_total")
                .description("Repositories collected from GitHub")
                .register(registry);

        this.generationAttemptsCounter = Counter.builder("auto_resume_generation_attempts_total")
                .description("Structured generation attempts (re-prompts included)")
                .register(registry);

        this.invalidOutputsCounter = Counter.builder("auto_resume_generation_invalid_outputs_total")
                .description("Provider answers rejected by schema validation")
                .register(registry);
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissesCounter.increment();
    }

    public void recordNetworkCall() {
        networkCallsCounter.increment();
    }

    /**
     * Record a backoff retry. Scope is "fetch" or "llm".
     */
    public void recordRetry(String scope) {
        Counter.builder("auto_resume_retries_total")
                .tag(TAG_SCOPE, scope)
                .register(registry)
                .increment();
    }

    public void recordRepositoriesCollected(int count) {
        repositoriesCollectedCounter.increment(count);
    }

    public void recordGenerationAttempt() {
        generationAttemptsCounter.increment();
    }

    public void recordInvalidOutput() {
        invalidOutputsCounter.increment();
    }

    /**
     * Get or create a timer for a pipeline stage.
     */
    public Timer getStageTimer(PipelineStage stage) {
        return stageTimers.computeIfAbsent(stage, s ->
                Timer.builder("auto_resume_stage_duration")
                        .description("Time spent in a pipeline stage")
                        .tag(TAG_STAGE, s.name().toLowerCase())
                        .register(registry)
        );
    }

    public void recordStageLatency(PipelineStage stage, long latencyMs) {
        getStageTimer(stage).record(Duration.ofMillis(latencyMs));
    }

    public double retries(String scope) {
        Counter counter = registry.find("auto_resume_retries_total").tag(TAG_SCOPE, scope).counter();
        return counter == null ? 0 : counter.count();
    }

    public double networkCalls() {
        return networkCallsCounter.count();
    }

    public double cacheHits() {
        return cacheHitsCounter.count();
    }

    public double cacheMisses() {
        return cacheMissesCounter.count();
    }

    /**
     * One-line digest of the run's counters, logged when the pipeline ends.
     */
    public String summary() {
        return String.format("cache hits=%.0f, cache misses=%.0f, network calls=%.0f, retries fetch=%.0f llm=%.0f, "
                        + "generation attempts=%.0f, invalid outputs=%.0f",
                cacheHits(), cacheMisses(), networkCalls(), retries("fetch"), retries("llm"),
                generationAttemptsCounter.count(), invalidOutputsCounter.count());
    }
}
