package dev.autoresume;

import dev.autoresume.exception.CompilationException;
import dev.autoresume.exception.PipelineException;
import dev.autoresume.exception.RateLimitedException;
import dev.autoresume.model.PipelineOutcome;
import dev.autoresume.service.ResumePipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Orchestrates the execution of the resume pipeline.
 * Separated from the main Application class for better testability and SRP.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

    private static final String SEPARATOR = "========================================";

    private final ResumePipelineService resumePipelineService;

    /**
     * Executes the pipeline and reports how it ended.
     *
     * @return the outcome; aborting at the selection prompt is not a failure
     */
    public PipelineOutcome execute() {
        log.info(SEPARATOR);
        log.info("Auto Resume Starting");
        log.info(SEPARATOR);

        try {
            PipelineOutcome outcome = resumePipelineService.runPipeline().block();
            if (outcome == null) {
                throw new IllegalStateException("Pipeline finished without an outcome");
            }

            log.info(SEPARATOR);
            if (outcome.isCompleted()) {
                log.info("Auto Resume Completed Successfully");
                log.info("Resume: {}", outcome.artifact());
                if (outcome.source() != null) {
                    log.info("LaTeX source: {}", outcome.source());
                }
            } else {
                log.info("Auto Resume Aborted by User");
            }
            log.info(SEPARATOR);
            return outcome;
        } catch (Exception e) {
            report(e);
            throw new IllegalStateException("Pipeline execution failed", e);
        }
    }

    private void report(Exception e) {
        log.error(SEPARATOR);
        if (e instanceof PipelineException pipelineException) {
            log.error("Stage failed: {}", pipelineException.getStage().getLabel());
            Throwable cause = pipelineException.getCause();
            log.error("Reason: {}", cause.getMessage());
            if (cause instanceof RateLimitedException rateLimited && !rateLimited.getRetryAfter().isZero()) {
                log.error("Try again in {} seconds", rateLimited.getRetryAfter().toSeconds());
            }
            if (cause instanceof CompilationException compilation) {
                log.error("Compiler output:\n{}", compilation.getDiagnostic());
                if (compilation.getPreservedSource() != null) {
                    log.error("The LaTeX source was kept at {}", compilation.getPreservedSource());
                }
            }
            log.debug("Failure detail", e);
        } else {
            log.error("Auto Resume failed: {}", e.getMessage(), e);
        }
        log.error(SEPARATOR);
    }
}
