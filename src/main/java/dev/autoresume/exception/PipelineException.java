package dev.autoresume.exception;

import dev.autoresume.model.PipelineStage;

/** Terminal failure of a pipeline run, tagged with the stage that failed. */
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineException(PipelineStage stage, Throwable cause) {
        super(stage.getLabel() + " failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
