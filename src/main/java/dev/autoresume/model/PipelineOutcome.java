package dev.autoresume.model;

import java.nio.file.Path;

/**
 * How a run ended. Aborting at the selection prompt is a normal outcome, not a failure.
 */
public record PipelineOutcome(Status status, Path artifact, Path source) {

    public enum Status {
        COMPLETED,
        USER_ABORTED
    }

    public static PipelineOutcome completed(Path artifact, Path source) {
        return new PipelineOutcome(Status.COMPLETED, artifact, source);
    }

    public static PipelineOutcome aborted() {
        return new PipelineOutcome(Status.USER_ABORTED, null, null);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
