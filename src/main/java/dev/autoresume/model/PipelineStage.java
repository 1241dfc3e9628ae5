package dev.autoresume.model;

/**
 * Stages of a resume run, in execution order.
 */
public enum PipelineStage {
    COLLECTION("GitHub collection"),
    JOB_RESOLUTION("Job source resolution"),
    EXTRACTION("Job description extraction"),
    RANKING("Repository ranking"),
    SELECTION("Repository selection"),
    GENERATION("Resume content generation"),
    ASSEMBLY("Document assembly"),
    EDITING("LaTeX source review"),
    COMPILATION("Document compilation");

    private final String label;

    PipelineStage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
