package com.phillippitts.hsie.exception;

/**
 * Pipeline component an error originated from. Used for error reports and logging context.
 */
public enum PipelineStage {
    ENTRY("entry"),
    PREPROCESSING("preprocessing"),
    ANALYSIS("analysis"),
    AGGREGATION("aggregation"),
    STORE("store");

    private final String label;

    PipelineStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
