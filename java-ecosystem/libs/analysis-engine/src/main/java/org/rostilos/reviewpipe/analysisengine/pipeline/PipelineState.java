package org.rostilos.reviewpipe.analysisengine.pipeline;

public enum PipelineState {
    IDLE("Idle"),
    RUNNING("Running"),
    AGGREGATING("Aggregating"),
    DONE("Done"),
    FAILED("Failed");

    private final String displayName;

    PipelineState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
