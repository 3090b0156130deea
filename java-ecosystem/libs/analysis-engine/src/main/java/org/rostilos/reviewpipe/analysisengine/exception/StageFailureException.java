package org.rostilos.reviewpipe.analysisengine.exception;

/**
 * Thrown by a stage whose capability errored or returned a payload that cannot be read.
 * The orchestrator records the stage with zero findings and moves on.
 */
public class StageFailureException extends RuntimeException {

    private final String stageName;

    public StageFailureException(String stageName, String message) {
        this(stageName, message, null);
    }

    public StageFailureException(String stageName, String message, Throwable cause) {
        super(String.format("Stage '%s' failed: %s", stageName, message), cause);
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }
}
