package org.rostilos.reviewpipe.analysisengine.exception;

/**
 * Thrown when the pipeline cannot be prepared before the first stage runs.
 */
public class PipelineSetupException extends RuntimeException {

    public PipelineSetupException(String message) {
        super(message);
    }

    public PipelineSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
