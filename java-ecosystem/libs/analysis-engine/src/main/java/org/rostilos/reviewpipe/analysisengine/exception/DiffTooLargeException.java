package org.rostilos.reviewpipe.analysisengine.exception;

/**
 * Exception thrown when a stage prompt exceeds the configured token budget.
 * Treated like any stage failure: the stage contributes no findings, the run continues.
 */
public class DiffTooLargeException extends RuntimeException {

    private final int estimatedTokens;
    private final int maxAllowedTokens;
    private final String stageName;

    public DiffTooLargeException(int estimatedTokens, int maxAllowedTokens, String stageName) {
        super(String.format(
            "Prompt exceeds token limit: estimated %d tokens, max allowed %d tokens (stage=%s)",
            estimatedTokens, maxAllowedTokens, stageName
        ));
        this.estimatedTokens = estimatedTokens;
        this.maxAllowedTokens = maxAllowedTokens;
        this.stageName = stageName;
    }

    public int getEstimatedTokens() {
        return estimatedTokens;
    }

    public int getMaxAllowedTokens() {
        return maxAllowedTokens;
    }

    public String getStageName() {
        return stageName;
    }

    /**
     * Returns the percentage of the token limit that would be used.
     */
    public double getUtilizationPercentage() {
        return maxAllowedTokens > 0 ? (estimatedTokens * 100.0 / maxAllowedTokens) : 0;
    }
}
