package org.rostilos.reviewpipe.core.model.finding;

/**
 * Token accounting reported by a stage's model service. Opaque to the pipeline, carried for reporting.
 */
public record TokenUsage(
        int promptTokens,
        int completionTokens,
        int totalTokens
) {
}
