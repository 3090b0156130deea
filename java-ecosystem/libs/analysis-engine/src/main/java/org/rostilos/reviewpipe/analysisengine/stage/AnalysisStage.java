package org.rostilos.reviewpipe.analysisengine.stage;

import org.rostilos.reviewpipe.core.model.finding.StageResult;

/**
 * One pluggable analysis step. Implementations may throw; the orchestrator isolates failures.
 */
public interface AnalysisStage {

    String getName();

    /**
     * Analyze the diff, optionally conditioned on earlier stages' findings.
     *
     * @param context immutable snapshot owned by the orchestrator
     * @return the stage's findings and timing
     */
    StageResult run(AnalysisContext context);
}
