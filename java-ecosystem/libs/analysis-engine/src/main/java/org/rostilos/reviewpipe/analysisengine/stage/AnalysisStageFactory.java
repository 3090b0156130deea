package org.rostilos.reviewpipe.analysisengine.stage;

/**
 * Builds stage instances for a pipeline run.
 */
public interface AnalysisStageFactory {

    /**
     * @throws org.rostilos.reviewpipe.analysisengine.exception.PipelineSetupException if the stage cannot be constructed
     */
    AnalysisStage create(StageDefinition definition);
}
