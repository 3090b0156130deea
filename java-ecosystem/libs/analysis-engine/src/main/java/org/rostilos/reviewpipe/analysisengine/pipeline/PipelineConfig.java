package org.rostilos.reviewpipe.analysisengine.pipeline;

import org.rostilos.reviewpipe.analysisengine.stage.StageDefinition;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-run pipeline settings.
 *
 * @param stages          stage definitions in execution order, disabled ones included
 * @param outputFormats   renderer format tags, e.g. {@code markdown}, {@code json}
 * @param outputDirectory where rendered artifacts are written
 */
public record PipelineConfig(
        List<StageDefinition> stages,
        List<String> outputFormats,
        Path outputDirectory
) {
    public PipelineConfig {
        stages = stages == null ? List.of() : List.copyOf(stages);
        outputFormats = outputFormats == null ? List.of() : List.copyOf(outputFormats);
    }

    public List<StageDefinition> enabledStages() {
        return stages.stream().filter(StageDefinition::enabled).toList();
    }
}
