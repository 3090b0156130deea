package org.rostilos.reviewpipe.analysisengine.pipeline;

import org.rostilos.reviewpipe.analysisengine.exception.PipelineSetupException;
import org.rostilos.reviewpipe.analysisengine.report.ReportOutput;
import org.rostilos.reviewpipe.analysisengine.report.ReportOutputWriter;
import org.rostilos.reviewpipe.analysisengine.stage.AnalysisContext;
import org.rostilos.reviewpipe.analysisengine.stage.AnalysisStage;
import org.rostilos.reviewpipe.analysisengine.stage.AnalysisStageFactory;
import org.rostilos.reviewpipe.analysisengine.stage.StageDefinition;
import org.rostilos.reviewpipe.core.model.diff.ParsedDiff;
import org.rostilos.reviewpipe.core.model.finding.Finding;
import org.rostilos.reviewpipe.core.model.finding.StageResult;
import org.rostilos.reviewpipe.core.model.report.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the configured analysis stages strictly in order over one parsed diff.
 * <p>
 * Only setup problems (no stages, no output formats, a stage that cannot be built) fail the run.
 * Once the first stage starts, a throwing stage is recorded with zero findings and the next one runs.
 * Each stage sees an immutable snapshot of the findings produced by the stages before it.
 */
@Service
public class PipelineExecutor {
    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final AnalysisStageFactory stageFactory;
    private final ReportAggregator reportAggregator;
    private final ReportOutputWriter reportOutputWriter;

    public PipelineExecutor(
            AnalysisStageFactory stageFactory,
            ReportAggregator reportAggregator,
            ReportOutputWriter reportOutputWriter
    ) {
        this.stageFactory = stageFactory;
        this.reportAggregator = reportAggregator;
        this.reportOutputWriter = reportOutputWriter;
    }

    /**
     * Build stages from the configuration, run them, aggregate and write the configured artifacts.
     */
    public PipelineOutcome execute(ParsedDiff diff, PipelineConfig config) {
        Instant startedAt = reportAggregator.now();
        logState(PipelineState.IDLE, null);

        List<AnalysisStage> stages;
        try {
            validateConfig(config);
            stages = createStages(config.enabledStages());
        } catch (RuntimeException e) {
            return fail(e);
        }

        Report report = runStages(diff, stages, startedAt);
        List<ReportOutput> outputs = reportOutputWriter.write(report, config.outputFormats(), config.outputDirectory());
        logState(PipelineState.DONE, outputs.size() + " artifact(s) written");
        return PipelineOutcome.success(report, outputs);
    }

    /**
     * Run already constructed stages. No artifacts are written.
     */
    public PipelineOutcome execute(ParsedDiff diff, List<AnalysisStage> stages) {
        Instant startedAt = reportAggregator.now();
        logState(PipelineState.IDLE, null);

        if (stages == null || stages.isEmpty()) {
            return fail(new PipelineSetupException("At least one analysis stage must be enabled"));
        }
        try {
            requireUniqueNames(stages.stream().map(AnalysisStage::getName).toList());
        } catch (PipelineSetupException e) {
            return fail(e);
        }

        Report report = runStages(diff, stages, startedAt);
        logState(PipelineState.DONE, null);
        return PipelineOutcome.success(report, List.of());
    }

    private void validateConfig(PipelineConfig config) {
        if (config == null) {
            throw new PipelineSetupException("Pipeline configuration is missing");
        }
        if (config.outputFormats().isEmpty()) {
            throw new PipelineSetupException("At least one output format must be configured");
        }
        if (config.enabledStages().isEmpty()) {
            throw new PipelineSetupException("At least one analysis stage must be enabled");
        }
        requireUniqueNames(config.enabledStages().stream().map(StageDefinition::name).toList());
    }

    // stage names key the per-stage counts of the report
    private void requireUniqueNames(List<String> names) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                throw new PipelineSetupException("Duplicate analysis stage name '" + name + "'");
            }
        }
    }

    private List<AnalysisStage> createStages(List<StageDefinition> definitions) {
        List<AnalysisStage> stages = new ArrayList<>(definitions.size());
        for (StageDefinition definition : definitions) {
            try {
                stages.add(stageFactory.create(definition));
            } catch (PipelineSetupException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PipelineSetupException(
                        "Failed to create stage '" + definition.name() + "': " + e.getMessage(), e);
            }
        }
        return stages;
    }

    private Report runStages(ParsedDiff diff, List<AnalysisStage> stages, Instant startedAt) {
        List<Finding> accumulated = new ArrayList<>();
        List<StageResult> results = new ArrayList<>(stages.size());

        for (int i = 0; i < stages.size(); i++) {
            AnalysisStage stage = stages.get(i);
            logState(PipelineState.RUNNING, String.format("stage %d/%d '%s'", i + 1, stages.size(), stage.getName()));

            AnalysisContext context = new AnalysisContext(diff, accumulated);
            StageResult result = runStage(stage, context);

            results.add(result);
            accumulated.addAll(result.findings());
            log.info("Stage '{}' finished in {} ms with {} finding(s){}",
                    result.stageName(),
                    result.elapsed().toMillis(),
                    result.findings().size(),
                    result.isFailed() ? " (failed)" : "");
        }

        logState(PipelineState.AGGREGATING, null);
        return reportAggregator.aggregate(results, startedAt);
    }

    private StageResult runStage(AnalysisStage stage, AnalysisContext context) {
        long start = System.nanoTime();
        try {
            StageResult result = stage.run(context);
            if (result == null) {
                log.warn("Stage '{}' returned no result, recording it without findings", stage.getName());
                return StageResult.failed(stage.getName(), Duration.ofNanos(System.nanoTime() - start), "no result");
            }
            String invalid = findInvalidFinding(result.findings());
            if (invalid != null) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                log.warn("Stage '{}' returned an invalid payload ({}), recording it without findings",
                        stage.getName(), invalid);
                return StageResult.failed(stage.getName(), elapsed, "invalid payload: " + invalid);
            }
            if (!stage.getName().equals(result.stageName())) {
                return new StageResult(stage.getName(), result.findings(), result.elapsed(),
                        result.tokenUsage(), result.error());
            }
            return result;
        } catch (Exception e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.error("Stage '{}' failed after {} ms: {}", stage.getName(), elapsed.toMillis(), e.getMessage(), e);
            return StageResult.failed(stage.getName(), elapsed, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    // StageResult already rejects null elements; severity is what the aggregator buckets on
    private String findInvalidFinding(List<Finding> findings) {
        for (int i = 0; i < findings.size(); i++) {
            if (findings.get(i).severity() == null) {
                return "finding #" + (i + 1) + " has no severity";
            }
        }
        return null;
    }

    private PipelineOutcome fail(RuntimeException e) {
        logState(PipelineState.FAILED, e.getMessage());
        log.error("Pipeline setup failed: {}", e.getMessage(), e);
        return PipelineOutcome.failure(e.getMessage());
    }

    private void logState(PipelineState state, String detail) {
        if (detail == null) {
            log.info("Pipeline state: {}", state.getDisplayName());
        } else {
            log.info("Pipeline state: {} ({})", state.getDisplayName(), detail);
        }
    }
}
