package org.rostilos.reviewpipe.analysisengine.pipeline;

import org.rostilos.reviewpipe.analysisengine.report.ReportOutput;
import org.rostilos.reviewpipe.core.model.report.Report;

import java.util.List;

/**
 * Result of {@link PipelineExecutor#execute}. A failed outcome carries no report.
 */
public record PipelineOutcome(
        boolean success,
        Report report,
        List<ReportOutput> outputs,
        String error
) {
    public PipelineOutcome {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public static PipelineOutcome success(Report report, List<ReportOutput> outputs) {
        return new PipelineOutcome(true, report, outputs, null);
    }

    public static PipelineOutcome failure(String error) {
        return new PipelineOutcome(false, null, List.of(), error);
    }
}
