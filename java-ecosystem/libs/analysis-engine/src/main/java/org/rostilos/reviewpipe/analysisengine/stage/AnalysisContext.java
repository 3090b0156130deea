package org.rostilos.reviewpipe.analysisengine.stage;

import org.rostilos.reviewpipe.core.model.diff.ParsedDiff;
import org.rostilos.reviewpipe.core.model.finding.Finding;

import java.util.List;
import java.util.Objects;

/**
 * Read-only input of one stage run: the parsed diff and every finding produced by the
 * stages that ran before it, in execution order.
 */
public record AnalysisContext(
        ParsedDiff diff,
        List<Finding> previousFindings
) {
    public AnalysisContext {
        Objects.requireNonNull(diff, "diff");
        previousFindings = previousFindings == null ? List.of() : List.copyOf(previousFindings);
    }

    public boolean hasPreviousFindings() {
        return !previousFindings.isEmpty();
    }
}
