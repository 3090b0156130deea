package org.rostilos.reviewpipe.analysisengine.stage;

import org.rostilos.reviewpipe.core.model.finding.Finding;
import org.rostilos.reviewpipe.core.model.finding.StageResult;
import org.rostilos.reviewpipe.core.model.finding.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for stages: measures elapsed time and drops incomplete findings
 * before they leave the stage.
 */
public abstract class AbstractAnalysisStage implements AnalysisStage {
    private static final Logger log = LoggerFactory.getLogger(AbstractAnalysisStage.class);

    private final String name;

    protected AbstractAnalysisStage(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public final StageResult run(AnalysisContext context) {
        long start = System.nanoTime();
        StageOutput output = analyze(context);

        List<Finding> complete = new ArrayList<>();
        for (Finding finding : output.findings()) {
            if (finding != null && finding.isComplete()) {
                complete.add(finding);
            } else {
                log.debug("Stage '{}' dropped incomplete finding: {}", name, finding);
            }
        }

        return StageResult.of(name, complete, Duration.ofNanos(System.nanoTime() - start), output.tokenUsage());
    }

    /**
     * Produce raw findings for the context. Thrown exceptions propagate to the orchestrator.
     */
    protected abstract StageOutput analyze(AnalysisContext context);

    protected record StageOutput(List<Finding> findings, TokenUsage tokenUsage) {
        public StageOutput {
            findings = findings == null ? List.of() : findings;
        }
    }
}
