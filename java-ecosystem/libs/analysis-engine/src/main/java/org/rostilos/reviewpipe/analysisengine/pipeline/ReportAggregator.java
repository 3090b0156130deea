package org.rostilos.reviewpipe.analysisengine.pipeline;

import org.rostilos.reviewpipe.core.model.finding.Finding;
import org.rostilos.reviewpipe.core.model.finding.Severity;
import org.rostilos.reviewpipe.core.model.finding.StageResult;
import org.rostilos.reviewpipe.core.model.finding.TokenUsage;
import org.rostilos.reviewpipe.core.model.report.Report;
import org.rostilos.reviewpipe.core.model.report.ReportSummary;
import org.rostilos.reviewpipe.core.model.report.ReportTokenUsage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Report} from stage results in a single pass over their findings.
 */
public class ReportAggregator {

    private final Clock clock;

    public ReportAggregator() {
        this(Clock.systemUTC());
    }

    public ReportAggregator(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * @param stageResults results in execution order
     * @param startedAt    pipeline start, used for wall-clock elapsed time
     */
    public Report aggregate(List<StageResult> stageResults, Instant startedAt) {
        Map<Severity, List<Finding>> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, new ArrayList<>());
        }
        Map<String, Integer> byStage = new LinkedHashMap<>();
        Map<String, Integer> tokensByStage = new LinkedHashMap<>();
        int total = 0;
        int totalTokens = 0;

        for (StageResult result : stageResults) {
            byStage.put(result.stageName(), result.findings().size());
            for (Finding finding : result.findings()) {
                bySeverity.get(finding.severity()).add(finding);
                total++;
            }
            TokenUsage usage = result.tokenUsage();
            if (usage != null && usage.totalTokens() > 0) {
                tokensByStage.put(result.stageName(), usage.totalTokens());
                totalTokens += usage.totalTokens();
            }
        }

        ReportSummary summary = new ReportSummary(
                total,
                bySeverity.get(Severity.CRITICAL).size(),
                bySeverity.get(Severity.HIGH).size(),
                bySeverity.get(Severity.MEDIUM).size(),
                bySeverity.get(Severity.LOW).size(),
                byStage
        );
        ReportTokenUsage tokenUsage = totalTokens > 0 ? new ReportTokenUsage(totalTokens, tokensByStage) : null;

        Instant now = clock.instant();
        Duration elapsed = startedAt == null || startedAt.isAfter(now)
                ? Duration.ZERO
                : Duration.between(startedAt, now);
        return new Report(stageResults, summary, bySeverity, now, elapsed, tokenUsage);
    }
}
