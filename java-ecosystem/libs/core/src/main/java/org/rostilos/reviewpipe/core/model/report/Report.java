package org.rostilos.reviewpipe.core.model.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.rostilos.reviewpipe.core.model.finding.Finding;
import org.rostilos.reviewpipe.core.model.finding.Severity;
import org.rostilos.reviewpipe.core.model.finding.StageResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate of one pipeline run. Built once by the aggregator and never mutated afterwards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Report {
    private final List<StageResult> stageResults;
    private final ReportSummary summary;
    private final Map<Severity, List<Finding>> findingsBySeverity;
    private final Instant generatedAt;
    private final Duration elapsed;
    private final ReportTokenUsage tokenUsage;

    public Report(
            List<StageResult> stageResults,
            ReportSummary summary,
            Map<Severity, List<Finding>> findingsBySeverity,
            Instant generatedAt,
            Duration elapsed,
            ReportTokenUsage tokenUsage
    ) {
        this.stageResults = List.copyOf(stageResults);
        this.summary = summary;
        EnumMap<Severity, List<Finding>> grouped = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            List<Finding> bucket = findingsBySeverity == null ? null : findingsBySeverity.get(severity);
            grouped.put(severity, bucket == null ? List.of() : List.copyOf(bucket));
        }
        this.findingsBySeverity = Collections.unmodifiableMap(grouped);
        this.generatedAt = generatedAt;
        this.elapsed = elapsed;
        this.tokenUsage = tokenUsage;
    }

    public List<StageResult> getStageResults() {
        return stageResults;
    }

    public ReportSummary getSummary() {
        return summary;
    }

    /**
     * Findings of the given severity in first-seen order across stages.
     */
    public List<Finding> getFindings(Severity severity) {
        return findingsBySeverity.get(severity);
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public ReportTokenUsage getTokenUsage() {
        return tokenUsage;
    }

    @JsonIgnore
    public Optional<ReportTokenUsage> findTokenUsage() {
        return Optional.ofNullable(tokenUsage);
    }

    @JsonIgnore
    public Optional<StageResult> findStageResult(String stageName) {
        return stageResults.stream()
                .filter(r -> r.stageName().equals(stageName))
                .findFirst();
    }
}
