package org.rostilos.reviewpipe.core.model.finding;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Output of one stage run.
 *
 * @param stageName  configured stage name
 * @param findings   findings in the order the stage produced them
 * @param elapsed    time spent in the stage, up to the failure point for failed stages
 * @param tokenUsage optional usage reported by the stage
 * @param error      failure message when the stage threw, otherwise null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageResult(
        String stageName,
        List<Finding> findings,
        Duration elapsed,
        TokenUsage tokenUsage,
        String error
) {
    public StageResult {
        Objects.requireNonNull(stageName, "stageName");
        findings = findings == null ? List.of() : List.copyOf(findings);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static StageResult of(String stageName, List<Finding> findings, Duration elapsed, TokenUsage tokenUsage) {
        return new StageResult(stageName, findings, elapsed, tokenUsage, null);
    }

    public static StageResult failed(String stageName, Duration elapsed, String error) {
        return new StageResult(stageName, List.of(), elapsed, null, error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
