package org.rostilos.reviewpipe.analysisengine.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rostilos.reviewpipe.analysisengine.extract.ExtractedFinding;
import org.rostilos.reviewpipe.analysisengine.extract.ReportMarkdownExtractor;
import org.rostilos.reviewpipe.analysisengine.pipeline.ReportAggregator;
import org.rostilos.reviewpipe.core.model.finding.Finding;
import org.rostilos.reviewpipe.core.model.finding.FindingType;
import org.rostilos.reviewpipe.core.model.finding.Severity;
import org.rostilos.reviewpipe.core.model.finding.StageResult;
import org.rostilos.reviewpipe.core.model.finding.TokenUsage;
import org.rostilos.reviewpipe.core.model.report.Report;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MarkdownReportRenderer")
class MarkdownReportRendererTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final MarkdownReportRenderer renderer = new MarkdownReportRenderer();
    private final ReportAggregator aggregator = new ReportAggregator(Clock.fixed(NOW, ZoneOffset.UTC));

    private final Finding nullCheck = new Finding(FindingType.ERROR, Severity.HIGH, "Null Check",
            "missing check", "src/a.ts", 12, "add a guard", "if (user.name) {\n  greet(user);\n}");
    private final Finding naming = new Finding(FindingType.INFO, Severity.LOW, "Naming",
            "unclear name", "src/b.ts", null, null, null);
    private final Finding injection = new Finding(FindingType.ERROR, Severity.CRITICAL, "SQL Injection",
            "query built from input", "src/db.ts", 40, "use bind parameters", null);

    private Report report() {
        return aggregator.aggregate(List.of(
                StageResult.of("code-review", List.of(naming, nullCheck), Duration.ofMillis(1200), new TokenUsage(90, 10, 100)),
                StageResult.of("security", List.of(injection), Duration.ofMillis(800), null),
                StageResult.of("performance", List.of(), Duration.ofMillis(300), null)
        ), NOW.minusMillis(2500));
    }

    @Test
    @DisplayName("should render header, summary and one section per stage")
    void shouldRenderSections() {
        String md = renderer.render(report());

        assertThat(md).startsWith("# Code Review Report\n\n");
        assertThat(md).contains("Generated: 2024-05-01 10:00:00 UTC");
        assertThat(md).contains("Execution Time: 2.50s");
        assertThat(md).contains("| **Total Findings** | 3 |");
        assertThat(md).contains("| Code Review | 2 |");
        assertThat(md).contains("- **Total**: 100 tokens");
        assertThat(md).contains("## Code Review Stage", "## Security Stage", "## Performance Stage");
        assertThat(md).contains("No issues found by Performance stage.");
    }

    @Test
    @DisplayName("should group findings by severity, most significant first")
    void shouldGroupBySeverity() {
        String md = renderer.render(report());

        int highHeading = md.indexOf("### HIGH");
        int lowHeading = md.indexOf("### LOW");
        assertThat(highHeading).isPositive().isLessThan(lowHeading);
    }

    @Test
    @DisplayName("should render findings as unchecked checklist items")
    void shouldRenderChecklistItems() {
        String md = renderer.render(report());

        assertThat(md).contains("""
                - [ ] **[HIGH]** Null Check
                  - **File**: `src/a.ts`:12
                  - **Issue**: missing check
                  - **Suggestion**: add a guard
                  - **Code**:
                    ```
                    if (user.name) {
                      greet(user);
                    }
                    ```
                """);
        assertThat(md).contains("- [ ] **[LOW]** Naming\n  - **File**: `src/b.ts`\n  - **Issue**: unclear name\n");
        assertThat(new ReportMarkdownExtractor().extract(md)).isEmpty();
    }

    @Test
    @DisplayName("should round-trip ticked items through the extractor")
    void shouldRoundTripThroughExtractor() {
        String ticked = renderer.render(report())
                .replace("- [ ] **[HIGH]** Null Check", "- [x] **[HIGH]** Null Check")
                .replace("- [ ] **[CRITICAL]** SQL Injection", "- [x] **[CRITICAL]** SQL Injection");

        List<ExtractedFinding> extracted = new ReportMarkdownExtractor().extract(ticked);

        assertThat(extracted).containsExactly(
                new ExtractedFinding("high", "Null Check", "src/a.ts", 12, "missing check", "add a guard",
                        "if (user.name) {\n  greet(user);\n}"),
                new ExtractedFinding("critical", "SQL Injection", "src/db.ts", 40, "query built from input",
                        "use bind parameters", null)
        );
    }

    @Test
    @DisplayName("should mention failed stages")
    void shouldRenderFailedStage() {
        Report report = aggregator.aggregate(List.of(
                StageResult.failed("security", Duration.ofMillis(5), "Stage 'security' failed: timeout")
        ), NOW);

        assertThat(renderer.render(report)).contains("Stage failed: Stage 'security' failed: timeout");
    }

    @Test
    @DisplayName("should turn stage names into titles")
    void shouldFormatDisplayName() {
        assertThat(MarkdownReportRenderer.displayName("code-review")).isEqualTo("Code Review");
        assertThat(MarkdownReportRenderer.displayName("security")).isEqualTo("Security");
        assertThat(MarkdownReportRenderer.displayName("api_usage")).isEqualTo("Api Usage");
    }
}
