package org.rostilos.reviewpipe.analysisengine.report;

import org.rostilos.reviewpipe.core.model.finding.Finding;
import org.rostilos.reviewpipe.core.model.finding.Severity;
import org.rostilos.reviewpipe.core.model.finding.StageResult;
import org.rostilos.reviewpipe.core.model.report.Report;
import org.rostilos.reviewpipe.core.model.report.ReportSummary;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Markdown report whose findings are unchecked checklist items. An operator ticks the
 * items to fix and feeds the file to {@code ReportMarkdownExtractor}.
 */
public class MarkdownReportRenderer implements ReportRenderer {

    public static final String FORMAT = "markdown";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
    private static final String CODE_INDENT = "    ";

    @Override
    public String render(Report report) {
        StringBuilder md = new StringBuilder();

        md.append("# Code Review Report\n\n");
        if (report.getGeneratedAt() != null) {
            md.append("Generated: ").append(TIMESTAMP_FORMAT.format(report.getGeneratedAt())).append("\n\n");
        }
        long millis = report.getElapsed() != null ? report.getElapsed().toMillis() : 0;
        md.append(String.format(Locale.ROOT, "Execution Time: %.2fs\n\n", millis / 1000.0));

        md.append("## Summary\n\n");
        appendSummaryTables(md, report.getSummary());

        report.findTokenUsage().ifPresent(usage -> {
            md.append("### Token Usage\n\n");
            md.append("- **Total**: ").append(usage.total()).append(" tokens\n");
            usage.byStage().forEach((stage, tokens) ->
                    md.append("- ").append(displayName(stage)).append(": ").append(tokens).append('\n'));
            md.append("\n");
        });

        md.append("---\n\n");
        for (StageResult result : report.getStageResults()) {
            appendStageSection(md, result);
        }
        return md.toString();
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    @Override
    public String getFileExtension() {
        return ".md";
    }

    private void appendSummaryTables(StringBuilder md, ReportSummary summary) {
        md.append("| Metric | Count |\n");
        md.append("|--------|-------|\n");
        md.append("| **Total Findings** | ").append(summary.totalFindings()).append(" |\n");
        md.append("| Critical | ").append(summary.critical()).append(" |\n");
        md.append("| High | ").append(summary.high()).append(" |\n");
        md.append("| Medium | ").append(summary.medium()).append(" |\n");
        md.append("| Low | ").append(summary.low()).append(" |\n\n");

        md.append("| Stage | Findings |\n");
        md.append("|-------|----------|\n");
        summary.byStage().forEach((stage, count) ->
                md.append("| ").append(displayName(stage)).append(" | ").append(count).append(" |\n"));
        md.append("\n");
    }

    private void appendStageSection(StringBuilder md, StageResult result) {
        String name = displayName(result.stageName());
        md.append("## ").append(name).append(" Stage\n\n");

        if (result.isFailed()) {
            md.append("Stage failed: ").append(singleLine(result.error())).append("\n\n");
            return;
        }
        if (result.findings().isEmpty()) {
            md.append("No issues found by ").append(name).append(" stage.\n\n");
            return;
        }

        md.append("Found ").append(result.findings().size()).append(" issue(s):\n\n");

        Map<Severity, List<Finding>> bySeverity = new EnumMap<>(Severity.class);
        for (Finding finding : result.findings()) {
            bySeverity.computeIfAbsent(finding.severity(), s -> new ArrayList<>()).add(finding);
        }
        bySeverity.forEach((severity, findings) -> {
            md.append("### ").append(tag(severity)).append("\n\n");
            for (Finding finding : findings) {
                appendFinding(md, finding);
            }
            md.append("\n");
        });
    }

    private void appendFinding(StringBuilder md, Finding finding) {
        md.append("- [ ] **[").append(tag(finding.severity())).append("]** ")
                .append(singleLine(finding.category())).append('\n');

        md.append("  - **File**: `").append(finding.file()).append('`');
        if (finding.line() != null) {
            md.append(':').append(finding.line());
        }
        md.append('\n');
        md.append("  - **Issue**: ").append(singleLine(finding.message())).append('\n');

        if (finding.suggestion() != null) {
            md.append("  - **Suggestion**: ").append(singleLine(finding.suggestion())).append('\n');
        }
        if (finding.code() != null) {
            md.append("  - **Code**:\n");
            // written verbatim; a code line ending in a triple backtick closes the fence when read back
            md.append(CODE_INDENT).append("```\n");
            for (String line : finding.code().split("\\r?\\n", -1)) {
                md.append(CODE_INDENT).append(line).append('\n');
            }
            md.append(CODE_INDENT).append("```\n");
        }
    }

    private static String tag(Severity severity) {
        return severity.getValue().toUpperCase(Locale.ROOT);
    }

    private static String singleLine(String text) {
        return text == null ? "" : text.replaceAll("\\s*\\r?\\n\\s*", " ").trim();
    }

    /**
     * {@code code-review} becomes {@code Code Review}.
     */
    static String displayName(String stageName) {
        StringBuilder sb = new StringBuilder();
        for (String part : stageName.split("[-_\\s]+")) {
            if (part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.length() > 0 ? sb.toString() : stageName;
    }
}
