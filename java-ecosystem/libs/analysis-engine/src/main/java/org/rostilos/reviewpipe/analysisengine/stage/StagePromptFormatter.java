package org.rostilos.reviewpipe.analysisengine.stage;

import org.rostilos.reviewpipe.core.model.diff.Change;
import org.rostilos.reviewpipe.core.model.diff.FileDiff;
import org.rostilos.reviewpipe.core.model.diff.ParsedDiff;
import org.rostilos.reviewpipe.core.model.finding.Finding;

import java.util.List;

/**
 * Renders the diff and prior findings as the text block sent to a review service.
 */
public class StagePromptFormatter {
    private static final String NO_PREVIOUS_FINDINGS = "No previous findings.\n";

    public String buildPrompt(String focus, AnalysisContext context) {
        StringBuilder prompt = new StringBuilder();
        if (focus != null && !focus.isBlank()) {
            prompt.append("# Review Focus\n\n").append(focus.trim()).append("\n\n");
        }
        prompt.append(formatDiff(context.diff()));
        prompt.append("---\n\n");
        if (context.hasPreviousFindings()) {
            prompt.append(formatPreviousFindings(context.previousFindings()));
        } else {
            prompt.append(NO_PREVIOUS_FINDINGS);
        }
        return prompt.toString();
    }

    public String formatDiff(ParsedDiff diff) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Code Changes Summary\n\n").append(diff.getSummary()).append("\n\n");

        for (FileDiff file : diff.getFiles()) {
            sb.append("## File: ").append(file.getPath()).append('\n');
            sb.append("Status: ").append(file.getStatus().getValue()).append('\n');
            file.getOldPath().ifPresent(old -> sb.append("Renamed from: ").append(old).append('\n'));
            sb.append("Changes: +").append(file.getAdditions()).append(" -").append(file.getDeletions()).append("\n\n");

            sb.append("```diff\n");
            for (Change change : file.getChanges()) {
                sb.append(change.type().getMarker()).append(change.content()).append('\n');
            }
            sb.append("```\n\n");
        }
        return sb.toString();
    }

    public String formatPreviousFindings(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            return NO_PREVIOUS_FINDINGS;
        }

        StringBuilder sb = new StringBuilder("# Previous Stage Findings\n\n");
        for (Finding finding : findings) {
            sb.append("- **[").append(finding.severity().getValue().toUpperCase()).append("]** ")
                    .append(finding.category()).append(": ").append(finding.message()).append('\n');
            sb.append("  File: ").append(finding.location()).append('\n');
            if (finding.suggestion() != null && !finding.suggestion().isBlank()) {
                sb.append("  Suggestion: ").append(finding.suggestion()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
