package org.rostilos.reviewpipe.analysisengine.extract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Serializes an extracted selection for downstream fix tooling.
 */
public class ExtractedFindingsFormatter {

    static final String EMPTY_SELECTION =
            "# No findings selected\n\nPlease check boxes in the report to select findings to fix.\n";

    private final ObjectMapper objectMapper;

    public ExtractedFindingsFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toMarkdown(List<ExtractedFinding> findings) {
        if (findings == null || findings.isEmpty()) {
            return EMPTY_SELECTION;
        }

        StringBuilder md = new StringBuilder("# Selected Findings to Fix\n\n");
        md.append("Total: ").append(findings.size()).append(" issue(s)\n\n");
        md.append("---\n\n");

        int index = 1;
        for (ExtractedFinding finding : findings) {
            md.append("## ").append(index++).append(". [")
                    .append(finding.severity().toUpperCase(Locale.ROOT)).append("] ")
                    .append(finding.category()).append("\n\n");
            md.append("**File**: `").append(finding.file()).append('`');
            if (finding.line() != null) {
                md.append(':').append(finding.line());
            }
            md.append("\n\n");
            md.append("**Issue**: ").append(finding.issue()).append("\n\n");

            if (finding.suggestion() != null && !finding.suggestion().isEmpty()) {
                md.append("**Suggested Fix**: ").append(finding.suggestion()).append("\n\n");
            }
            if (finding.code() != null && !finding.code().isEmpty()) {
                md.append("**Current Code**:\n```\n").append(finding.code()).append("\n```\n\n");
            }
            md.append("---\n\n");
        }
        return md.toString();
    }

    public String toJson(List<ExtractedFinding> findings) {
        List<ExtractedFinding> source = findings == null ? List.of() : findings;
        List<NumberedFinding> numbered = new ArrayList<>(source.size());
        for (int i = 0; i < source.size(); i++) {
            ExtractedFinding f = source.get(i);
            numbered.add(new NumberedFinding(i + 1, f.severity(), f.category(), f.file(), f.line(),
                    f.issue(), f.suggestion(), f.code()));
        }
        try {
            return objectMapper.writeValueAsString(new Selection(numbered.size(), numbered));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize extracted findings", e);
        }
    }

    public record Selection(int total, List<NumberedFinding> findings) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NumberedFinding(
            int id,
            String severity,
            String category,
            String file,
            Integer line,
            String issue,
            String suggestion,
            String code
    ) {
    }
}
