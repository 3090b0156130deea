package org.rostilos.reviewpipe.analysisengine.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers the findings an operator ticked in a Markdown report.
 * <p>
 * Only items of the form {@code - [x] **[SEVERITY]** category} are read. An item is emitted
 * when both its File and Issue fields were found; any other checked item is dropped silently.
 */
public class ReportMarkdownExtractor {
    private static final Logger log = LoggerFactory.getLogger(ReportMarkdownExtractor.class);

    private static final Pattern CHECKED_ITEM = Pattern.compile("^- \\[x] \\*\\*\\[(.+?)]\\*\\* (.+)$");
    private static final Pattern FILE_FIELD = Pattern.compile("- \\*\\*File\\*\\*: `(.+?)`(:(\\d+))?");
    private static final Pattern ISSUE_FIELD = Pattern.compile("- \\*\\*Issue\\*\\*: (.+)");
    private static final Pattern SUGGESTION_FIELD = Pattern.compile("- \\*\\*Suggestion\\*\\*: (.+)");
    private static final String CODE_FIELD = "- **Code**:";
    private static final String FENCE = "```";
    private static final String CHECKBOX_PREFIX = "- [";
    private static final String HEADING_PREFIX = "##";
    private static final Pattern CODE_INDENT = Pattern.compile("^\\s{4}");

    private enum State {
        SCANNING,
        IN_ITEM,
        IN_CODE_FENCE
    }

    public List<ExtractedFinding> extract(Path reportPath) throws IOException {
        String content = Files.readString(reportPath, StandardCharsets.UTF_8);
        List<ExtractedFinding> findings = extract(content);
        log.info("Extracted {} checked finding(s) from {}", findings.size(), reportPath);
        return findings;
    }

    public List<ExtractedFinding> extract(String content) {
        List<ExtractedFinding> findings = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return findings;
        }

        String[] lines = content.split("\\r?\\n", -1);
        State state = State.SCANNING;
        ItemBuilder item = null;
        List<String> codeLines = null;

        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            switch (state) {
                case SCANNING -> {
                    Matcher matcher = CHECKED_ITEM.matcher(line);
                    if (matcher.matches()) {
                        item = new ItemBuilder(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2));
                        state = State.IN_ITEM;
                    }
                    i++;
                }
                case IN_ITEM -> {
                    if (endsItem(lines, i)) {
                        item.build().ifPresent(findings::add);
                        item = null;
                        state = State.SCANNING;
                        // the terminating line is re-examined while scanning
                        continue;
                    }
                    if (line.contains(CODE_FIELD) && i + 1 < lines.length
                            && lines[i + 1].trim().startsWith(FENCE)) {
                        codeLines = new ArrayList<>();
                        state = State.IN_CODE_FENCE;
                        i += 2;
                        continue;
                    }
                    item.readField(line);
                    i++;
                }
                case IN_CODE_FENCE -> {
                    if (line.trim().endsWith(FENCE)) {
                        item.code = String.join("\n", codeLines);
                        codeLines = null;
                        state = State.IN_ITEM;
                    } else {
                        codeLines.add(CODE_INDENT.matcher(line).replaceFirst(""));
                    }
                    i++;
                }
            }
        }

        if (state == State.IN_CODE_FENCE) {
            item.code = String.join("\n", codeLines);
        }
        if (item != null) {
            item.build().ifPresent(findings::add);
        }
        return findings;
    }

    private static boolean endsItem(String[] lines, int index) {
        String line = lines[index];
        if (line.startsWith(CHECKBOX_PREFIX) || line.startsWith(HEADING_PREFIX)) {
            return true;
        }
        return line.trim().isEmpty()
                && index + 1 < lines.length
                && lines[index + 1].startsWith(CHECKBOX_PREFIX);
    }

    private static final class ItemBuilder {
        private final String severity;
        private final String category;
        private String file;
        private Integer line;
        private String issue;
        private String suggestion;
        private String code;

        private ItemBuilder(String severity, String category) {
            this.severity = severity;
            this.category = category;
        }

        private void readField(String text) {
            Matcher fileMatcher = FILE_FIELD.matcher(text);
            if (fileMatcher.find()) {
                file = fileMatcher.group(1);
                line = parseLine(fileMatcher.group(3));
            }
            Matcher issueMatcher = ISSUE_FIELD.matcher(text);
            if (issueMatcher.find()) {
                issue = issueMatcher.group(1);
            }
            Matcher suggestionMatcher = SUGGESTION_FIELD.matcher(text);
            if (suggestionMatcher.find()) {
                suggestion = suggestionMatcher.group(1);
            }
        }

        private static Integer parseLine(String digits) {
            if (digits == null) {
                return null;
            }
            try {
                return Integer.valueOf(digits);
            } catch (NumberFormatException e) {
                log.debug("Ignoring out-of-range line number {}", digits);
                return null;
            }
        }

        private Optional<ExtractedFinding> build() {
            if (file == null || file.isEmpty() || issue == null || issue.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new ExtractedFinding(severity, category, file, line, issue, suggestion, code));
        }
    }
}
