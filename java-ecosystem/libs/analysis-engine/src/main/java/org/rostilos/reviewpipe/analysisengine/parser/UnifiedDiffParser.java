package org.rostilos.reviewpipe.analysisengine.parser;

import org.rostilos.reviewpipe.analysisengine.exception.DiffUnreadableException;
import org.rostilos.reviewpipe.core.model.diff.Change;
import org.rostilos.reviewpipe.core.model.diff.DiffStat;
import org.rostilos.reviewpipe.core.model.diff.FileDiff;
import org.rostilos.reviewpipe.core.model.diff.FileStatus;
import org.rostilos.reviewpipe.core.model.diff.ParsedDiff;
import org.rostilos.reviewpipe.vcsclient.VcsClientException;
import org.rostilos.reviewpipe.vcsclient.VcsDiffProvider;
import org.rostilos.reviewpipe.vcsclient.model.VcsDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts unified diff text into a line-addressable {@link ParsedDiff}.
 * <p>
 * The text is split into {@code diff --git} blocks that are parsed independently: a block whose
 * header does not carry an {@code a/<old> b/<new>} path pair is dropped, as is a file whose
 * extension is not supported. Neither condition fails the parse.
 */
public class UnifiedDiffParser {
    private static final Logger log = LoggerFactory.getLogger(UnifiedDiffParser.class);

    public static final Set<String> DEFAULT_SUPPORTED_EXTENSIONS =
            Collections.unmodifiableSet(new LinkedHashSet<>(List.of(".java", ".kt", ".ts", ".tsx", ".js", ".jsx")));

    private static final String BLOCK_MARKER = "diff --git ";
    private static final Pattern DIFF_GIT_PATTERN = Pattern.compile("^diff --git a/(.+?) b/(.+)$");
    private static final Pattern HUNK_HEADER_PATTERN = Pattern.compile("^@@ -\\d+(?:,\\d+)? \\+(\\d+)(?:,\\d+)? @@");

    private final Set<String> supportedExtensions;
    private final VcsDiffProvider vcsDiffProvider;

    public UnifiedDiffParser() {
        this(DEFAULT_SUPPORTED_EXTENSIONS, null);
    }

    public UnifiedDiffParser(Collection<String> supportedExtensions) {
        this(supportedExtensions, null);
    }

    /**
     * @param supportedExtensions file suffixes to keep, e.g. {@code .ts}
     * @param vcsDiffProvider     resolves commit and range sources; may be null when only text or file sources are parsed
     */
    public UnifiedDiffParser(Collection<String> supportedExtensions, VcsDiffProvider vcsDiffProvider) {
        this.supportedExtensions = Collections.unmodifiableSet(new LinkedHashSet<>(supportedExtensions));
        this.vcsDiffProvider = vcsDiffProvider;
    }

    /**
     * Resolve the source to diff text and parse it.
     *
     * @throws DiffUnreadableException if the file cannot be read or the revision cannot be resolved
     */
    public ParsedDiff parse(DiffSource source) {
        if (source instanceof DiffSource.Text text) {
            return parse(text.content());
        }
        if (source instanceof DiffSource.File file) {
            String content;
            try {
                content = Files.readString(file.path(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new DiffUnreadableException(source.describe(), e.getMessage(), e);
            }
            return parse(content);
        }
        VcsDiffProvider vcs = requireVcs(source);
        VcsDiff vcsDiff;
        try {
            if (source instanceof DiffSource.Commit commit) {
                vcsDiff = vcs.getCommitDiff(commit.commitRef());
            } else {
                DiffSource.Range range = (DiffSource.Range) source;
                vcsDiff = vcs.getRangeDiff(range.fromRef(), range.toRef());
            }
        } catch (VcsClientException e) {
            throw new DiffUnreadableException(source.describe(), e.getMessage(), e);
        }
        return parse(vcsDiff.rawDiff(),
                new DiffStat(vcsDiff.filesChanged(), vcsDiff.insertions(), vcsDiff.deletions()));
    }

    public ParsedDiff parse(String rawDiff) {
        return parse(rawDiff, null);
    }

    /**
     * Parse diff text.
     *
     * @param rawDiff unified diff; null or blank yields an empty diff
     * @param stat    statistics from version control used for the summary line, may be null
     */
    public ParsedDiff parse(String rawDiff, DiffStat stat) {
        if (rawDiff == null || rawDiff.isBlank()) {
            return ParsedDiff.of(List.of(), stat);
        }

        List<FileDiff> files = new ArrayList<>();
        int blocks = 0;
        for (List<String> block : splitBlocks(rawDiff)) {
            blocks++;
            FileDiff fileDiff = parseBlock(block);
            if (fileDiff == null) {
                log.debug("Skipping malformed diff block starting with: {}", block.get(0));
                continue;
            }
            if (!isSupported(fileDiff.getPath())) {
                log.debug("Skipping unsupported file: {}", fileDiff.getPath());
                continue;
            }
            files.add(fileDiff);
        }

        ParsedDiff parsed = ParsedDiff.of(files, stat);
        log.info("Parsed {} of {} file block(s): {}", files.size(), blocks, parsed.getSummary());
        return parsed;
    }

    public boolean isSupported(String path) {
        for (String extension : supportedExtensions) {
            if (path.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getSupportedExtensions() {
        return supportedExtensions;
    }

    /**
     * Split on {@code diff --git} boundaries. Text before the first boundary is not part of any block.
     */
    private List<List<String>> splitBlocks(String rawDiff) {
        List<List<String>> blocks = new ArrayList<>();
        List<String> current = null;
        for (String line : rawDiff.split("\\r?\\n")) {
            if (line.startsWith(BLOCK_MARKER)) {
                current = new ArrayList<>();
                blocks.add(current);
            }
            if (current != null) {
                current.add(line);
            }
        }
        return blocks;
    }

    private FileDiff parseBlock(List<String> lines) {
        Matcher header = DIFF_GIT_PATTERN.matcher(lines.get(0));
        if (!header.matches()) {
            return null;
        }
        String oldPath = header.group(1);
        String newPath = header.group(2);

        boolean newFile = false;
        boolean deletedFile = false;
        boolean inHunk = false;
        int currentLine = 0;
        List<Change> changes = new ArrayList<>();

        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher hunk = HUNK_HEADER_PATTERN.matcher(line);
            if (hunk.find()) {
                try {
                    currentLine = Integer.parseInt(hunk.group(1));
                } catch (NumberFormatException e) {
                    log.debug("Hunk start out of range in {}: {}", newPath, line);
                    return null;
                }
                inHunk = true;
                continue;
            }

            if (!inHunk) {
                if (line.startsWith("new file mode")) {
                    newFile = true;
                } else if (line.startsWith("deleted file mode")) {
                    deletedFile = true;
                }
                continue;
            }

            if (line.startsWith("+") && !line.startsWith("+++")) {
                changes.add(Change.added(currentLine, line.substring(1)));
                currentLine++;
            } else if (line.startsWith("-") && !line.startsWith("---")) {
                // removed lines do not exist in the new file, the counter stays put
                changes.add(Change.deleted(currentLine, line.substring(1)));
            } else if (line.startsWith(" ")) {
                changes.add(Change.context(currentLine, line.substring(1)));
                currentLine++;
            }
        }

        FileStatus status;
        if (newFile) {
            status = FileStatus.ADDED;
        } else if (deletedFile) {
            status = FileStatus.DELETED;
        } else if (!oldPath.equals(newPath)) {
            status = FileStatus.RENAMED;
        } else {
            status = FileStatus.MODIFIED;
        }

        return new FileDiff(newPath, oldPath.equals(newPath) ? null : oldPath, status, changes);
    }

    private VcsDiffProvider requireVcs(DiffSource source) {
        if (vcsDiffProvider == null) {
            throw new DiffUnreadableException(source.describe(), "no version control provider configured");
        }
        return vcsDiffProvider;
    }
}
