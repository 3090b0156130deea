package org.rostilos.reviewpipe.core.model.diff;

import java.util.List;

/**
 * Full change set of one comparison, restricted to files with supported extensions.
 * An empty file list is a valid diff that simply has nothing to analyze.
 */
public final class ParsedDiff {
    private final List<FileDiff> files;
    private final int totalAdditions;
    private final int totalDeletions;
    private final String summary;

    private ParsedDiff(List<FileDiff> files, String summary) {
        this.files = List.copyOf(files);
        this.totalAdditions = this.files.stream().mapToInt(FileDiff::getAdditions).sum();
        this.totalDeletions = this.files.stream().mapToInt(FileDiff::getDeletions).sum();
        this.summary = summary != null
                ? summary
                : new DiffStat(this.files.size(), totalAdditions, totalDeletions).toSummary();
    }

    /**
     * @param files retained files in diff order
     * @param stat  VCS-provided statistics; when null the summary is computed from {@code files}
     */
    public static ParsedDiff of(List<FileDiff> files, DiffStat stat) {
        return new ParsedDiff(files, stat != null ? stat.toSummary() : null);
    }

    public static ParsedDiff of(List<FileDiff> files) {
        return of(files, null);
    }

    public List<FileDiff> getFiles() {
        return files;
    }

    public int getTotalAdditions() {
        return totalAdditions;
    }

    public int getTotalDeletions() {
        return totalDeletions;
    }

    public String getSummary() {
        return summary;
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
