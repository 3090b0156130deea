package org.rostilos.reviewpipe.core.model.diff;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Change set of one file within a parsed diff. Hunks are concatenated in file order.
 * Addition and deletion counts are derived from {@link #getChanges()} once, at construction.
 */
public final class FileDiff {
    private final String path;
    private final String oldPath;
    private final FileStatus status;
    private final List<Change> changes;
    private final int additions;
    private final int deletions;

    public FileDiff(String path, String oldPath, FileStatus status, List<Change> changes) {
        this.path = Objects.requireNonNull(path, "path");
        this.oldPath = oldPath;
        this.status = Objects.requireNonNull(status, "status");
        this.changes = changes == null ? List.of() : List.copyOf(changes);
        this.additions = (int) this.changes.stream().filter(c -> c.type() == ChangeType.ADD).count();
        this.deletions = (int) this.changes.stream().filter(c -> c.type() == ChangeType.DELETE).count();
    }

    public String getPath() {
        return path;
    }

    /**
     * Previous path, present only for renamed files.
     */
    public Optional<String> getOldPath() {
        return Optional.ofNullable(oldPath);
    }

    public FileStatus getStatus() {
        return status;
    }

    public List<Change> getChanges() {
        return changes;
    }

    public int getAdditions() {
        return additions;
    }

    public int getDeletions() {
        return deletions;
    }

    @Override
    public String toString() {
        return "FileDiff{" + status.getValue() + " " + path + " +" + additions + " -" + deletions + "}";
    }
}
