package org.rostilos.reviewpipe.core.model.diff;

import java.util.Objects;

/**
 * One line of a file's hunk.
 *
 * @param type       add, delete or context
 * @param lineNumber 1-based line in the new file; for deletions the counter value at the point of deletion
 * @param content    raw line text without the diff marker
 */
public record Change(
        ChangeType type,
        int lineNumber,
        String content
) {
    public Change {
        Objects.requireNonNull(type, "type");
        content = content == null ? "" : content;
    }

    public static Change added(int lineNumber, String content) {
        return new Change(ChangeType.ADD, lineNumber, content);
    }

    public static Change deleted(int lineNumber, String content) {
        return new Change(ChangeType.DELETE, lineNumber, content);
    }

    public static Change context(int lineNumber, String content) {
        return new Change(ChangeType.CONTEXT, lineNumber, content);
    }
}
