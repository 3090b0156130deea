package org.rostilos.reviewpipe.core.model.diff;

/**
 * Statistical summary reported by version control for a whole comparison,
 * counted over every file regardless of extension filtering.
 */
public record DiffStat(
        int filesChanged,
        int insertions,
        int deletions
) {
    public String toSummary() {
        return String.format("%d files changed, %d insertions(+), %d deletions(-)",
                filesChanged, insertions, deletions);
    }
}
