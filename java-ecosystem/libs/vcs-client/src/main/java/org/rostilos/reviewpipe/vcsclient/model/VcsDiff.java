package org.rostilos.reviewpipe.vcsclient.model;

/**
 * Unified diff of a comparison with the counts version control reports for it.
 *
 * @param rawDiff      unified diff text, {@code diff --git} blocks
 * @param filesChanged number of files in the comparison
 * @param insertions   added lines across all files
 * @param deletions    removed lines across all files
 */
public record VcsDiff(
        String rawDiff,
        int filesChanged,
        int insertions,
        int deletions
) {
}
