package org.rostilos.reviewpipe.vcsclient;

import org.rostilos.reviewpipe.vcsclient.model.VcsDiff;

/**
 * Resolves revisions of a repository into unified diff text plus statistics.
 */
public interface VcsDiffProvider {

    /**
     * Git's well-known empty tree object, used as the base of a root commit.
     */
    String EMPTY_TREE_SHA = "4b825dc642cb6eb9a060e54bf8d69288fbee4904";

    /**
     * Diff a single commit against its first parent, or against the empty tree
     * when the commit has no parent.
     *
     * @param commitRef any revision expression (hash, branch, {@code HEAD~2}, ...)
     * @return the unified diff and its statistics
     * @throws VcsClientException if the repository or the revision cannot be read
     */
    VcsDiff getCommitDiff(String commitRef);

    /**
     * Diff two revisions. {@link #EMPTY_TREE_SHA} is accepted as {@code fromRef}.
     *
     * @throws VcsClientException if the repository or either revision cannot be read
     */
    VcsDiff getRangeDiff(String fromRef, String toRef);
}
