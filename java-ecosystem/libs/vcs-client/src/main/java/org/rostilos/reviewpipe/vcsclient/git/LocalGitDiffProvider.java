package org.rostilos.reviewpipe.vcsclient.git;

import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.rostilos.reviewpipe.vcsclient.VcsClientException;
import org.rostilos.reviewpipe.vcsclient.VcsDiffProvider;
import org.rostilos.reviewpipe.vcsclient.model.VcsDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link VcsDiffProvider} backed by a local git working copy, read through JGit.
 */
public class LocalGitDiffProvider implements VcsDiffProvider {
    private static final Logger log = LoggerFactory.getLogger(LocalGitDiffProvider.class);

    private final Path repositoryPath;

    public LocalGitDiffProvider(Path repositoryPath) {
        this.repositoryPath = repositoryPath;
    }

    @Override
    public VcsDiff getCommitDiff(String commitRef) {
        try (Repository repository = openRepository(); RevWalk walk = new RevWalk(repository)) {
            RevCommit commit = walk.parseCommit(resolve(repository, commitRef));

            AbstractTreeIterator oldTree;
            if (commit.getParentCount() == 0) {
                log.info("Commit {} has no parent, diffing against the empty tree", commit.getName());
                oldTree = new EmptyTreeIterator();
            } else {
                RevCommit parent = walk.parseCommit(commit.getParent(0).getId());
                oldTree = treeParser(repository, parent.getTree().getId());
            }

            return diff(repository, oldTree, treeParser(repository, commit.getTree().getId()));
        } catch (IOException e) {
            throw new VcsClientException("Failed to diff commit " + commitRef + ": " + e.getMessage(), e);
        }
    }

    @Override
    public VcsDiff getRangeDiff(String fromRef, String toRef) {
        try (Repository repository = openRepository(); RevWalk walk = new RevWalk(repository)) {
            AbstractTreeIterator oldTree;
            if (EMPTY_TREE_SHA.equals(fromRef)) {
                oldTree = new EmptyTreeIterator();
            } else {
                RevCommit from = walk.parseCommit(resolve(repository, fromRef));
                oldTree = treeParser(repository, from.getTree().getId());
            }
            RevCommit to = walk.parseCommit(resolve(repository, toRef));

            return diff(repository, oldTree, treeParser(repository, to.getTree().getId()));
        } catch (IOException e) {
            throw new VcsClientException(
                    "Failed to diff " + fromRef + ".." + toRef + ": " + e.getMessage(), e);
        }
    }

    private Repository openRepository() throws IOException {
        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(repositoryPath.toFile());
        if (builder.getGitDir() == null) {
            throw new VcsClientException("No git repository found at " + repositoryPath);
        }
        return builder.setMustExist(true).build();
    }

    private ObjectId resolve(Repository repository, String ref) throws IOException {
        ObjectId id;
        try {
            id = repository.resolve(ref + "^{commit}");
        } catch (RevisionSyntaxException e) {
            throw new VcsClientException("Invalid revision: " + ref, e);
        }
        if (id == null) {
            throw new VcsClientException("Cannot resolve revision: " + ref);
        }
        return id;
    }

    private CanonicalTreeParser treeParser(Repository repository, ObjectId treeId) throws IOException {
        CanonicalTreeParser parser = new CanonicalTreeParser();
        try (ObjectReader reader = repository.newObjectReader()) {
            parser.reset(reader, treeId);
        }
        return parser;
    }

    private VcsDiff diff(Repository repository, AbstractTreeIterator oldTree, AbstractTreeIterator newTree)
            throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.setRepository(repository);
            formatter.setDetectRenames(true);

            List<DiffEntry> entries = formatter.scan(oldTree, newTree);
            int insertions = 0;
            int deletions = 0;
            for (DiffEntry entry : entries) {
                for (Edit edit : formatter.toFileHeader(entry).toEditList()) {
                    insertions += edit.getLengthB();
                    deletions += edit.getLengthA();
                }
            }
            formatter.format(entries);
            formatter.flush();

            log.debug("Diff resolved: {} files, +{} -{}", entries.size(), insertions, deletions);
            return new VcsDiff(out.toString(StandardCharsets.UTF_8), entries.size(), insertions, deletions);
        }
    }
}
