package org.rostilos.reviewpipe.analysisengine.parser;

import org.assertj.core.groups.Tuple;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rostilos.reviewpipe.analysisengine.exception.DiffUnreadableException;
import org.rostilos.reviewpipe.core.model.diff.Change;
import org.rostilos.reviewpipe.core.model.diff.ChangeType;
import org.rostilos.reviewpipe.core.model.diff.FileDiff;
import org.rostilos.reviewpipe.core.model.diff.FileStatus;
import org.rostilos.reviewpipe.core.model.diff.ParsedDiff;
import org.rostilos.reviewpipe.vcsclient.VcsClientException;
import org.rostilos.reviewpipe.vcsclient.VcsDiffProvider;
import org.rostilos.reviewpipe.vcsclient.model.VcsDiff;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("UnifiedDiffParser")
class UnifiedDiffParserTest {

    private final UnifiedDiffParser parser = new UnifiedDiffParser(List.of(".ts", ".tsx", ".js", ".jsx"));

    private static final String TWO_FILE_DIFF = """
            diff --git a/src/service.ts b/src/service.ts
            index abc123..def456 100644
            --- a/src/service.ts
            +++ b/src/service.ts
            @@ -10,4 +10,5 @@ export class Service {
               constructor() {}
            -  run() {}
            +  run(): void {}
            +  stop(): void {}
               dispose() {}
            @@ -40,2 +41,2 @@
            -const a = 1;
            +const a = 2;
             export default Service;
            diff --git a/README.md b/README.md
            index 111111..222222 100644
            --- a/README.md
            +++ b/README.md
            @@ -1,1 +1,2 @@
             # Title
            +More docs
            """;

    @Nested
    @DisplayName("parse(String)")
    class ParseTextTests {

        @Test
        @DisplayName("should return empty diff for null and blank input")
        void shouldReturnEmptyForNullOrBlank() {
            assertThat(parser.parse((String) null).getFiles()).isEmpty();
            assertThat(parser.parse("   ").getFiles()).isEmpty();
        }

        @Test
        @DisplayName("should parse the documented example exactly")
        void shouldParseDocumentedExample() {
            ParsedDiff diff = parser.parse("diff --git a/x.ts b/x.ts\n@@ -1,2 +1,3 @@\n line1\n+added\n-old\n");

            assertThat(diff.getFiles()).hasSize(1);
            FileDiff file = diff.getFiles().get(0);
            assertThat(file.getPath()).isEqualTo("x.ts");
            assertThat(file.getStatus()).isEqualTo(FileStatus.MODIFIED);
            assertThat(file.getAdditions()).isEqualTo(1);
            assertThat(file.getDeletions()).isEqualTo(1);
            assertThat(file.getChanges()).containsExactly(
                    Change.context(1, "line1"),
                    Change.added(2, "added"),
                    Change.deleted(3, "old"));
        }

        @Test
        @DisplayName("delete as first hunk line should carry the hunk new-start value")
        void deleteAsFirstHunkLineShouldCarryNewStart() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/a.ts b/a.ts
                    @@ -5,3 +5,2 @@
                    -gone
                     kept
                     kept2
                    """);

            assertThat(diff.getFiles().get(0).getChanges()).containsExactly(
                    Change.deleted(5, "gone"),
                    Change.context(5, "kept"),
                    Change.context(6, "kept2"));
        }

        @Test
        @DisplayName("should reset the counter on every hunk and concatenate hunks in order")
        void shouldResetCounterPerHunk() {
            FileDiff file = parser.parse(TWO_FILE_DIFF).getFiles().get(0);

            assertThat(file.getChanges())
                    .extracting(Change::type, Change::lineNumber)
                    .containsExactly(
                            Tuple.tuple(ChangeType.CONTEXT, 10),
                            Tuple.tuple(ChangeType.DELETE, 11),
                            Tuple.tuple(ChangeType.ADD, 11),
                            Tuple.tuple(ChangeType.ADD, 12),
                            Tuple.tuple(ChangeType.CONTEXT, 13),
                            Tuple.tuple(ChangeType.DELETE, 41),
                            Tuple.tuple(ChangeType.ADD, 41),
                            Tuple.tuple(ChangeType.CONTEXT, 42));
        }

        @Test
        @DisplayName("should strip exactly the diff marker from content")
        void shouldStripMarkerOnly() {
            FileDiff file = parser.parse(TWO_FILE_DIFF).getFiles().get(0);

            assertThat(file.getChanges().get(0).content()).isEqualTo("  constructor() {}");
            assertThat(file.getChanges().get(2).content()).isEqualTo("  run(): void {}");
        }

        @Test
        @DisplayName("should accept hunk headers without counts")
        void shouldAcceptHunkHeadersWithoutCounts() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/one.js b/one.js
                    @@ -1 +1 @@
                    -a
                    +b
                    """);

            assertThat(diff.getFiles().get(0).getChanges()).containsExactly(
                    Change.deleted(1, "a"),
                    Change.added(1, "b"));
        }

        @Test
        @DisplayName("should ignore no-newline markers, file headers and metadata")
        void shouldIgnoreMetadataLines() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/m.ts b/m.ts
                    index 1..2 100644
                    --- a/m.ts
                    +++ b/m.ts
                    @@ -1,1 +1,1 @@
                    -old
                    \\ No newline at end of file
                    +new
                    \\ No newline at end of file
                    """);

            FileDiff file = diff.getFiles().get(0);
            assertThat(file.getChanges()).hasSize(2);
            assertThat(file.getAdditions()).isEqualTo(1);
            assertThat(file.getDeletions()).isEqualTo(1);
        }

        @Test
        @DisplayName("should handle CRLF line endings")
        void shouldHandleCrlf() {
            ParsedDiff diff = parser.parse("diff --git a/w.ts b/w.ts\r\n@@ -1,1 +1,2 @@\r\n a\r\n+b\r\n");

            assertThat(diff.getFiles().get(0).getChanges()).containsExactly(
                    Change.context(1, "a"),
                    Change.added(2, "b"));
        }
    }

    @Nested
    @DisplayName("status classification")
    class StatusTests {

        @Test
        @DisplayName("should detect new file mode")
        void shouldDetectNewFileMode() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/src/new.ts b/src/new.ts
                    new file mode 100644
                    index 0000000..abc123
                    --- /dev/null
                    +++ b/src/new.ts
                    @@ -0,0 +1,2 @@
                    +export const x = 1;
                    +export const y = 2;
                    """);

            FileDiff file = diff.getFiles().get(0);
            assertThat(file.getStatus()).isEqualTo(FileStatus.ADDED);
            assertThat(file.getChanges()).extracting(Change::lineNumber).containsExactly(1, 2);
        }

        @Test
        @DisplayName("should detect deleted file mode")
        void shouldDetectDeletedFileMode() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/src/old.ts b/src/old.ts
                    deleted file mode 100644
                    index abc123..0000000
                    --- a/src/old.ts
                    +++ /dev/null
                    @@ -1,2 +0,0 @@
                    -a
                    -b
                    """);

            FileDiff file = diff.getFiles().get(0);
            assertThat(file.getStatus()).isEqualTo(FileStatus.DELETED);
            assertThat(file.getDeletions()).isEqualTo(2);
            assertThat(file.getChanges()).extracting(Change::lineNumber).containsExactly(0, 0);
        }

        @Test
        @DisplayName("renamed file should keep both paths")
        void renamedFileShouldKeepBothPaths() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/src/OldName.ts b/src/NewName.ts
                    similarity index 95%
                    rename from src/OldName.ts
                    rename to src/NewName.ts
                    @@ -1,1 +1,1 @@
                    -class OldName {}
                    +class NewName {}
                    """);

            FileDiff file = diff.getFiles().get(0);
            assertThat(file.getStatus()).isEqualTo(FileStatus.RENAMED);
            assertThat(file.getPath()).isEqualTo("src/NewName.ts");
            assertThat(file.getOldPath()).contains("src/OldName.ts");
        }

        @Test
        @DisplayName("non-renamed file should omit old path")
        void nonRenamedShouldOmitOldPath() {
            FileDiff file = parser.parse(TWO_FILE_DIFF).getFiles().get(0);

            assertThat(file.getOldPath()).isEmpty();
        }

        @Test
        @DisplayName("marker text inside hunk content should not change status")
        void markerInsideContentShouldNotChangeStatus() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/doc.ts b/doc.ts
                    @@ -1,1 +1,2 @@
                     // notes
                    +// new file mode is printed by git
                    """);

            assertThat(diff.getFiles().get(0).getStatus()).isEqualTo(FileStatus.MODIFIED);
        }
    }

    @Nested
    @DisplayName("filtering and malformed input")
    class FilteringTests {

        @Test
        @DisplayName("should keep only supported extensions and total over them")
        void shouldKeepOnlySupportedExtensions() {
            ParsedDiff diff = parser.parse(TWO_FILE_DIFF);

            assertThat(diff.getFiles()).extracting(FileDiff::getPath).containsExactly("src/service.ts");
            assertThat(diff.getTotalAdditions()).isEqualTo(3);
            assertThat(diff.getTotalDeletions()).isEqualTo(2);
            assertThat(diff.getSummary()).isEqualTo("1 files changed, 3 insertions(+), 2 deletions(-)");
        }

        @Test
        @DisplayName("diff without supported files should be empty, not an error")
        void diffWithoutSupportedFilesShouldBeEmpty() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/notes.txt b/notes.txt
                    @@ -1,1 +1,1 @@
                    -a
                    +b
                    """);

            assertThat(diff.isEmpty()).isTrue();
            assertThat(diff.getTotalAdditions()).isZero();
        }

        @Test
        @DisplayName("should drop blocks with unexpected headers and keep the rest")
        void shouldDropMalformedBlocks() {
            ParsedDiff diff = parser.parse("""
                    commit preamble that is not part of any block
                    +not a change
                    diff --git broken-header
                    @@ -1,1 +1,1 @@
                    +ignored
                    diff --git a/ok.ts b/ok.ts
                    @@ -1,1 +1,2 @@
                     a
                    +b
                    """);

            assertThat(diff.getFiles()).extracting(FileDiff::getPath).containsExactly("ok.ts");
            assertThat(diff.getTotalAdditions()).isEqualTo(1);
        }

        @Test
        @DisplayName("should drop a block whose hunk start does not fit a line number")
        void shouldDropBlockWithOutOfRangeHunkStart() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/bad.ts b/bad.ts
                    @@ -1 +99999999999 @@
                    +overflow
                    diff --git a/good.ts b/good.ts
                    @@ -1,1 +1,2 @@
                     a
                    +b
                    """);

            assertThat(diff.getFiles()).extracting(FileDiff::getPath).containsExactly("good.ts");
            assertThat(diff.getTotalAdditions()).isEqualTo(1);
        }

        @Test
        @DisplayName("should ignore change-like lines before the first hunk")
        void shouldIgnoreLinesBeforeFirstHunk() {
            ParsedDiff diff = parser.parse("""
                    diff --git a/small.js b/small.js
                    +// tiny
                    """);

            assertThat(diff.getFiles()).hasSize(1);
            assertThat(diff.getFiles().get(0).getChanges()).isEmpty();
        }

        @Test
        @DisplayName("additions across files should equal sum of add changes")
        void additionsShouldEqualAddChanges() {
            ParsedDiff diff = new UnifiedDiffParser(List.of(".ts", ".md")).parse(TWO_FILE_DIFF);

            long addChanges = diff.getFiles().stream()
                    .flatMap(f -> f.getChanges().stream())
                    .filter(c -> c.type() == ChangeType.ADD)
                    .count();
            assertThat(diff.getTotalAdditions()).isEqualTo((int) addChanges).isEqualTo(4);
            assertThat(diff.getFiles()).hasSize(2);
        }

        @Test
        @DisplayName("line numbers should advance exactly on add and context lines")
        void lineNumbersShouldAdvanceOnAddAndContext() {
            FileDiff file = parser.parse(TWO_FILE_DIFF).getFiles().get(0);
            List<Change> changes = file.getChanges();

            List<Integer> advancing = changes.stream()
                    .filter(c -> c.type() != ChangeType.DELETE)
                    .map(Change::lineNumber)
                    .toList();
            assertThat(advancing).isSorted().doesNotHaveDuplicates().containsExactly(10, 11, 12, 13, 41, 42);

            for (int i = 0; i < changes.size() - 1; i++) {
                if (changes.get(i).type() == ChangeType.DELETE) {
                    assertThat(changes.get(i).lineNumber()).isEqualTo(changes.get(i + 1).lineNumber());
                }
            }
        }

        @Test
        @DisplayName("default extensions should include java and typescript")
        void defaultExtensions() {
            UnifiedDiffParser defaults = new UnifiedDiffParser();

            assertThat(defaults.isSupported("src/Main.java")).isTrue();
            assertThat(defaults.isSupported("web/app.tsx")).isTrue();
            assertThat(defaults.isSupported("build.gradle")).isFalse();
        }
    }

    @Nested
    @DisplayName("parse(DiffSource)")
    class ParseSourceTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should read diff from file")
        void shouldReadDiffFromFile() throws Exception {
            Path file = tempDir.resolve("change.diff");
            Files.writeString(file, TWO_FILE_DIFF);

            ParsedDiff diff = parser.parse(DiffSource.ofFile(file));

            assertThat(diff.getFiles()).hasSize(1);
        }

        @Test
        @DisplayName("missing file should be unreadable")
        void missingFileShouldBeUnreadable() {
            Path missing = tempDir.resolve("missing.diff");

            assertThatThrownBy(() -> parser.parse(DiffSource.ofFile(missing)))
                    .isInstanceOf(DiffUnreadableException.class)
                    .hasMessageContaining("missing.diff");
        }

        @Test
        @DisplayName("should parse inline text source")
        void shouldParseInlineText() {
            assertThat(parser.parse(DiffSource.ofText(TWO_FILE_DIFF)).getFiles()).hasSize(1);
        }

        @Test
        @DisplayName("commit source should use VCS statistics for the summary")
        void commitSourceShouldUseVcsStatistics() {
            VcsDiffProvider vcs = mock(VcsDiffProvider.class);
            when(vcs.getCommitDiff("abc123")).thenReturn(new VcsDiff(TWO_FILE_DIFF, 2, 4, 2));
            UnifiedDiffParser vcsParser = new UnifiedDiffParser(List.of(".ts"), vcs);

            ParsedDiff diff = vcsParser.parse(DiffSource.ofCommit("abc123"));

            assertThat(diff.getFiles()).hasSize(1);
            assertThat(diff.getTotalAdditions()).isEqualTo(3);
            assertThat(diff.getSummary()).isEqualTo("2 files changed, 4 insertions(+), 2 deletions(-)");
        }

        @Test
        @DisplayName("root commit diff should classify every file as added")
        void rootCommitShouldClassifyFilesAsAdded() {
            String rootDiff = """
                    diff --git a/a.ts b/a.ts
                    new file mode 100644
                    index 0000000..1111111
                    --- /dev/null
                    +++ b/a.ts
                    @@ -0,0 +1 @@
                    +a
                    diff --git a/b.js b/b.js
                    new file mode 100644
                    index 0000000..2222222
                    --- /dev/null
                    +++ b/b.js
                    @@ -0,0 +1,2 @@
                    +b
                    +c
                    """;
            VcsDiffProvider vcs = mock(VcsDiffProvider.class);
            when(vcs.getRangeDiff(VcsDiffProvider.EMPTY_TREE_SHA, "root")).thenReturn(new VcsDiff(rootDiff, 2, 3, 0));
            UnifiedDiffParser vcsParser = new UnifiedDiffParser(List.of(".ts", ".js"), vcs);

            ParsedDiff diff = vcsParser.parse(DiffSource.ofRange(VcsDiffProvider.EMPTY_TREE_SHA, "root"));

            assertThat(diff.getFiles()).extracting(FileDiff::getStatus)
                    .containsOnly(FileStatus.ADDED)
                    .hasSize(2);
        }

        @Test
        @DisplayName("unresolvable revision should be unreadable")
        void unresolvableRevisionShouldBeUnreadable() {
            VcsDiffProvider vcs = mock(VcsDiffProvider.class);
            when(vcs.getCommitDiff("nope")).thenThrow(new VcsClientException("Cannot resolve revision: nope"));
            UnifiedDiffParser vcsParser = new UnifiedDiffParser(List.of(".ts"), vcs);

            assertThatThrownBy(() -> vcsParser.parse(DiffSource.ofCommit("nope")))
                    .isInstanceOf(DiffUnreadableException.class)
                    .hasMessageContaining("commit nope")
                    .hasCauseInstanceOf(VcsClientException.class);
        }

        @Test
        @DisplayName("commit source without provider should be unreadable")
        void commitSourceWithoutProviderShouldBeUnreadable() {
            assertThatThrownBy(() -> parser.parse(DiffSource.ofCommit("HEAD")))
                    .isInstanceOf(DiffUnreadableException.class);
        }
    }
}
