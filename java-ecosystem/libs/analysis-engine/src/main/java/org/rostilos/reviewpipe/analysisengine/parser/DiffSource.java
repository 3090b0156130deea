package org.rostilos.reviewpipe.analysisengine.parser;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the unified diff text comes from.
 */
public sealed interface DiffSource permits DiffSource.Text, DiffSource.File, DiffSource.Commit, DiffSource.Range {

    /**
     * Human-readable description used in logs and error messages.
     */
    String describe();

    static DiffSource ofText(String content) {
        return new Text(content);
    }

    static DiffSource ofFile(Path path) {
        return new File(path);
    }

    static DiffSource ofCommit(String commitRef) {
        return new Commit(commitRef);
    }

    static DiffSource ofRange(String fromRef, String toRef) {
        return new Range(fromRef, toRef);
    }

    record Text(String content) implements DiffSource {
        @Override
        public String describe() {
            return "inline diff text";
        }
    }

    record File(Path path) implements DiffSource {
        public File {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String describe() {
            return "file " + path;
        }
    }

    record Commit(String commitRef) implements DiffSource {
        public Commit {
            Objects.requireNonNull(commitRef, "commitRef");
        }

        @Override
        public String describe() {
            return "commit " + commitRef;
        }
    }

    record Range(String fromRef, String toRef) implements DiffSource {
        public Range {
            Objects.requireNonNull(fromRef, "fromRef");
            Objects.requireNonNull(toRef, "toRef");
        }

        @Override
        public String describe() {
            return "range " + fromRef + ".." + toRef;
        }
    }
}
