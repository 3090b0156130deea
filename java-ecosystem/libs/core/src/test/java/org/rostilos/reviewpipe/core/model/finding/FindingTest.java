package org.rostilos.reviewpipe.core.model.finding;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Finding model")
class FindingTest {

    private static Finding finding(String file, String message) {
        return new Finding(FindingType.WARNING, Severity.HIGH, "Null Check", message, file, 12, null, null);
    }

    @Nested
    @DisplayName("Finding.isComplete()")
    class CompletenessTests {

        @Test
        @DisplayName("should be complete when file and message are present")
        void shouldBeCompleteWithFileAndMessage() {
            assertThat(finding("a.ts", "missing check").isComplete()).isTrue();
        }

        @Test
        @DisplayName("should be incomplete with blank file")
        void shouldBeIncompleteWithBlankFile() {
            assertThat(finding("  ", "missing check").isComplete()).isFalse();
            assertThat(finding(null, "missing check").isComplete()).isFalse();
        }

        @Test
        @DisplayName("should be incomplete with blank message")
        void shouldBeIncompleteWithBlankMessage() {
            assertThat(finding("a.ts", "").isComplete()).isFalse();
        }

        @Test
        @DisplayName("should be incomplete without severity")
        void shouldBeIncompleteWithoutSeverity() {
            Finding f = new Finding(FindingType.INFO, null, "x", "msg", "a.ts", null, null, null);
            assertThat(f.isComplete()).isFalse();
        }
    }

    @Test
    @DisplayName("location should append line when present")
    void locationShouldAppendLine() {
        assertThat(finding("a.ts", "m").location()).isEqualTo("a.ts:12");
        Finding noLine = new Finding(FindingType.INFO, Severity.LOW, "c", "m", "b.ts", null, null, null);
        assertThat(noLine.location()).isEqualTo("b.ts");
    }

    @Nested
    @DisplayName("StageResult")
    class StageResultTests {

        @Test
        @DisplayName("should copy findings defensively")
        void shouldCopyFindingsDefensively() {
            List<Finding> source = new ArrayList<>(List.of(finding("a.ts", "m")));
            StageResult result = StageResult.of("code-review", source, Duration.ofMillis(5), null);

            source.clear();

            assertThat(result.findings()).hasSize(1);
            assertThatThrownBy(() -> result.findings().add(finding("b.ts", "x")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("failed result should have no findings and keep elapsed")
        void failedResultShouldHaveNoFindings() {
            StageResult result = StageResult.failed("security", Duration.ofSeconds(2), "boom");

            assertThat(result.findings()).isEmpty();
            assertThat(result.elapsed()).isEqualTo(Duration.ofSeconds(2));
            assertThat(result.isFailed()).isTrue();
            assertThat(result.error()).isEqualTo("boom");
        }

        @Test
        @DisplayName("null elapsed should default to zero")
        void nullElapsedShouldDefaultToZero() {
            StageResult result = StageResult.of("perf", null, null, null);

            assertThat(result.elapsed()).isEqualTo(Duration.ZERO);
            assertThat(result.findings()).isEmpty();
            assertThat(result.isFailed()).isFalse();
        }
    }
}
