package org.rostilos.reviewpipe.analysisengine.report;

import java.nio.file.Path;

public record ReportOutput(
        String format,
        Path path
) {
}
