package org.rostilos.reviewpipe.analysisengine.report;

import org.rostilos.reviewpipe.core.model.report.Report;

/**
 * Turns an aggregated report into one textual artifact.
 */
public interface ReportRenderer {

    String render(Report report);

    /**
     * Format tag matched against {@code reviewpipe.output.formats}, lower case.
     */
    String getFormat();

    /**
     * File extension including the leading dot.
     */
    String getFileExtension();
}
