package org.rostilos.reviewpipe.core.model.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derived counts of a report. {@code byStage} iterates in stage execution order.
 */
public record ReportSummary(
        int totalFindings,
        int critical,
        int high,
        int medium,
        int low,
        Map<String, Integer> byStage
) {
    public ReportSummary {
        byStage = byStage == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(byStage));
    }
}
