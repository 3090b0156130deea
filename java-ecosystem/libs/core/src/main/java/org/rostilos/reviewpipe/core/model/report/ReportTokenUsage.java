package org.rostilos.reviewpipe.core.model.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ReportTokenUsage(
        int total,
        Map<String, Integer> byStage
) {
    public ReportTokenUsage {
        byStage = byStage == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(byStage));
    }
}
