package org.rostilos.reviewpipe.analysisengine.extract;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A finding recovered from a ticked checklist item.
 *
 * @param severity lower-cased tag as written in the report; not validated
 * @param line     null when the File field carries no {@code :<line>} suffix
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedFinding(
        String severity,
        String category,
        String file,
        Integer line,
        String issue,
        String suggestion,
        String code
) {
}
