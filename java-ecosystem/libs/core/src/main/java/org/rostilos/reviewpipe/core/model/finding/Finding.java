package org.rostilos.reviewpipe.core.model.finding;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One issue surfaced by an analysis stage.
 * Producers must drop findings that are not {@link #isComplete() complete}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Finding(
        FindingType type,
        Severity severity,
        String category,
        String message,
        String file,
        Integer line,
        String suggestion,
        String code
) {
    @JsonIgnore
    public boolean isComplete() {
        return type != null
                && severity != null
                && file != null && !file.isBlank()
                && message != null && !message.isBlank();
    }

    public String location() {
        return line != null ? file + ":" + line : file;
    }
}
