package org.rostilos.reviewpipe.core.model.finding;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Finding severity. Declaration order is significance order, CRITICAL first.
 */
public enum Severity {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Case-insensitive lookup by tag.
     *
     * @throws IllegalArgumentException for blank or unknown tags
     */
    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        String normalized = value.trim().toLowerCase();
        for (Severity severity : values()) {
            if (severity.value.equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
