package org.rostilos.reviewpipe.core.model.finding;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FindingType {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String value;

    FindingType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FindingType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Finding type must not be blank");
        }
        String normalized = value.trim().toLowerCase();
        for (FindingType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown finding type: " + value);
    }
}
