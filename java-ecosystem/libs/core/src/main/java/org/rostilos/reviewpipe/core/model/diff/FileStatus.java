package org.rostilos.reviewpipe.core.model.diff;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FileStatus {
    ADDED("added"),
    MODIFIED("modified"),
    DELETED("deleted"),
    RENAMED("renamed");

    private final String value;

    FileStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
