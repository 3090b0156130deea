package org.rostilos.reviewpipe.core.model.diff;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a single line inside a hunk, keyed by its unified-diff marker.
 */
public enum ChangeType {
    ADD("add", '+'),
    DELETE("delete", '-'),
    CONTEXT("context", ' ');

    private final String value;
    private final char marker;

    ChangeType(String value, char marker) {
        this.value = value;
        this.marker = marker;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public char getMarker() {
        return marker;
    }
}
