package ru.tigran.researchsignalengine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which matrix a signal was detected in.
 */
public enum SourceType {
    SECTION("section"),
    THEME("theme");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
