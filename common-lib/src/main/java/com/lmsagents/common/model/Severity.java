package com.lmsagents.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Two-level risk classification. Pure function of the overall score:
 * below {@link #DANGER_BELOW} is {@code danger}, everything else {@code warning}.
 */
public enum Severity {
    WARNING("warning"),
    DANGER("danger");

    public static final double DANGER_BELOW = 30.0;

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    public static Severity fromScore(double score) {
        return score < DANGER_BELOW ? DANGER : WARNING;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        for (Severity s : values()) {
            if (s.wireName.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
