package com.lmsagents.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Origin of a recommendation text. */
public enum GeneratedBy {
    RULE("rule"),
    EXTERNAL("external");

    private final String wireName;

    GeneratedBy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static GeneratedBy fromWireName(String value) {
        return "external".equalsIgnoreCase(value) ? EXTERNAL : RULE;
    }
}
