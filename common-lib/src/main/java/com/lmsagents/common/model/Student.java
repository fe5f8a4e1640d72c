package com.lmsagents.common.model;

public record Student(
    long id,
    String username,
    String fullName
) {
    /** Full name when present, otherwise the login name. */
    public String displayName() {
        return fullName != null && !fullName.isBlank() ? fullName : username;
    }
}
