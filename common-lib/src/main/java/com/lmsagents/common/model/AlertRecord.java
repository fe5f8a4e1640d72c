package com.lmsagents.common.model;

import java.time.Instant;

/**
 * Instructor-facing alert. Written by the monitoring worker (performance summary, also
 * its dedup marker) and by the notification worker (routed alert).
 * Append-only apart from the read flag.
 */
public record AlertRecord(
    Long id,
    AgentRole source,
    long studentId,
    String text,
    Severity severity,
    boolean read,
    Instant createdAt
) {
    public static AlertRecord unread(AgentRole source, long studentId, String text,
                                     Severity severity, Instant createdAt) {
        return new AlertRecord(null, source, studentId, text, severity, false, createdAt);
    }

    public AlertRecord withId(long newId) {
        return new AlertRecord(newId, source, studentId, text, severity, read, createdAt);
    }

    public AlertRecord markedRead() {
        return read ? this : new AlertRecord(id, source, studentId, text, severity, true, createdAt);
    }
}
