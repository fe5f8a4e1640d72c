package com.lmsagents.common.model;

import java.time.Instant;

/**
 * Audit row written by the router: one per inbound event (payload set, decision null)
 * and one per routing decision (decision set, target usually set). Immutable.
 */
public record DecisionLogEntry(
    Long id,
    String eventType,
    String sourceAgent,
    String targetAgent,
    Long studentId,
    String payload,
    String decision,
    Instant createdAt
) {
    public static DecisionLogEntry inbound(String eventType, String sourceAgent, Long studentId,
                                           String payload, Instant createdAt) {
        return new DecisionLogEntry(null, eventType, sourceAgent, null, studentId, payload, null, createdAt);
    }

    public static DecisionLogEntry decision(String eventType, String targetAgent, Long studentId,
                                            String decision, Instant createdAt) {
        return new DecisionLogEntry(null, eventType, AgentRole.ORCHESTRATOR.wireName(), targetAgent,
                                    studentId, null, decision, createdAt);
    }

    public DecisionLogEntry withId(long newId) {
        return new DecisionLogEntry(newId, eventType, sourceAgent, targetAgent, studentId, payload, decision, createdAt);
    }

    public boolean isDecision() {
        return decision != null;
    }
}
