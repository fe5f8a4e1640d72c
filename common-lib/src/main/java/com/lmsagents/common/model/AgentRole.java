package com.lmsagents.common.model;

/** Logical worker roles. Mailbox addresses are configuration; roles are protocol. */
public enum AgentRole {
    ORCHESTRATOR("orchestrator"),
    MONITORING("monitoring"),
    ADAPTATION("adaptation"),
    NOTIFICATION("notification");

    private final String wireName;

    AgentRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AgentRole fromWireName(String value) {
        for (AgentRole role : values()) {
            if (role.wireName.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown agent role: " + value);
    }
}
