package com.lmsagents.common.config;

/** Mailbox addresses of the four logical workers. */
public record AgentAddresses(
    String router,
    String monitoring,
    String adaptation,
    String notification
) {
    public static AgentAddresses forServer(String server) {
        return new AgentAddresses(
            "orchestrator@" + server,
            "monitoring@" + server,
            "adaptation@" + server,
            "notification@" + server);
    }
}
