package com.lmsagents.common.message;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Well-formed JSON whose {@code type} is not part of the protocol. Kept so the router
 * can still audit it before ignoring it.
 *
 * @param rawType the {@code type} value as received, {@code null} when absent
 * @param payload the full JSON object
 */
public record UnknownMessage(String rawType, JsonNode payload) implements AgentMessage {

    @Override
    public MessageType type() {
        return MessageType.UNKNOWN;
    }

    @Override
    public Long studentId() {
        JsonNode id = payload == null ? null : payload.get("student_id");
        return id != null && id.canConvertToLong() ? id.asLong() : null;
    }

    @Override
    public String eventName() {
        return rawType != null ? rawType : MessageType.UNKNOWN.wireName();
    }
}
