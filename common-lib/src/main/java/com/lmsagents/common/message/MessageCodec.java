package com.lmsagents.common.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lmsagents.common.exception.AgentException;
import com.lmsagents.common.exception.MalformedMessageException;

/**
 * JSON wire format for {@link AgentMessage}.
 *
 * <p>Bodies are flat objects with a {@code type} discriminator. Unknown keys are ignored,
 * an unrecognised {@code type} decodes to {@link UnknownMessage}, and anything that is not
 * a JSON object or lacks a required field raises {@link MalformedMessageException}.
 */
public class MessageCodec {

    public static final String TYPE_FIELD = "type";

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(AgentMessage message) {
        try {
            if (message instanceof UnknownMessage unknown) {
                return objectMapper.writeValueAsString(unknown.payload());
            }
            ObjectNode node = objectMapper.valueToTree(message);
            node.put(TYPE_FIELD, message.type().wireName());
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AgentException("codec", AgentException.Fault.ENCODING,
                                     "Failed to encode message type=" + message.type(), e);
        }
    }

    public AgentMessage decode(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedMessageException("Empty message body");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Unparseable message body", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("Message body is not a JSON object");
        }

        JsonNode typeNode = node.get(TYPE_FIELD);
        String rawType = typeNode == null || typeNode.isNull() ? null : typeNode.asText();
        MessageType type = MessageType.fromWireName(rawType);
        if (type == MessageType.UNKNOWN) {
            return new UnknownMessage(rawType, node);
        }
        try {
            return objectMapper.treeToValue(node, type.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("Invalid '" + rawType + "' payload: " + rootMessage(e), e);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
