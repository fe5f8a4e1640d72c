package com.lmsagents.common.mailbox;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable unit of delivery between mailboxes.
 *
 * @param sender      address of the sending worker
 * @param destination address of the receiving mailbox
 * @param body        encoded message (see {@link com.lmsagents.common.message.MessageCodec})
 * @param traceId     correlation id carried from the originating event to every follow-up
 * @param sentAt      enqueue time
 */
public record Envelope(
    String sender,
    String destination,
    String body,
    String traceId,
    Instant sentAt
) {
    public Envelope {
        Objects.requireNonNull(destination, "destination is required");
        sender = sender == null ? "" : sender;
        traceId = traceId == null ? "unknown" : traceId;
    }
}
