package com.lmsagents.common.mailbox;

import com.lmsagents.common.exception.MailboxDeliveryException;
import com.lmsagents.common.message.AgentMessage;
import com.lmsagents.common.message.MessageCodec;

import java.time.Clock;

/**
 * Outbound side of one worker: encodes a message, stamps the worker's own address as
 * sender and hands the envelope to the transport.
 */
public class AgentMessenger {

    private final String senderAddress;
    private final MailboxTransport transport;
    private final MessageCodec codec;
    private final Clock clock;

    public AgentMessenger(String senderAddress, MailboxTransport transport, MessageCodec codec, Clock clock) {
        this.senderAddress = senderAddress;
        this.transport     = transport;
        this.codec         = codec;
        this.clock         = clock;
    }

    /**
     * @throws MailboxDeliveryException when the destination is unknown; callers log and continue
     */
    public Envelope send(String destination, AgentMessage message, String traceId) {
        Envelope envelope = new Envelope(senderAddress, destination, codec.encode(message), traceId, clock.instant());
        transport.send(envelope);
        return envelope;
    }
}
