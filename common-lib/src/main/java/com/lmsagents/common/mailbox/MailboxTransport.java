package com.lmsagents.common.mailbox;

import com.lmsagents.common.exception.MailboxDeliveryException;

/**
 * Addressed, asynchronous, at-least-once delivery between worker mailboxes.
 *
 * <p>Order is preserved per sender→receiver path only. Implementations backed by an
 * external broker (XMPP, Kafka, ...) can replace {@link InMemoryMailboxTransport}
 * without any worker change.
 */
public interface MailboxTransport {

    /** Creates the mailbox for {@code address}, or returns the existing one. */
    Mailbox register(String address);

    /**
     * Enqueues the envelope for its destination and returns without waiting for receipt.
     *
     * @throws MailboxDeliveryException if the destination is not known to the transport
     */
    void send(Envelope envelope);
}
