package com.lmsagents.common.exception;

/**
 * Raised to the sender when an envelope cannot be handed to its destination mailbox,
 * e.g. because no worker registered that address.
 */
public class MailboxDeliveryException extends AgentException {
    private final String destination;

    public MailboxDeliveryException(String sender, String destination, String message) {
        super(sender, Fault.DELIVERY, message + " destination=" + destination);
        this.destination = destination;
    }

    public String getDestination() {
        return destination;
    }
}
