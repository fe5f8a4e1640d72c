package com.lmsagents.common.exception;

/**
 * Failure detected inside one worker or one of its collaborators. None of these ever
 * crosses a receive or tick loop: the loop logs and moves on.
 */
public class AgentException extends RuntimeException {

    /** What went wrong, independent of which component noticed it. */
    public enum Fault {
        /** Envelope could not be handed to its destination mailbox. */
        DELIVERY,
        /** Inbound body is not a decodable message. */
        MALFORMED_MESSAGE,
        /** Outbound message could not be serialised. */
        ENCODING,
        /** Recommendation generator answered with nothing usable. */
        GENERATOR_RESPONSE
    }

    private final String component;
    private final Fault fault;

    public AgentException(String component, Fault fault, String message) {
        super(format(component, fault, message));
        this.component = component;
        this.fault     = fault;
    }

    public AgentException(String component, Fault fault, String message, Throwable cause) {
        super(format(component, fault, message), cause);
        this.component = component;
        this.fault     = fault;
    }

    /** Worker address or component name that raised the failure. */
    public String getComponent() {
        return component;
    }

    public Fault getFault() {
        return fault;
    }

    private static String format(String component, Fault fault, String message) {
        return "[" + component + "] " + fault + ": " + message;
    }
}
