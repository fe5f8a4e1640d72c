package com.lmsagents.common.exception;

/**
 * Raised by the message codec when a body cannot be parsed or misses a required field.
 * Receivers log and drop; the message is never retried.
 */
public class MalformedMessageException extends AgentException {

    public MalformedMessageException(String message) {
        super("codec", Fault.MALFORMED_MESSAGE, message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super("codec", Fault.MALFORMED_MESSAGE, message, cause);
    }
}
