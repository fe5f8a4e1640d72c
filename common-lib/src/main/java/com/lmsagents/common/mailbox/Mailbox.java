package com.lmsagents.common.mailbox;

import java.time.Duration;
import java.util.Optional;

/** Addressed inbound queue owned by exactly one worker. */
public interface Mailbox {

    String address();

    /**
     * Blocks up to {@code timeout} for the next envelope.
     *
     * @return the oldest pending envelope, or empty when the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<Envelope> receive(Duration timeout) throws InterruptedException;
}
