package com.lmsagents.common.mailbox;

import com.lmsagents.common.exception.AgentException;
import com.lmsagents.common.exception.MailboxDeliveryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMailboxTransportTest {

    private final InMemoryMailboxTransport transport = new InMemoryMailboxTransport();

    private static Envelope envelope(String to, String body) {
        return new Envelope("monitoring@localhost", to, body, "t-1", Instant.EPOCH);
    }

    @Test
    @DisplayName("messages from one sender arrive in send order")
    void fifoPerSender() throws InterruptedException {
        Mailbox inbox = transport.register("orchestrator@localhost");
        transport.send(envelope("orchestrator@localhost", "first"));
        transport.send(envelope("orchestrator@localhost", "second"));

        assertEquals("first", inbox.receive(Duration.ofMillis(10)).orElseThrow().body());
        assertEquals("second", inbox.receive(Duration.ofMillis(10)).orElseThrow().body());
    }

    @Test
    @DisplayName("receive on an empty mailbox returns empty after the timeout")
    void emptyAfterTimeout() throws InterruptedException {
        Mailbox inbox = transport.register("adaptation@localhost");
        Optional<Envelope> next = inbox.receive(Duration.ofMillis(20));
        assertTrue(next.isEmpty());
    }

    @Test
    @DisplayName("sending to an unregistered address raises a delivery error")
    void unknownDestination() {
        MailboxDeliveryException e = assertThrows(MailboxDeliveryException.class,
            () -> transport.send(envelope("nobody@localhost", "{}")));
        assertEquals("nobody@localhost", e.getDestination());
        assertEquals(AgentException.Fault.DELIVERY, e.getFault());
        assertEquals("monitoring@localhost", e.getComponent());
    }

    @Test
    @DisplayName("registering the same address twice returns the same mailbox")
    void idempotentRegister() {
        Mailbox first = transport.register("notification@localhost");
        Mailbox second = transport.register("notification@localhost");
        assertSame(first, second);
    }

    @Test
    @DisplayName("envelope defaults a missing trace id")
    void envelopeDefaults() {
        Envelope e = new Envelope(null, "a@b", "{}", null, Instant.EPOCH);
        assertEquals("", e.sender());
        assertEquals("unknown", e.traceId());
    }
}
