package com.lmsagents.common.worker;

import com.lmsagents.common.mailbox.Envelope;
import com.lmsagents.common.mailbox.InMemoryMailboxTransport;
import com.lmsagents.common.mailbox.Mailbox;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ReceiveLoopTest {

    private final InMemoryMailboxTransport transport = new InMemoryMailboxTransport();

    private void send(String body) {
        transport.send(new Envelope("x@localhost", "inbox@localhost", body, "t", Instant.EPOCH));
    }

    @Test
    @DisplayName("envelopes are handled in arrival order")
    void handlesInOrder() throws InterruptedException {
        Mailbox inbox = transport.register("inbox@localhost");
        List<String> seen = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        ReceiveLoop loop = new ReceiveLoop("test", inbox, Duration.ofMillis(50), envelope -> {
            seen.add(envelope.body());
            latch.countDown();
            return Mono.empty();
        });

        loop.start();
        send("one");
        send("two");
        assertTrue(latch.await(2, TimeUnit.SECONDS));
        loop.stop();

        assertEquals(List.of("one", "two"), seen);
        assertFalse(loop.isRunning());
    }

    @Test
    @DisplayName("a failing handler does not stop the loop")
    void handlerFailureIsAbsorbed() throws InterruptedException {
        Mailbox inbox = transport.register("inbox@localhost");
        CountDownLatch latch = new CountDownLatch(2);
        ReceiveLoop loop = new ReceiveLoop("test", inbox, Duration.ofMillis(50), envelope -> {
            latch.countDown();
            if (envelope.body().equals("bad")) {
                throw new IllegalStateException("handler blew up");
            }
            return Mono.empty();
        });

        loop.start();
        send("bad");
        send("good");
        assertTrue(latch.await(2, TimeUnit.SECONDS));
        loop.stop();
    }

    @Test
    @DisplayName("restart before the pending receive times out leaves a single loop draining the mailbox")
    void restartKeepsOneLoop() throws InterruptedException {
        Mailbox inbox = transport.register("inbox@localhost");
        List<String> seen = new CopyOnWriteArrayList<>();
        ReceiveLoop loop = new ReceiveLoop("test", inbox, Duration.ofMillis(50), envelope -> {
            seen.add(envelope.body());
            return Mono.empty();
        });

        loop.start();
        loop.stop();
        loop.start();
        try {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (loop.activeLoops() > 1 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, loop.activeLoops());

            Thread.sleep(200);
            assertEquals(1, loop.activeLoops());

            send("after-restart");
            deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (seen.isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(List.of("after-restart"), seen);
        } finally {
            loop.stop();
        }
    }
}
