package com.lmsagents.common.mailbox;

import com.lmsagents.common.exception.MailboxDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process transport: one unbounded FIFO queue per registered address.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap} and {@link LinkedBlockingQueue}. A single
 * queue per receiver keeps every sender→receiver path in send order; interleaving across
 * senders follows arrival order and carries no guarantee.
 */
public class InMemoryMailboxTransport implements MailboxTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMailboxTransport.class);

    private final ConcurrentHashMap<String, QueueMailbox> mailboxes = new ConcurrentHashMap<>();

    @Override
    public Mailbox register(String address) {
        return mailboxes.computeIfAbsent(address, a -> {
            log.info("[Transport] Mailbox registered. address={}", a);
            return new QueueMailbox(a);
        });
    }

    @Override
    public void send(Envelope envelope) {
        QueueMailbox target = mailboxes.get(envelope.destination());
        if (target == null) {
            throw new MailboxDeliveryException(envelope.sender(), envelope.destination(),
                                               "No mailbox registered for destination.");
        }
        target.queue.offer(envelope);
        log.debug("[Transport] Enqueued. from={} to={} traceId={} pending={}",
                  envelope.sender(), envelope.destination(), envelope.traceId(), target.queue.size());
    }

    private static final class QueueMailbox implements Mailbox {

        private final String address;
        private final BlockingQueue<Envelope> queue = new LinkedBlockingQueue<>();

        private QueueMailbox(String address) {
            this.address = address;
        }

        @Override
        public String address() {
            return address;
        }

        @Override
        public Optional<Envelope> receive(Duration timeout) throws InterruptedException {
            return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }
    }
}
