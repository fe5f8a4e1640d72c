package com.lmsagents.common.worker;

import com.lmsagents.common.mailbox.Envelope;
import com.lmsagents.common.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Timed receive loop over one {@link Mailbox}.
 *
 * <pre>
 *   receive(timeout) → [envelope] handler(envelope) → repeat while running
 *                    → [timeout]  repeat while running
 * </pre>
 *
 * <p>The blocking receive always runs on the loop's own single-thread scheduler, so a
 * handler that completes on another thread never ends up blocking that thread on the next
 * receive. Handler errors are logged and absorbed: nothing escapes the loop. Shutdown is
 * cooperative: the running flag is checked after every receive, so a stopped loop exits
 * within one receive timeout. Each start opens a new generation; a loop from an earlier
 * generation ends after its pending receive even if the loop was restarted meanwhile.
 */
public final class ReceiveLoop {

    private static final Logger log = LoggerFactory.getLogger(ReceiveLoop.class);

    private final String name;
    private final Mailbox mailbox;
    private final Duration receiveTimeout;
    private final Function<Envelope, Mono<Void>> handler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger activeLoops = new AtomicInteger();

    private volatile Scheduler scheduler;
    private volatile Disposable subscription;

    public ReceiveLoop(String name, Mailbox mailbox, Duration receiveTimeout,
                       Function<Envelope, Mono<Void>> handler) {
        this.name           = name;
        this.mailbox        = mailbox;
        this.receiveTimeout = receiveTimeout;
        this.handler        = handler;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        long current = generation.incrementAndGet();
        Scheduler loopScheduler = Schedulers.newSingle(name + "-mailbox", true);
        scheduler = loopScheduler;
        activeLoops.incrementAndGet();
        subscription = Mono.defer(() -> receiveOnce(loopScheduler))
            .repeat(() -> running.get() && generation.get() == current)
            .doFinally(signal -> activeLoops.decrementAndGet())
            .subscribe(
                ignored -> {},
                err -> log.error("[{}] Receive loop terminated unexpectedly", name, err),
                () -> log.info("[{}] Receive loop stopped. address={}", name, mailbox.address()));
        log.info("[{}] Receive loop started. address={} timeoutMs={}", name, mailbox.address(),
                 receiveTimeout.toMillis());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Scheduler current = scheduler;
        Disposable currentSubscription = subscription;
        current.disposeGracefully()
            .timeout(receiveTimeout.plusSeconds(1))
            .onErrorResume(e -> {
                log.warn("[{}] Receive loop did not drain in time; forcing shutdown", name);
                currentSubscription.dispose();
                current.dispose();
                return Mono.empty();
            })
            .subscribe();
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Loops still subscribed, including ones draining after a stop. */
    int activeLoops() {
        return activeLoops.get();
    }

    private Mono<Void> receiveOnce(Scheduler loopScheduler) {
        return Mono.fromCallable(() -> mailbox.receive(receiveTimeout))
            .subscribeOn(loopScheduler)
            .flatMap(next -> next.map(this::dispatch).orElseGet(Mono::empty))
            .onErrorResume(e -> {
                if (running.get()) {
                    log.error("[{}] Receive failed; continuing", name, e);
                } else {
                    log.debug("[{}] Receive interrupted during shutdown", name);
                }
                return Mono.empty();
            });
    }

    private Mono<Void> dispatch(Envelope envelope) {
        return Mono.defer(() -> handler.apply(envelope))
            .onErrorResume(e -> {
                log.error("[{}] Handler failed; message dropped. from={} traceId={}",
                          name, envelope.sender(), envelope.traceId(), e);
                return Mono.empty();
            });
    }
}
