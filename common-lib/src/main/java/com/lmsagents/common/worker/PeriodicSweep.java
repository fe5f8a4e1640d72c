package com.lmsagents.common.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Fixed-period ticker that runs one self-contained cycle per tick.
 *
 * <p>Overlap policy: a tick that fires while the previous cycle is still in flight is
 * skipped (and logged), never queued. The first tick fires immediately on start.
 * Cycle errors are logged and the ticker keeps going.
 */
public final class PeriodicSweep {

    private static final Logger log = LoggerFactory.getLogger(PeriodicSweep.class);

    private final String name;
    private final Duration period;
    private final Supplier<Mono<?>> cycle;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);

    private volatile Disposable ticker;

    public PeriodicSweep(String name, Duration period, Supplier<Mono<?>> cycle) {
        this.name   = name;
        this.period = period;
        this.cycle  = cycle;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        ticker = Flux.interval(Duration.ZERO, period)
            .takeWhile(tick -> running.get())
            .subscribe(tick -> triggerNow());
        log.info("[{}] Periodic sweep started. periodSeconds={}", name, period.toSeconds());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Disposable current = ticker;
        if (current != null) {
            current.dispose();
        }
        log.info("[{}] Periodic sweep stopped.", name);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runs one cycle unless one is already in flight.
     *
     * @return {@code true} if a cycle was started, {@code false} if the tick was skipped
     */
    public boolean triggerNow() {
        if (!cycleInFlight.compareAndSet(false, true)) {
            log.warn("[{}] Previous cycle still running; skipping tick", name);
            return false;
        }
        Mono.defer(cycle)
            .doFinally(signal -> cycleInFlight.set(false))
            .subscribe(
                ignored -> {},
                err -> log.error("[{}] Cycle failed", name, err));
        return true;
    }
}
