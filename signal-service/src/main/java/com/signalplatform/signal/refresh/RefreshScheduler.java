package com.signalplatform.signal.refresh;

import com.signalplatform.signal.logger.RefreshFlowLogger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed-cadence refresh loop.
 *
 * <pre>
 *   tick 0 (immediately) → cycle → tick 1 (+interval) → cycle → ...
 * </pre>
 *
 * <p>Ticks come from {@code Flux.interval}, so the cadence does not drift with cycle duration.
 * A tick that arrives while the previous cycle is still running is skipped and logged; at most
 * one cycle is ever active. Readers are never involved.
 */
@Component
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final RefreshCoordinator coordinator;
    private final RefreshFlowLogger flowLogger;
    private final RefreshSettings settings;
    private final Scheduler timer;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicReference<CountDownLatch> cycleDone = new AtomicReference<>(new CountDownLatch(0));
    private final AtomicLong skippedTicks = new AtomicLong();
    private final AtomicLong startedCycles = new AtomicLong();

    @Value("${signal.refresh.enabled:true}")
    private boolean enabled = true;

    private volatile Disposable ticks;

    @Autowired
    public RefreshScheduler(RefreshCoordinator coordinator, RefreshFlowLogger flowLogger, RefreshSettings settings) {
        this(coordinator, flowLogger, settings, Schedulers.parallel());
    }

    public RefreshScheduler(RefreshCoordinator coordinator, RefreshFlowLogger flowLogger,
                            RefreshSettings settings, Scheduler timer) {
        this.coordinator = coordinator;
        this.flowLogger  = flowLogger;
        this.settings    = settings;
        this.timer       = timer;
    }

    @PostConstruct
    public void startOnBoot() {
        if (!enabled) {
            log.info("Refresh loop disabled. property=signal.refresh.enabled");
            return;
        }
        start();
    }

    /** Starts ticking; the first cycle runs immediately. Calling twice has no effect. */
    public synchronized void start() {
        if (ticks != null && !ticks.isDisposed()) {
            return;
        }
        log.info("Refresh loop started. intervalSeconds={} sourceTimeoutMs={}",
                 settings.interval().toSeconds(), settings.sourceTimeout().toMillis());
        ticks = Flux.interval(Duration.ZERO, settings.interval(), timer)
            .onBackpressureDrop(this::skip)
            .subscribe(this::onTick,
                       err -> log.error("Refresh loop terminated unexpectedly", err));
    }

    /**
     * Stops future ticks, then waits for an in-flight cycle to finish, bounded by
     * {@link RefreshSettings#shutdownWait()}. A running cycle is never interrupted.
     *
     * @return {@code true} when no cycle was left running
     */
    @PreDestroy
    public boolean stop() {
        Disposable current;
        synchronized (this) {
            current = ticks;
            ticks = null;
        }
        if (current != null) {
            current.dispose();
        }
        try {
            boolean finished = cycleDone.get().await(settings.shutdownWait().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Refresh loop stopped with a cycle still running. waitedMs={}",
                         settings.shutdownWait().toMillis());
            } else {
                log.info("Refresh loop stopped. cycles={} skippedTicks={}", startedCycles.get(), skippedTicks.get());
            }
            return finished;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        Disposable current = ticks;
        return current != null && !current.isDisposed();
    }

    public boolean isCycleInFlight() {
        return inFlight.get();
    }

    public long skippedTicks() {
        return skippedTicks.get();
    }

    public long startedCycles() {
        return startedCycles.get();
    }

    // ── tick handling ────────────────────────────────────────────────────────

    void onTick(long tick) {
        if (!inFlight.compareAndSet(false, true)) {
            skip(tick);
            return;
        }
        CountDownLatch done = new CountDownLatch(1);
        cycleDone.set(done);
        startedCycles.incrementAndGet();

        Mono.defer(coordinator::runCycle)
            .doFinally(signal -> {
                inFlight.set(false);
                done.countDown();
            })
            .subscribe(
                state -> log.debug("Refresh cycle completed. tick={} cycle={}", tick, state.cycle()),
                err -> log.error("Refresh cycle errored. tick={}", tick, err)
            );
    }

    private void skip(long tick) {
        skippedTicks.incrementAndGet();
        flowLogger.refreshSkipped(tick);
    }
}
