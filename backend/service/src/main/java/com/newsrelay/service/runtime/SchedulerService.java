package com.newsrelay.service.runtime;

import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.events.AlertRaised;
import com.newsrelay.service.store.DedupStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One fixed-delay timer per enabled group: the next cycle is scheduled only after the
 * previous one has finished. Cycles run on a worker pool with one thread per group, so a
 * slow or failing group never holds up another.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<SourceGroupPoller> pollers;
    private final DedupStore store;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration shutdownGrace;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService groupExecutor;
    private final AtomicBoolean stopped = new AtomicBoolean();

    public SchedulerService(
            List<SourceGroupPoller> pollers,
            DedupStore store,
            EventBus eventBus,
            Clock clock,
            Duration shutdownGrace
    ) {
        this(pollers, store, eventBus, clock, shutdownGrace, 1000);
    }

    SchedulerService(
            List<SourceGroupPoller> pollers,
            DedupStore store,
            EventBus eventBus,
            Clock clock,
            Duration shutdownGrace,
            long minIntervalMillis
    ) {
        this.pollers = List.copyOf(pollers);
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
        this.shutdownGrace = shutdownGrace;
        this.minIntervalMillis = minIntervalMillis;
        this.groupExecutor = Executors.newFixedThreadPool(Math.max(1, this.pollers.size()));
    }

    public void start() {
        for (SourceGroupPoller poller : pollers) {
            if (!poller.enabled()) {
                LOGGER.info("Group " + poller.groupName() + " is disabled");
                continue;
            }
            LOGGER.info("Scheduling group " + poller.groupName() + " every " + poller.interval());
            scheduleNext(poller, 0);
        }
    }

    public List<CycleReport> runOnce() {
        List<Callable<CycleReport>> tasks = new ArrayList<>();
        for (SourceGroupPoller poller : pollers) {
            if (poller.enabled()) {
                tasks.add(() -> runCycleSafely(poller));
            }
        }
        try {
            List<CycleReport> reports = new ArrayList<>();
            for (Future<CycleReport> future : groupExecutor.invokeAll(tasks)) {
                reports.add(future.get());
            }
            return reports;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException e) {
            // runCycleSafely only lets Errors through
            throw new IllegalStateException("Group cycle failed", e.getCause());
        }
    }

    /**
     * Stops the timers, waits up to the grace period for in-flight cycles, interrupts
     * whatever is still running and persists the store one final time.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        timerExecutor.shutdownNow();
        groupExecutor.shutdown();
        try {
            if (!groupExecutor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning("Cycles still running after " + shutdownGrace + "; interrupting");
                groupExecutor.shutdownNow();
                groupExecutor.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            groupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            store.flush();
            LOGGER.info("Scheduler stopped; store flushed with " + store.size() + " record(s)");
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public List<SourceGroupPoller> pollers() {
        return pollers;
    }

    private void scheduleNext(SourceGroupPoller poller, long delayMillis) {
        if (stopped.get()) {
            return;
        }
        try {
            timerExecutor.schedule(() -> submitCycle(poller), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "Timer closed; not rescheduling " + poller.groupName(), e);
        }
    }

    private void submitCycle(SourceGroupPoller poller) {
        try {
            groupExecutor.submit(() -> {
                runCycleSafely(poller);
                scheduleNext(poller, Math.max(minIntervalMillis, poller.interval().toMillis()));
            });
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "Worker pool closed; skipping cycle for " + poller.groupName(), e);
        }
    }

    private CycleReport runCycleSafely(SourceGroupPoller poller) {
        try {
            return poller.runCycle();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Cycle failed for group " + poller.groupName(), ex);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "scheduler",
                    "Group cycle failed: " + poller.groupName() + " - " + ex.getMessage(),
                    Map.of("group", poller.groupName())
            ));
            return CycleReport.aborted(poller.groupName(), String.valueOf(ex.getMessage()));
        }
    }
}
