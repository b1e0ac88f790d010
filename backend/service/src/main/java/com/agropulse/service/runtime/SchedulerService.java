package com.agropulse.service.runtime;

import com.agropulse.core.bus.EventBus;
import com.agropulse.core.events.AlertRaised;
import com.agropulse.service.cache.RefreshCoordinator;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class SchedulerService {
    private final List<ScheduledRefresh> refreshes;
    private final EventBus eventBus;
    private final Clock clock;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "refresh-ticker");
        thread.setDaemon(true);
        return thread;
    });

    public SchedulerService(List<ScheduledRefresh> refreshes, EventBus eventBus, Clock clock) {
        this(refreshes, eventBus, clock, 1_000);
    }

    SchedulerService(List<ScheduledRefresh> refreshes, EventBus eventBus, Clock clock, long minIntervalMillis) {
        this.refreshes = List.copyOf(refreshes);
        this.eventBus = eventBus;
        this.clock = clock;
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        for (ScheduledRefresh scheduled : refreshes) {
            if (!scheduled.enabled()) {
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> tick(scheduled.coordinator()),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
        }
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void tick(RefreshCoordinator<?> coordinator) {
        try {
            coordinator.requestRefresh(false);
        } catch (RuntimeException ex) {
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "scheduler",
                    coordinator.name(),
                    "Refresh tick failed: " + coordinator.name() + " - " + ex.getMessage(),
                    Map.of("cache", coordinator.name())
            ));
        }
    }

    public record ScheduledRefresh(RefreshCoordinator<?> coordinator, Duration interval, boolean enabled) {
        public ScheduledRefresh {
            Objects.requireNonNull(coordinator, "coordinator is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
