package com.agropulse.service.api;

import com.agropulse.core.bus.EventBus;
import com.agropulse.core.events.AlertRaised;
import com.agropulse.core.events.RefreshCompleted;
import com.agropulse.core.events.RefreshStarted;
import com.agropulse.core.events.SourceHarvested;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final IntSupplier sseClientCountSupplier;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, RefreshStatus> refreshStatuses = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SourceStatus> sourceStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock, IntSupplier sseClientCountSupplier) {
        this(clock, sseClientCountSupplier);
        eventBus.subscribeAll(event -> onAnyEvent());
        eventBus.subscribe(RefreshStarted.class, this::onRefreshStarted);
        eventBus.subscribe(RefreshCompleted.class, this::onRefreshCompleted);
        eventBus.subscribe(SourceHarvested.class, this::onSourceHarvested);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    private DiagnosticsTracker(Clock clock, IntSupplier sseClientCountSupplier) {
        this.clock = clock;
        this.sseClientCountSupplier = sseClientCountSupplier;
    }

    public static DiagnosticsTracker empty() {
        return new DiagnosticsTracker(Clock.systemUTC(), () -> 0);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("sseClientsConnected", sseClientCountSupplier.getAsInt());
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("refreshes", refreshesSnapshot());
        metrics.put("sources", sourcesSnapshot());
        return metrics;
    }

    public Map<String, Object> refreshesSnapshot() {
        Map<String, Object> refreshes = new HashMap<>();
        refreshStatuses.forEach((name, status) -> refreshes.put(name, status.toMap()));
        return refreshes;
    }

    public Map<String, Object> sourcesSnapshot() {
        Map<String, Object> sources = new HashMap<>();
        sourceStatuses.forEach((id, status) -> sources.put(id, status.toMap()));
        return sources;
    }

    private void onAnyEvent() {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty() && recentEventTimestamps.peekFirst().isBefore(threshold)) {
            recentEventTimestamps.removeFirst();
        }
    }

    private void onRefreshStarted(RefreshStarted event) {
        refreshStatuses.compute(event.cacheName(), (name, current) ->
                (current == null ? RefreshStatus.empty() : current).withStart(event.timestamp()));
    }

    private void onRefreshCompleted(RefreshCompleted event) {
        refreshStatuses.compute(event.cacheName(), (name, current) ->
                (current == null ? RefreshStatus.empty() : current).withCompletion(event));
    }

    private void onSourceHarvested(SourceHarvested event) {
        sourceStatuses.compute(event.sourceId(), (id, current) ->
                (current == null ? SourceStatus.empty() : current).withHarvest(event));
    }

    private void onAlertRaised(AlertRaised event) {
        Object source = event.details().get("source");
        if (!(source instanceof String sourceId) || sourceId.isBlank()) {
            return;
        }
        sourceStatuses.compute(sourceId, (id, current) ->
                (current == null ? SourceStatus.empty() : current).withFailure(event.timestamp(), event.message()));
    }

    private record RefreshStatus(
            Instant lastStartedAt,
            Instant lastCompletedAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            String lastErrorMessage,
            long runs,
            long failures
    ) {
        private static RefreshStatus empty() {
            return new RefreshStatus(null, null, null, null, null, 0, 0);
        }

        private RefreshStatus withStart(Instant startedAt) {
            return new RefreshStatus(startedAt, lastCompletedAt, lastDurationMillis, lastSuccess, lastErrorMessage, runs, failures);
        }

        private RefreshStatus withCompletion(RefreshCompleted event) {
            return new RefreshStatus(
                    lastStartedAt,
                    event.timestamp(),
                    event.durationMillis(),
                    event.success(),
                    event.success() ? null : event.errorMessage(),
                    runs + 1,
                    event.success() ? failures : failures + 1
            );
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastStartedAt", lastStartedAt == null ? null : lastStartedAt.toString());
            map.put("lastCompletedAt", lastCompletedAt == null ? null : lastCompletedAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastErrorMessage", lastErrorMessage);
            map.put("runs", runs);
            map.put("failures", failures);
            return map;
        }
    }

    private record SourceStatus(
            Instant lastHarvestAt,
            Integer lastCandidates,
            Integer lastAccepted,
            Instant lastFailureAt,
            String lastErrorMessage
    ) {
        private static SourceStatus empty() {
            return new SourceStatus(null, null, null, null, null);
        }

        private SourceStatus withHarvest(SourceHarvested event) {
            return new SourceStatus(event.timestamp(), event.candidates(), event.accepted(), lastFailureAt, lastErrorMessage);
        }

        private SourceStatus withFailure(Instant at, String message) {
            return new SourceStatus(lastHarvestAt, lastCandidates, lastAccepted, at, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastHarvestAt", lastHarvestAt == null ? null : lastHarvestAt.toString());
            map.put("lastCandidates", lastCandidates);
            map.put("lastAccepted", lastAccepted);
            map.put("lastFailureAt", lastFailureAt == null ? null : lastFailureAt.toString());
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
