package com.agropulse.service.cache;

import com.agropulse.collectors.api.AggregationFailureException;
import com.agropulse.collectors.api.Collector;
import com.agropulse.collectors.api.CollectorContext;
import com.agropulse.core.events.RefreshCompleted;
import com.agropulse.core.events.RefreshStarted;
import com.agropulse.core.events.SnapshotPublished;
import com.agropulse.core.model.Timestamped;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RefreshCoordinator<T extends Timestamped> {
    private static final Logger LOGGER = Logger.getLogger(RefreshCoordinator.class.getName());

    private final String name;
    private final Collector<T> collector;
    private final CollectorContext ctx;
    private final Duration ttl;
    private final Duration firstLoadTimeout;

    private final AtomicReference<T> current = new AtomicReference<>();
    private final Object lock = new Object();
    private CompletableFuture<T> inFlight;
    private volatile Instant lastFailureAt;
    private volatile String lastErrorMessage;

    public RefreshCoordinator(String name, Collector<T> collector, CollectorContext ctx, Duration ttl, Duration firstLoadTimeout) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.collector = Objects.requireNonNull(collector, "collector is required");
        this.ctx = Objects.requireNonNull(ctx, "ctx is required");
        this.ttl = Objects.requireNonNull(ttl, "ttl is required");
        this.firstLoadTimeout = Objects.requireNonNull(firstLoadTimeout, "firstLoadTimeout is required");
    }

    public String name() {
        return name;
    }

    /**
     * Returns the cached value, starting a background refresh when it is stale. Only
     * the very first read waits, for at most {@code firstLoadTimeout}.
     *
     * @throws DataUnavailableException when nothing has been cached yet and the first
     *                                  population failed or is still running
     */
    public T getSnapshot() {
        T snapshot = current.get();
        if (snapshot != null) {
            requestRefresh(false);
            return snapshot;
        }
        CompletableFuture<T> firstLoad = requestRefresh(false);
        try {
            return firstLoad.get(firstLoadTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return currentOrUnavailable("still populating", null);
        } catch (ExecutionException e) {
            return currentOrUnavailable("first refresh failed: " + rootMessage(e), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return currentOrUnavailable("interrupted while waiting for first refresh", e);
        }
    }

    public Optional<T> current() {
        return Optional.ofNullable(current.get());
    }

    public CompletableFuture<T> requestRefresh(boolean force) {
        CompletableFuture<T> started;
        synchronized (lock) {
            if (inFlight != null) {
                return inFlight.copy();
            }
            T snapshot = current.get();
            if (!force && snapshot != null && isFresh(snapshot)) {
                return CompletableFuture.completedFuture(snapshot);
            }
            started = new CompletableFuture<>();
            inFlight = started;
        }
        launch(started, force);
        return started.copy();
    }

    public CacheStatus status() {
        T snapshot = current.get();
        boolean refreshing;
        synchronized (lock) {
            refreshing = inFlight != null;
        }
        CacheState state;
        if (refreshing) {
            state = CacheState.POPULATING;
        } else if (snapshot == null) {
            state = CacheState.EMPTY;
        } else {
            state = isFresh(snapshot) ? CacheState.FRESH : CacheState.STALE;
        }
        return new CacheStatus(
                name,
                state,
                snapshot == null ? null : snapshot.generatedAt(),
                snapshot == null ? 0 : snapshot.size(),
                snapshot == null ? List.of() : snapshot.degradedSources(),
                ttl.toSeconds(),
                lastFailureAt,
                lastErrorMessage
        );
    }

    boolean isFresh(T snapshot) {
        return Duration.between(snapshot.generatedAt(), ctx.clock().instant()).compareTo(ttl) < 0;
    }

    private void launch(CompletableFuture<T> started, boolean force) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new RefreshStarted(startedAt, name, force));
        CompletableFuture<T> task;
        try {
            task = CompletableFuture.supplyAsync(() -> collector.collect(ctx), ctx.executor())
                    .thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            task = CompletableFuture.failedFuture(e);
        }
        task.whenComplete((value, error) -> {
            long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
            if (error == null && value != null) {
                succeed(started, value, durationMillis);
            } else {
                fail(started, error == null ? new IllegalStateException(collector.name() + " produced no value") : error, durationMillis);
            }
        });
    }

    private void succeed(CompletableFuture<T> started, T value, long durationMillis) {
        current.set(value);
        synchronized (lock) {
            inFlight = null;
        }
        Instant now = ctx.clock().instant();
        ctx.eventBus().publish(new RefreshCompleted(now, name, true, durationMillis, value.degradedSources(), null));
        ctx.eventBus().publish(new SnapshotPublished(now, name, value.generatedAt(), value.size()));
        LOGGER.info(() -> name + " refreshed with " + value.size() + " items in " + durationMillis + "ms");
        started.complete(value);
    }

    private void fail(CompletableFuture<T> started, Throwable error, long durationMillis) {
        Throwable cause = unwrap(error);
        String message = rootMessage(cause);
        lastFailureAt = ctx.clock().instant();
        lastErrorMessage = message;
        synchronized (lock) {
            inFlight = null;
        }
        List<String> failedSources = cause instanceof AggregationFailureException failure ? failure.failedSources() : List.of();
        ctx.eventBus().publish(new RefreshCompleted(ctx.clock().instant(), name, false, durationMillis, failedSources, message));
        LOGGER.log(Level.WARNING, name + " refresh failed, keeping previous value: " + message, cause);
        started.completeExceptionally(cause);
    }

    private T currentOrUnavailable(String reason, Throwable cause) {
        T snapshot = current.get();
        if (snapshot != null) {
            return snapshot;
        }
        throw new DataUnavailableException(name + " data unavailable: " + reason, cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
