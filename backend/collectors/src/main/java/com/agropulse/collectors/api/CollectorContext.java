package com.agropulse.collectors.api;

import com.agropulse.collectors.fetch.SourceFetcher;
import com.agropulse.core.bus.EventBus;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

public record CollectorContext(
        SourceFetcher fetcher,
        EventBus eventBus,
        Clock clock,
        Executor executor
) {
    public CollectorContext {
        Objects.requireNonNull(fetcher, "fetcher is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(executor, "executor is required");
    }
}
