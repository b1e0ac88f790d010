package com.agropulse.core.events;

import java.time.Instant;
import java.util.List;

public record RefreshCompleted(
        Instant timestamp,
        String cacheName,
        boolean success,
        long durationMillis,
        List<String> degradedSources,
        String errorMessage
) implements Event {
    public RefreshCompleted {
        degradedSources = degradedSources == null ? List.of() : List.copyOf(degradedSources);
    }

    @Override
    public String type() {
        return "RefreshCompleted";
    }
}
