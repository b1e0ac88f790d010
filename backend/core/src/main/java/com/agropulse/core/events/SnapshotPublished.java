package com.agropulse.core.events;

import java.time.Instant;

public record SnapshotPublished(
        Instant timestamp,
        String cacheName,
        Instant generatedAt,
        int itemCount
) implements Event {
    @Override
    public String type() {
        return "SnapshotPublished";
    }
}
