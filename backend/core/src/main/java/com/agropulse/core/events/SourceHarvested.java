package com.agropulse.core.events;

import java.time.Instant;

public record SourceHarvested(
        Instant timestamp,
        String sourceId,
        int candidates,
        int accepted,
        int skipped,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SourceHarvested";
    }
}
