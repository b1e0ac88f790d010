package com.agropulse.core.events;

import java.time.Instant;

public record RefreshStarted(Instant timestamp, String cacheName, boolean forced) implements Event {
    @Override
    public String type() {
        return "RefreshStarted";
    }
}
