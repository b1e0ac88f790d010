package com.agropulse.collectors.config;

import java.time.Duration;
import java.util.Objects;

public record FetchSettings(Duration timeout, int retries, String userAgent) {
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0 Safari/537.36";

    public FetchSettings {
        Objects.requireNonNull(timeout, "timeout is required");
        retries = Math.max(0, retries);
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public static FetchSettings defaults() {
        return new FetchSettings(Duration.ofSeconds(15), 1, DEFAULT_USER_AGENT);
    }
}
