package com.agropulse.collectors.api;

import java.util.List;

public class AggregationFailureException extends RuntimeException {
    private final List<String> failedSources;

    public AggregationFailureException(String message, List<String> failedSources) {
        super(message);
        this.failedSources = List.copyOf(failedSources);
    }

    public AggregationFailureException(String message, List<String> failedSources, Throwable cause) {
        super(message, cause);
        this.failedSources = List.copyOf(failedSources);
    }

    public List<String> failedSources() {
        return failedSources;
    }
}
