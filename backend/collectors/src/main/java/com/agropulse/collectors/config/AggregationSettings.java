package com.agropulse.collectors.config;

public record AggregationSettings(
        int retentionDays,
        int maxCandidatesPerListing,
        int maxArticlesPerSource,
        int maxArticles,
        int detailConcurrency
) {
    public AggregationSettings {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be positive");
        }
        maxCandidatesPerListing = Math.max(1, maxCandidatesPerListing);
        maxArticlesPerSource = Math.max(1, maxArticlesPerSource);
        maxArticles = Math.max(0, maxArticles);
        detailConcurrency = Math.max(1, detailConcurrency);
    }

    public static AggregationSettings defaults() {
        return new AggregationSettings(7, 30, 4, 0, 4);
    }
}
