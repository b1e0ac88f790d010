package com.agropulse.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record Snapshot(List<Article> articles, Instant generatedAt, List<String> degradedSources) implements Timestamped {
    public Snapshot {
        Objects.requireNonNull(generatedAt, "generatedAt is required");
        articles = articles == null ? List.of() : List.copyOf(articles);
        degradedSources = degradedSources == null ? List.of() : List.copyOf(degradedSources);
    }

    @Override
    public int size() {
        return articles.size();
    }
}
