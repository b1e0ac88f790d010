package com.agropulse.collectors.pipeline;

import com.agropulse.core.model.Article;

import java.util.List;

public record SourceOutcome(String sourceId, boolean success, List<Article> articles, int candidates, int skipped, String error) {
    public SourceOutcome {
        articles = articles == null ? List.of() : List.copyOf(articles);
    }

    static SourceOutcome succeeded(String sourceId, List<Article> articles, int candidates, int skipped) {
        return new SourceOutcome(sourceId, true, articles, candidates, skipped, null);
    }

    static SourceOutcome failed(String sourceId, String error) {
        return new SourceOutcome(sourceId, false, List.of(), 0, 0, error);
    }
}
