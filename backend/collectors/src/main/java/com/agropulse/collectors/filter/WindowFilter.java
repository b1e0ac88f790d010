package com.agropulse.collectors.filter;

import com.agropulse.core.model.Article;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class WindowFilter {
    private WindowFilter() {
    }

    public static List<Article> filter(List<Article> articles, Instant now, int retentionDays) {
        Instant cutoff = cutoff(now, retentionDays);
        return articles.stream()
                .filter(article -> !article.publishedAt().isBefore(cutoff))
                .toList();
    }

    public static boolean within(Instant instant, Instant now, int retentionDays) {
        return instant != null && !instant.isBefore(cutoff(now, retentionDays));
    }

    private static Instant cutoff(Instant now, int retentionDays) {
        return now.minus(Duration.ofDays(retentionDays));
    }
}
