package com.agropulse.collectors.dedupe;

import com.agropulse.core.model.Article;
import com.agropulse.core.util.TextUtils;
import com.agropulse.core.util.UrlCanonicalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses articles that point at the same story. The first occurrence keeps its
 * position; a later duplicate only replaces it when it carries strictly more of
 * summary and image.
 */
public final class Deduplicator {
    private Deduplicator() {
    }

    public static List<Article> dedupe(List<Article> articles) {
        Map<String, Article> byIdentity = new LinkedHashMap<>();
        for (Article candidate : articles) {
            byIdentity.merge(identity(candidate), candidate, Deduplicator::richer);
        }
        return new ArrayList<>(byIdentity.values());
    }

    public static String identity(Article article) {
        return UrlCanonicalizer.canonicalize(article.url())
                .map(url -> "url:" + url)
                .orElseGet(() -> "title:" + TextUtils.identityForm(article.title()) + "|" + TextUtils.identityForm(article.source()));
    }

    private static Article richer(Article incumbent, Article challenger) {
        return completeness(challenger) > completeness(incumbent) ? challenger : incumbent;
    }

    private static int completeness(Article article) {
        return (article.hasSummary() ? 2 : 0) + (article.hasImage() ? 1 : 0);
    }
}
