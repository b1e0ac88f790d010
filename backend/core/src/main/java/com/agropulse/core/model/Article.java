package com.agropulse.core.model;

import com.agropulse.core.util.TextUtils;

import java.time.Instant;
import java.util.Objects;

public record Article(
        String title,
        String url,
        String summary,
        String imageUrl,
        Instant publishedAt,
        String source,
        String topicId,
        String topicLabel,
        String color
) {
    public Article {
        Objects.requireNonNull(publishedAt, "publishedAt is required");
        title = TextUtils.collapseWhitespace(title);
        url = url == null ? "" : url.trim();
        summary = TextUtils.collapseWhitespace(summary);
        imageUrl = imageUrl == null ? "" : imageUrl.trim();
        source = source == null ? "" : source;
    }

    public static Article of(String title, String url, String summary, String imageUrl,
                             Instant publishedAt, String source, Topic topic) {
        return new Article(title, url, summary, imageUrl, publishedAt, source, topic.id(), topic.label(), topic.color());
    }

    public boolean hasSummary() {
        return !summary.isEmpty();
    }

    public boolean hasImage() {
        return !imageUrl.isEmpty();
    }
}
