package com.agropulse.collectors.extract;

import com.agropulse.core.model.Article;
import com.agropulse.core.model.Topic;

import java.time.Instant;

public record ArticleDraft(String title, String url, String summary, String imageUrl, Instant publishedAt) {
    public Article toArticle(Topic topic, String source) {
        return Article.of(title, url, summary, imageUrl, publishedAt, source, topic);
    }

    public String text() {
        return title + " " + summary;
    }
}
