package com.agropulse.service.api;

import com.agropulse.core.model.Article;
import com.agropulse.core.model.FeedSource;
import com.agropulse.core.model.Quote;
import com.agropulse.core.model.QuoteBoard;
import com.agropulse.core.model.Snapshot;
import com.agropulse.core.model.Topic;
import com.agropulse.core.model.TopicCatalog;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ResponseViews {
    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    private final ZoneId zone;

    ResponseViews(ZoneId zone) {
        this.zone = zone;
    }

    Map<String, Object> news(Snapshot snapshot) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("generated_at", iso(snapshot.generatedAt()));
        body.put("articles", snapshot.articles().stream().map(this::article).toList());
        body.put("degraded_sources", snapshot.degradedSources());
        return body;
    }

    Map<String, Object> article(Article article) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("title", article.title());
        view.put("url", article.url());
        view.put("summary", article.summary());
        view.put("image_url", article.imageUrl());
        view.put("published_at", iso(article.publishedAt()));
        view.put("published_label", LABEL.format(article.publishedAt().atZone(zone)));
        view.put("source", article.source());
        view.put("topic_key", article.topicId());
        view.put("topic_label", article.topicLabel());
        view.put("color", article.color());
        return view;
    }

    Map<String, Object> quotes(QuoteBoard board) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("generated_at", iso(board.generatedAt()));
        body.put("quotes", board.quotes().stream().map(ResponseViews::quote).toList());
        return body;
    }

    Map<String, Object> catalog(TopicCatalog catalog) {
        List<Map<String, Object>> topics = catalog.topics().stream().map(ResponseViews::topic).toList();
        List<Map<String, Object>> feeds = catalog.feeds().stream().map(ResponseViews::feed).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("topics", topics);
        body.put("feeds", feeds);
        return body;
    }

    private static Map<String, Object> quote(Quote quote) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("key", quote.key());
        view.put("label", quote.label());
        view.put("value", quote.value());
        view.put("change", quote.change());
        view.put("unit", quote.unit());
        view.put("source", quote.source());
        return view;
    }

    private static Map<String, Object> topic(Topic topic) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", topic.id());
        view.put("label", topic.label());
        view.put("color", topic.color());
        view.put("source", topic.displaySource());
        view.put("keywords", topic.keywords().stream().sorted().toList());
        return view;
    }

    private static Map<String, Object> feed(FeedSource feed) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", feed.id());
        view.put("name", feed.name());
        view.put("format", feed.format().name());
        return view;
    }

    private String iso(Instant instant) {
        return instant.atZone(zone).toOffsetDateTime().toString();
    }
}
