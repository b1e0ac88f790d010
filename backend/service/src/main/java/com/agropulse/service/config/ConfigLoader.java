package com.agropulse.service.config;

import com.agropulse.core.model.FeedSource;
import com.agropulse.core.model.Topic;
import com.agropulse.core.model.TopicCatalog;
import com.agropulse.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.HashSet;
import java.util.Set;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static TopicCatalog loadCatalog(Path configDir) {
        Path path = configDir.resolve("topics.json");
        TopicCatalog catalog = read(path, new TypeReference<>() {
        });
        validate(catalog, path);
        return catalog;
    }

    public static AppConfig loadApp(Path configDir) {
        Path path = configDir.resolve("app.json");
        if (!Files.exists(path)) {
            return AppConfig.defaults();
        }
        AppConfig config = read(path, new TypeReference<>() {
        });
        try {
            config.zone();
        } catch (DateTimeException e) {
            throw new IllegalStateException("Unknown displayTimezone " + config.displayTimezone() + " in " + path, e);
        }
        return config;
    }

    static void validate(TopicCatalog catalog, Path path) {
        if (catalog.topics().isEmpty()) {
            throw new IllegalStateException("No topics configured in " + path);
        }
        Set<String> ids = new HashSet<>();
        for (Topic topic : catalog.topics()) {
            if (!ids.add(topic.id())) {
                throw new IllegalStateException("Duplicate source id " + topic.id() + " in " + path);
            }
            requireAbsolute(topic.sourceRef(), topic.id(), path);
        }
        for (FeedSource feed : catalog.feeds()) {
            if (!ids.add(feed.id())) {
                throw new IllegalStateException("Duplicate source id " + feed.id() + " in " + path);
            }
            if (feed.listingUrls().isEmpty()) {
                throw new IllegalStateException("Feed " + feed.id() + " has no listingUrls in " + path);
            }
            feed.listingUrls().forEach(url -> requireAbsolute(url, feed.id(), path));
            feed.fallbackUrls().forEach(url -> requireAbsolute(url, feed.id(), path));
        }
        if (catalog.defaultTopicId() != null && catalog.topic(catalog.defaultTopicId()).isEmpty()) {
            throw new IllegalStateException("defaultTopicId " + catalog.defaultTopicId() + " is not a configured topic in " + path);
        }
    }

    private static void requireAbsolute(String url, String sourceId, Path path) {
        try {
            if (url != null && URI.create(url).isAbsolute()) {
                return;
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid URL " + url + " for " + sourceId + " in " + path, e);
        }
        throw new IllegalStateException("Source " + sourceId + " needs an absolute URL in " + path);
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
