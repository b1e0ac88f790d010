package com.agropulse.core.model;

import java.util.List;
import java.util.Optional;

public record TopicCatalog(List<Topic> topics, List<FeedSource> feeds, String defaultTopicId) {
    public TopicCatalog {
        topics = topics == null ? List.of() : List.copyOf(topics);
        feeds = feeds == null ? List.of() : List.copyOf(feeds);
    }

    public Optional<Topic> topic(String id) {
        return topics.stream().filter(topic -> topic.id().equals(id)).findFirst();
    }

    public Topic classify(String text) {
        return topics.stream()
                .filter(topic -> topic.mentionedIn(text))
                .findFirst()
                .or(() -> defaultTopicId == null ? Optional.empty() : topic(defaultTopicId))
                .orElseGet(() -> topics.get(0));
    }

    public boolean isRelevant(String text) {
        return topics.stream().anyMatch(topic -> topic.mentionedIn(text));
    }

    public int sourceCount() {
        return topics.size() + feeds.size();
    }
}
