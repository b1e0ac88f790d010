package com.agropulse.collectors.pipeline;

import com.agropulse.collectors.api.AggregationFailureException;
import com.agropulse.collectors.api.Collector;
import com.agropulse.collectors.api.CollectorContext;
import com.agropulse.collectors.config.AggregationSettings;
import com.agropulse.collectors.dedupe.Deduplicator;
import com.agropulse.collectors.extract.ArticleExtractor;
import com.agropulse.collectors.extract.ExtractException;
import com.agropulse.collectors.filter.WindowFilter;
import com.agropulse.core.events.AlertRaised;
import com.agropulse.core.model.Article;
import com.agropulse.core.model.Snapshot;
import com.agropulse.core.model.TopicCatalog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AggregationPipeline implements Collector<Snapshot> {
    public static final String NAME = "news";
    private static final Logger LOGGER = Logger.getLogger(AggregationPipeline.class.getName());

    private final TopicCatalog catalog;
    private final ArticleExtractor extractor;
    private final AggregationSettings settings;

    public AggregationPipeline(TopicCatalog catalog, ArticleExtractor extractor, AggregationSettings settings) {
        this.catalog = catalog;
        this.extractor = extractor;
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<Snapshot> collect(CollectorContext ctx) {
        return run(ctx, ctx.clock().instant());
    }

    public CompletableFuture<Snapshot> run(CollectorContext ctx, Instant now) {
        SourceHarvester harvester = new SourceHarvester(ctx, extractor, settings, catalog);
        List<CompletableFuture<SourceOutcome>> tasks = new ArrayList<>();
        catalog.topics().forEach(topic -> tasks.add(guarded(ctx, topic.id(),
                CompletableFuture.supplyAsync(() -> {
                    try {
                        return harvester.harvestTopic(topic, now);
                    } catch (ExtractException e) {
                        throw new CompletionException(e);
                    }
                }, ctx.executor()))));
        catalog.feeds().forEach(feed -> tasks.add(guarded(ctx, feed.id(),
                CompletableFuture.supplyAsync(() -> {
                    try {
                        return harvester.harvestFeed(feed, now);
                    } catch (ExtractException e) {
                        throw new CompletionException(e);
                    }
                }, ctx.executor()))));

        return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> merge(tasks.stream().map(CompletableFuture::join).toList(), now));
    }

    private CompletableFuture<SourceOutcome> guarded(CollectorContext ctx, String sourceId, CompletableFuture<SourceOutcome> task) {
        return task.handle((outcome, error) -> {
            if (error == null) {
                return outcome;
            }
            String message = SourceHarvester.rootMessage(error);
            LOGGER.log(Level.WARNING, "Source " + sourceId + " failed: " + message);
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "aggregation",
                    NAME,
                    "Source " + sourceId + " failed: " + message,
                    Map.of("source", sourceId)
            ));
            return SourceOutcome.failed(sourceId, message);
        });
    }

    Snapshot merge(List<SourceOutcome> outcomes, Instant now) {
        List<String> failed = outcomes.stream()
                .filter(outcome -> !outcome.success())
                .map(SourceOutcome::sourceId)
                .toList();
        if (outcomes.isEmpty()) {
            throw new AggregationFailureException("No topics or feeds configured", List.of());
        }
        if (failed.size() == outcomes.size()) {
            throw new AggregationFailureException("All " + failed.size() + " sources failed", failed);
        }

        List<Article> merged = outcomes.stream()
                .flatMap(outcome -> outcome.articles().stream())
                .toList();
        List<Article> articles = new ArrayList<>(WindowFilter.filter(Deduplicator.dedupe(merged), now, settings.retentionDays()));
        articles.sort(Comparator.comparing(Article::publishedAt).reversed());
        if (settings.maxArticles() > 0 && articles.size() > settings.maxArticles()) {
            articles = capKeepingEveryTopic(articles, settings.maxArticles());
        }
        Snapshot snapshot = new Snapshot(articles, now, failed);
        LOGGER.info(() -> "Aggregated " + merged.size() + " articles from " + outcomes.size()
                + " sources, kept " + snapshot.size() + ", degraded=" + failed);
        return snapshot;
    }

    // The newest article of each topic is reserved before the rest fill the cap by date.
    static List<Article> capKeepingEveryTopic(List<Article> sorted, int cap) {
        boolean[] kept = new boolean[sorted.size()];
        int count = 0;
        Set<String> topics = new HashSet<>();
        for (int i = 0; i < sorted.size() && count < cap; i++) {
            if (topics.add(sorted.get(i).topicId())) {
                kept[i] = true;
                count++;
            }
        }
        for (int i = 0; i < sorted.size() && count < cap; i++) {
            if (!kept[i]) {
                kept[i] = true;
                count++;
            }
        }
        List<Article> result = new ArrayList<>(count);
        for (int i = 0; i < sorted.size(); i++) {
            if (kept[i]) {
                result.add(sorted.get(i));
            }
        }
        return result;
    }
}
