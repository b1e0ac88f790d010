package com.agropulse.collectors.pipeline;

import com.agropulse.collectors.api.CollectorContext;
import com.agropulse.collectors.config.AggregationSettings;
import com.agropulse.collectors.extract.ArticleDraft;
import com.agropulse.collectors.extract.ArticleExtractor;
import com.agropulse.collectors.extract.ArticleStub;
import com.agropulse.collectors.extract.ExtractException;
import com.agropulse.collectors.fetch.RawDocument;
import com.agropulse.collectors.filter.WindowFilter;
import com.agropulse.core.events.SourceHarvested;
import com.agropulse.core.model.Article;
import com.agropulse.core.model.FeedSource;
import com.agropulse.core.model.ListingFormat;
import com.agropulse.core.model.Topic;
import com.agropulse.core.model.TopicCatalog;
import com.agropulse.core.util.UrlCanonicalizer;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

class SourceHarvester {
    private static final Logger LOGGER = Logger.getLogger(SourceHarvester.class.getName());

    private final CollectorContext ctx;
    private final ArticleExtractor extractor;
    private final AggregationSettings settings;
    private final TopicCatalog catalog;

    SourceHarvester(CollectorContext ctx, ArticleExtractor extractor, AggregationSettings settings, TopicCatalog catalog) {
        this.ctx = ctx;
        this.extractor = extractor;
        this.settings = settings;
        this.catalog = catalog;
    }

    SourceOutcome harvestTopic(Topic topic, Instant now) throws ExtractException {
        Instant startedAt = ctx.clock().instant();
        RawDocument listing = fetchNow(URI.create(topic.sourceRef()));
        List<ArticleStub> stubs = extractor.parseListing(listing, topic.format(), null, settings.maxCandidatesPerListing());
        String source = topic.displaySource();
        List<Article> accepted = harvest(stubs, now, draft -> topic.accepts(draft.title(), draft.summary())
                ? Optional.of(draft.toArticle(topic, source))
                : Optional.empty(), settings.maxArticlesPerSource());
        return finish(topic.id(), stubs.size(), accepted, startedAt);
    }

    SourceOutcome harvestFeed(FeedSource feed, Instant now) throws ExtractException {
        Instant startedAt = ctx.clock().instant();
        Function<ArticleDraft, Optional<Article>> acceptance = draft -> {
            String text = draft.text();
            if (!catalog.isRelevant(text)) {
                return Optional.empty();
            }
            return Optional.of(draft.toArticle(catalog.classify(text), feed.name()));
        };
        int quota = settings.maxArticlesPerSource();

        ListingRead primary = readListings(feed, feed.listingUrls(), feed.format());
        List<ArticleStub> candidates = new ArrayList<>(primary.stubs.values());
        List<Article> accepted = new ArrayList<>(harvest(candidates, now, acceptance, quota));
        if (accepted.size() < quota && !feed.fallbackUrls().isEmpty()) {
            LOGGER.fine(() -> feed.id() + ": " + accepted.size() + " of " + quota + " from listings, reading fallback pages");
            ListingRead fallback = readListings(feed, feed.fallbackUrls(), ListingFormat.LINKS);
            List<ArticleStub> extra = fallback.stubs.entrySet().stream()
                    .filter(entry -> !primary.stubs.containsKey(entry.getKey()))
                    .map(Map.Entry::getValue)
                    .toList();
            candidates.addAll(extra);
            accepted.addAll(harvest(extra, now, acceptance, quota - accepted.size()));
            if (primary.allFailed() && fallback.allFailed()) {
                primary.rethrow(feed);
            }
        } else if (primary.allFailed()) {
            primary.rethrow(feed);
        }
        return finish(feed.id(), candidates.size(), accepted, startedAt);
    }

    private ListingRead readListings(FeedSource feed, List<String> urls, ListingFormat format) {
        ListingRead read = new ListingRead(urls.size());
        for (String listingUrl : urls) {
            try {
                RawDocument listing = fetchNow(URI.create(listingUrl));
                for (ArticleStub stub : extractor.parseListing(listing, format, feed, settings.maxCandidatesPerListing())) {
                    read.stubs.putIfAbsent(UrlCanonicalizer.canonicalize(stub.url()).orElse(stub.url()), stub);
                }
            } catch (CompletionException | IllegalArgumentException e) {
                read.failed++;
                read.lastFetchFailure = e;
                LOGGER.log(Level.WARNING, "Listing " + listingUrl + " of " + feed.id() + " failed: " + rootMessage(e));
            } catch (ExtractException e) {
                read.failed++;
                read.lastParseFailure = e;
                LOGGER.log(Level.WARNING, "Listing " + listingUrl + " of " + feed.id() + " could not be parsed: " + e.getMessage());
            }
        }
        return read;
    }

    private List<Article> harvest(List<ArticleStub> stubs, Instant now, Function<ArticleDraft, Optional<Article>> acceptance, int limit) {
        List<ArticleStub> inWindow = stubs.stream()
                .filter(stub -> stub.listedAt() == null || WindowFilter.within(stub.listedAt(), now, settings.retentionDays()))
                .toList();
        List<Article> accepted = new ArrayList<>();
        int batchSize = settings.detailConcurrency();
        for (int from = 0; from < inWindow.size() && accepted.size() < limit; from += batchSize) {
            List<ArticleStub> batch = inWindow.subList(from, Math.min(inWindow.size(), from + batchSize));
            List<CompletableFuture<RawDocument>> pages = batch.stream().map(this::detailPage).toList();
            for (int i = 0; i < batch.size() && accepted.size() < limit; i++) {
                toDraft(batch.get(i), pages.get(i))
                        .filter(draft -> WindowFilter.within(draft.publishedAt(), now, settings.retentionDays()))
                        .flatMap(acceptance)
                        .ifPresent(accepted::add);
            }
        }
        return accepted;
    }

    private CompletableFuture<RawDocument> detailPage(ArticleStub stub) {
        if (!extractor.needsDetail(stub)) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return ctx.fetcher().fetch(URI.create(stub.url()));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Optional<ArticleDraft> toDraft(ArticleStub stub, CompletableFuture<RawDocument> page) {
        RawDocument doc;
        try {
            doc = page.join();
        } catch (CompletionException e) {
            LOGGER.log(Level.FINE, "Article page " + stub.url() + " unavailable, using listing data: " + rootMessage(e));
            return fromStub(stub);
        }
        if (doc == null) {
            return fromStub(stub);
        }
        try {
            return Optional.of(extractor.parseArticle(doc, stub));
        } catch (ExtractException e) {
            LOGGER.log(Level.FINE, "Skipping " + stub.url() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ArticleDraft> fromStub(ArticleStub stub) {
        try {
            return Optional.of(extractor.fromStub(stub));
        } catch (ExtractException e) {
            LOGGER.log(Level.FINE, "Skipping " + stub.url() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private SourceOutcome finish(String sourceId, int candidates, List<Article> accepted, Instant startedAt) {
        long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
        int skipped = Math.max(0, candidates - accepted.size());
        ctx.eventBus().publish(new SourceHarvested(ctx.clock().instant(), sourceId, candidates, accepted.size(), skipped, durationMillis));
        LOGGER.fine(() -> sourceId + ": accepted " + accepted.size() + " of " + candidates + " listing entries");
        return SourceOutcome.succeeded(sourceId, accepted, candidates, skipped);
    }

    private RawDocument fetchNow(URI uri) {
        return ctx.fetcher().fetch(uri).join();
    }

    private static final class ListingRead {
        private final int attempted;
        private final Map<String, ArticleStub> stubs = new LinkedHashMap<>();
        private int failed;
        private RuntimeException lastFetchFailure;
        private ExtractException lastParseFailure;

        private ListingRead(int attempted) {
            this.attempted = attempted;
        }

        private boolean allFailed() {
            return failed == attempted;
        }

        private void rethrow(FeedSource feed) throws ExtractException {
            if (lastParseFailure != null) {
                throw lastParseFailure;
            }
            if (lastFetchFailure != null) {
                throw lastFetchFailure;
            }
            throw new ExtractException(ExtractException.Kind.UNPARSEABLE, "Feed " + feed.id() + " has no listing URLs");
        }
    }

    static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
