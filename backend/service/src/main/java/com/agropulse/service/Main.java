package com.agropulse.service;

import com.agropulse.collectors.api.CollectorContext;
import com.agropulse.collectors.extract.ArticleExtractor;
import com.agropulse.collectors.fetch.HttpSourceFetcher;
import com.agropulse.collectors.pipeline.AggregationPipeline;
import com.agropulse.collectors.quotes.QuoteCollector;
import com.agropulse.core.bus.EventBus;
import com.agropulse.core.model.QuoteBoard;
import com.agropulse.core.model.Snapshot;
import com.agropulse.core.model.TopicCatalog;
import com.agropulse.service.api.ApiServer;
import com.agropulse.service.api.DiagnosticsTracker;
import com.agropulse.service.api.SseBroadcaster;
import com.agropulse.service.cache.RefreshCoordinator;
import com.agropulse.service.config.AppConfig;
import com.agropulse.service.config.ConfigLoader;
import com.agropulse.service.http.HttpClientFactory;
import com.agropulse.service.runtime.SchedulerService;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("CONFIG_DIR", "config"));
        TopicCatalog catalog = ConfigLoader.loadCatalog(configDir);
        AppConfig app = ConfigLoader.loadApp(configDir);
        int port = resolvePort(env, app.port());
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        HttpClient sharedHttpClient = HttpClientFactory.create(Duration.ofSeconds(5));
        ExecutorService workers = Executors.newFixedThreadPool(app.topicParallelism());

        CollectorContext context = new CollectorContext(
                new HttpSourceFetcher(sharedHttpClient, app.fetchSettings(), clock),
                eventBus,
                clock,
                workers
        );

        AggregationPipeline pipeline = new AggregationPipeline(catalog, new ArticleExtractor(app.zone()), app.aggregationSettings());
        RefreshCoordinator<Snapshot> news = new RefreshCoordinator<>(
                AggregationPipeline.NAME, pipeline, context, app.cacheTtl(), app.firstLoadTimeout());
        RefreshCoordinator<QuoteBoard> quotes = new RefreshCoordinator<>(
                QuoteCollector.NAME, new QuoteCollector(app.quoteSettings()), context, app.quoteTtl(), app.firstLoadTimeout());

        SchedulerService scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledRefresh(news, app.tickerInterval(), true),
                new SchedulerService.ScheduledRefresh(quotes, app.tickerInterval(), true)
        ), eventBus, clock);
        SseBroadcaster broadcaster = new SseBroadcaster(eventBus);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock, broadcaster::clientCount);
        ApiServer apiServer = new ApiServer(port, news, quotes, catalog, broadcaster, diagnosticsTracker, app.zone());

        scheduler.start();
        apiServer.start();
        LOGGER.info("Serving " + catalog.sourceCount() + " news sources on port " + apiServer.actualPort());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            workers.shutdown();
            try {
                workers.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static int resolvePort(Map<String, String> env, int configured) {
        String raw = env.get("PORT");
        if (raw == null || raw.isBlank()) {
            return configured;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            LOGGER.warning("Ignoring invalid PORT=" + raw + ", using " + configured);
            return configured;
        }
    }
}
