package com.agropulse.service.runtime;

import com.agropulse.core.bus.EventBus;
import com.agropulse.core.model.QuoteBoard;
import com.agropulse.core.model.Snapshot;
import com.agropulse.service.cache.RefreshCoordinator;
import com.agropulse.service.support.MutableClock;
import com.agropulse.service.support.ScriptedCollector;
import com.agropulse.service.support.TestContexts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.IntSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerServiceTest {
    private static final Instant T0 = Instant.parse("2026-03-10T18:00:00Z");

    private ExecutorService executor;
    private MutableClock clock;
    private EventBus bus;
    private SchedulerService scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        clock = new MutableClock(T0, ZoneOffset.UTC);
        bus = new EventBus();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
        executor.shutdownNow();
    }

    @Test
    void tickPopulatesOnceAndSkipsWhileFresh() throws Exception {
        ScriptedCollector<Snapshot> news = ScriptedCollector.answering("news", ctx -> TestContexts.snapshot(ctx.clock().instant(), 1));
        RefreshCoordinator<Snapshot> coordinator = coordinator("news", news);
        scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledRefresh(coordinator, Duration.ofMillis(20), true)
        ), bus, clock, 10);

        scheduler.start();
        waitUntil(() -> news.runs(), 1);
        Thread.sleep(150);

        assertEquals(1, news.runs());
        assertTrue(coordinator.current().isPresent());
    }

    @Test
    void tickRefreshesAgainOnceValueIsStale() throws Exception {
        ScriptedCollector<Snapshot> news = ScriptedCollector.answering("news", ctx -> TestContexts.snapshot(ctx.clock().instant(), 1));
        RefreshCoordinator<Snapshot> coordinator = coordinator("news", news);
        scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledRefresh(coordinator, Duration.ofMillis(20), true)
        ), bus, clock, 10);

        scheduler.start();
        waitUntil(() -> news.runs(), 1);
        clock.advance(Duration.ofMinutes(16));
        waitUntil(() -> news.runs(), 2);

        assertEquals(T0.plus(Duration.ofMinutes(16)), coordinator.current().orElseThrow().generatedAt());
    }

    @Test
    void disabledRefreshNeverTicks() throws Exception {
        ScriptedCollector<Snapshot> news = ScriptedCollector.answering("news", ctx -> TestContexts.snapshot(ctx.clock().instant(), 1));
        ScriptedCollector<QuoteBoard> quotes = ScriptedCollector.answering("quotes", ctx -> TestContexts.board(ctx.clock().instant()));
        RefreshCoordinator<Snapshot> newsCoordinator = coordinator("news", news);
        RefreshCoordinator<QuoteBoard> quoteCoordinator = new RefreshCoordinator<>(
                "quotes", quotes, TestContexts.context(bus, clock, executor), Duration.ofMinutes(15), Duration.ofSeconds(5));
        scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledRefresh(newsCoordinator, Duration.ofMillis(20), false),
                new SchedulerService.ScheduledRefresh(quoteCoordinator, Duration.ofMillis(20), true)
        ), bus, clock, 10);

        scheduler.start();
        waitUntil(() -> quotes.runs(), 1);
        Thread.sleep(100);

        assertEquals(0, news.runs());
        assertTrue(quoteCoordinator.current().isPresent());
    }

    private RefreshCoordinator<Snapshot> coordinator(String name, ScriptedCollector<Snapshot> collector) {
        return new RefreshCoordinator<>(name, collector, TestContexts.context(bus, clock, executor),
                Duration.ofMinutes(15), Duration.ofSeconds(5));
    }

    private static void waitUntil(IntSupplier value, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (value.getAsInt() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(value.getAsInt() >= expected, "expected at least " + expected + " but was " + value.getAsInt());
    }
}
