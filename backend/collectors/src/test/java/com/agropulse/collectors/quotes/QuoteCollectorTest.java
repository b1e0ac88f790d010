package com.agropulse.collectors.quotes;

import com.agropulse.collectors.api.AggregationFailureException;
import com.agropulse.collectors.api.CollectorContext;
import com.agropulse.collectors.config.QuoteSettings;
import com.agropulse.collectors.fetch.FetchException;
import com.agropulse.collectors.support.EventCapture;
import com.agropulse.collectors.support.FixtureUtils;
import com.agropulse.collectors.support.MutableClock;
import com.agropulse.collectors.support.StubSourceFetcher;
import com.agropulse.core.bus.EventBus;
import com.agropulse.core.events.AlertRaised;
import com.agropulse.core.model.Quote;
import com.agropulse.core.model.QuoteBoard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QuoteCollectorTest {
    private static final Instant NOW = Instant.parse("2026-03-10T18:00:00Z");
    private static final String BASE = "https://quotes.example.com";

    private ExecutorService executor;
    private StubSourceFetcher fetcher;
    private EventBus bus;
    private EventCapture capture;
    private CollectorContext ctx;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);
        fetcher = new StubSourceFetcher(clock);
        bus = new EventBus();
        capture = new EventCapture(bus);
        ctx = new CollectorContext(fetcher, bus, clock, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void buildsBoardFromOverviewAndDetailPages() {
        fetcher.page(BASE + "/cotacoes/", FixtureUtils.read("fixtures/quotes-overview.html"));
        fetcher.page(BASE + "/cotacoes/cafe", FixtureUtils.read("fixtures/quotes-cafe.html"));
        fetcher.page(BASE + "/cotacoes/soja", FixtureUtils.read("fixtures/quotes-soja.html"));

        QuoteBoard board = collector().collect(ctx).join();

        assertEquals(NOW, board.generatedAt());
        assertEquals(List.of("dolar", "cafe", "milho", "soja"), board.quotes().stream().map(Quote::key).toList());
        assertEquals(List.of("5,12", "1.850,30", "68,50", "128,40"), board.quotes().stream().map(Quote::value).toList());
        assertEquals(List.of("-0,35%", "1,05%", "+0,44%", "-0,20%"), board.quotes().stream().map(Quote::change).toList());
    }

    @Test
    void coffeeFallsBackToOverviewWhenItsPageFails() {
        fetcher.page(BASE + "/cotacoes/", FixtureUtils.read("fixtures/quotes-overview.html"));
        fetcher.fail(BASE + "/cotacoes/cafe", FetchException.Kind.TIMEOUT);
        fetcher.fail(BASE + "/cotacoes/soja", FetchException.Kind.UNREACHABLE);

        QuoteBoard board = collector().collect(ctx).join();

        assertEquals("1.790,00", board.quotes().get(1).value());
        assertEquals("", board.quotes().get(3).value());
        assertEquals(4, board.size());
    }

    @Test
    void overviewFailureFailsTheRefresh() {
        fetcher.fail(BASE + "/cotacoes/", FetchException.Kind.BAD_STATUS);

        CompletionException error = assertThrows(CompletionException.class, () -> collector().collect(ctx).join());

        AggregationFailureException failure = assertInstanceOf(AggregationFailureException.class, error.getCause());
        assertEquals(List.of(QuoteCollector.NAME), failure.failedSources());
        assertEquals(1, capture.byType(AlertRaised.class).size());
        assertEquals(0, fetcher.calls(BASE + "/cotacoes/cafe"));
    }

    private QuoteCollector collector() {
        return new QuoteCollector(new QuoteSettings(BASE + "/"));
    }
}
