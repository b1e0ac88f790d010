package com.agropulse.collectors.quotes;

import com.agropulse.collectors.api.AggregationFailureException;
import com.agropulse.collectors.api.Collector;
import com.agropulse.collectors.api.CollectorContext;
import com.agropulse.collectors.config.QuoteSettings;
import com.agropulse.collectors.fetch.RawDocument;
import com.agropulse.core.events.AlertRaised;
import com.agropulse.core.model.Quote;
import com.agropulse.core.model.QuoteBoard;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

public class QuoteCollector implements Collector<QuoteBoard> {
    public static final String NAME = "quotes";
    private static final Logger LOGGER = Logger.getLogger(QuoteCollector.class.getName());

    private final QuoteSettings settings;

    public QuoteCollector(QuoteSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompletableFuture<QuoteBoard> collect(CollectorContext ctx) {
        URI overview = settings.page("/cotacoes/");
        return ctx.fetcher().fetch(overview)
                .handle((doc, error) -> {
                    if (error != null) {
                        String message = rootMessage(error);
                        ctx.eventBus().publish(new AlertRaised(
                                ctx.clock().instant(), "quotes", NAME, "Quote overview unavailable: " + message,
                                Map.of("url", overview.toString())));
                        throw new AggregationFailureException("Quote overview unavailable: " + message, List.of(NAME), error);
                    }
                    return html(doc);
                })
                .thenCompose(main -> {
                    Quote dollar = QuotePageParser.dollar(main);
                    Quote milho = QuotePageParser.indicator(main, QuotePageParser.MILHO);
                    CompletableFuture<Quote> cafe = ctx.fetcher().fetch(settings.page("/cotacoes/cafe"))
                            .handle((doc, error) -> {
                                if (error != null) {
                                    LOGGER.log(Level.WARNING, "Coffee quote page unavailable, reading overview: " + rootMessage(error));
                                    return QuotePageParser.indicator(main, QuotePageParser.CAFE_ON_MAIN_PAGE);
                                }
                                return QuotePageParser.indicator(html(doc), QuotePageParser.CAFE);
                            });
                    return cafe.thenCombine(soja(ctx, main), (cafeQuote, sojaQuote) ->
                            new QuoteBoard(List.of(dollar, cafeQuote, milho, sojaQuote), ctx.clock().instant()));
                });
    }

    private CompletableFuture<Quote> soja(CollectorContext ctx, Document main) {
        Quote fromOverview = QuotePageParser.indicator(main, QuotePageParser.SOJA);
        if (!fromOverview.value().isEmpty()) {
            return CompletableFuture.completedFuture(fromOverview);
        }
        return ctx.fetcher().fetch(settings.page("/cotacoes/soja"))
                .handle((doc, error) -> {
                    if (error != null) {
                        LOGGER.log(Level.WARNING, "Soy quote page unavailable: " + rootMessage(error));
                        return fromOverview;
                    }
                    return QuotePageParser.indicator(html(doc), QuotePageParser.SOJA);
                });
    }

    private static Document html(RawDocument doc) {
        return Jsoup.parse(doc.body(), doc.url());
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
