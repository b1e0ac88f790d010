package com.agropulse.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record QuoteBoard(List<Quote> quotes, Instant generatedAt) implements Timestamped {
    public QuoteBoard {
        Objects.requireNonNull(generatedAt, "generatedAt is required");
        quotes = quotes == null ? List.of() : List.copyOf(quotes);
    }

    @Override
    public int size() {
        return quotes.size();
    }
}
