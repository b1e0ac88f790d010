package com.agropulse.collectors.fetch;

import java.time.Instant;

public record RawDocument(String url, Instant fetchedAt, String body) {
}
