package com.agropulse.collectors.fetch;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

public interface SourceFetcher {
    /**
     * Retrieves a page. The future fails with a {@link FetchException} on any
     * unusable outcome; it never completes with a partial document.
     */
    CompletableFuture<RawDocument> fetch(URI uri);
}
