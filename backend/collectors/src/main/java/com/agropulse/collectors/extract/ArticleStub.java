package com.agropulse.collectors.extract;

import java.time.Instant;

public record ArticleStub(String url, String title, String teaser, String imageUrl, Instant listedAt) {
    public ArticleStub {
        title = title == null ? "" : title;
        teaser = teaser == null ? "" : teaser;
        imageUrl = imageUrl == null ? "" : imageUrl;
    }
}
