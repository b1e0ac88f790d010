package com.agropulse.service.http;

import java.net.http.HttpClient;
import java.time.Duration;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    // News portals move articles between canonical paths, so redirects are followed.
    public static HttpClient create(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
