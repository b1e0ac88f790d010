package com.agropulse.collectors.config;

import java.net.URI;

public record QuoteSettings(String baseUrl) {
    public static final String DEFAULT_BASE_URL = "https://www.noticiasagricolas.com.br";

    public QuoteSettings {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl.trim());
    }

    public static QuoteSettings defaults() {
        return new QuoteSettings(DEFAULT_BASE_URL);
    }

    public URI page(String path) {
        return URI.create(baseUrl + path);
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
