package com.agropulse.service.config;

import com.agropulse.collectors.config.AggregationSettings;
import com.agropulse.collectors.config.FetchSettings;
import com.agropulse.collectors.config.QuoteSettings;

import java.time.Duration;
import java.time.ZoneId;

public record AppConfig(
        int port,
        int retentionDays,
        int cacheTtlMinutes,
        int quoteTtlMinutes,
        int tickerIntervalSeconds,
        int firstLoadTimeoutSeconds,
        int fetchTimeoutSeconds,
        int fetchRetries,
        int topicParallelism,
        int detailConcurrency,
        int maxCandidatesPerListing,
        int maxArticlesPerSource,
        int maxArticles,
        String userAgent,
        String displayTimezone,
        String quoteBaseUrl
) {
    public AppConfig {
        port = port > 0 ? port : 8080;
        retentionDays = retentionDays > 0 ? retentionDays : 7;
        cacheTtlMinutes = cacheTtlMinutes > 0 ? cacheTtlMinutes : 15;
        quoteTtlMinutes = quoteTtlMinutes > 0 ? quoteTtlMinutes : 15;
        tickerIntervalSeconds = tickerIntervalSeconds > 0 ? tickerIntervalSeconds : 60;
        firstLoadTimeoutSeconds = firstLoadTimeoutSeconds > 0 ? firstLoadTimeoutSeconds : 45;
        fetchTimeoutSeconds = fetchTimeoutSeconds > 0 ? fetchTimeoutSeconds : 15;
        fetchRetries = Math.max(0, fetchRetries);
        topicParallelism = topicParallelism > 0 ? topicParallelism : 8;
        detailConcurrency = detailConcurrency > 0 ? detailConcurrency : 4;
        maxCandidatesPerListing = maxCandidatesPerListing > 0 ? maxCandidatesPerListing : 30;
        maxArticlesPerSource = maxArticlesPerSource > 0 ? maxArticlesPerSource : 4;
        maxArticles = Math.max(0, maxArticles);
        userAgent = userAgent == null || userAgent.isBlank() ? FetchSettings.DEFAULT_USER_AGENT : userAgent;
        displayTimezone = displayTimezone == null || displayTimezone.isBlank() ? "America/Sao_Paulo" : displayTimezone;
        quoteBaseUrl = quoteBaseUrl == null || quoteBaseUrl.isBlank() ? QuoteSettings.DEFAULT_BASE_URL : quoteBaseUrl;
    }

    public static AppConfig defaults() {
        return new AppConfig(0, 0, 0, 0, 0, 0, 0, 1, 0, 0, 0, 0, 0, null, null, null);
    }

    public AggregationSettings aggregationSettings() {
        return new AggregationSettings(retentionDays, maxCandidatesPerListing, maxArticlesPerSource, maxArticles, detailConcurrency);
    }

    public FetchSettings fetchSettings() {
        return new FetchSettings(Duration.ofSeconds(fetchTimeoutSeconds), fetchRetries, userAgent);
    }

    public QuoteSettings quoteSettings() {
        return new QuoteSettings(quoteBaseUrl);
    }

    public ZoneId zone() {
        return ZoneId.of(displayTimezone);
    }

    public Duration cacheTtl() {
        return Duration.ofMinutes(cacheTtlMinutes);
    }

    public Duration quoteTtl() {
        return Duration.ofMinutes(quoteTtlMinutes);
    }

    public Duration tickerInterval() {
        return Duration.ofSeconds(tickerIntervalSeconds);
    }

    public Duration firstLoadTimeout() {
        return Duration.ofSeconds(firstLoadTimeoutSeconds);
    }
}
