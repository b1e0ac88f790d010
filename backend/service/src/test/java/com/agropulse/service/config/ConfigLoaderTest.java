package com.agropulse.service.config;

import com.agropulse.core.model.ListingFormat;
import com.agropulse.core.model.Topic;
import com.agropulse.core.model.TopicCatalog;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    private static final Path SHIPPED_CONFIG = Path.of("../../config");

    @Test
    void loadsShippedCatalog() {
        TopicCatalog catalog = ConfigLoader.loadCatalog(SHIPPED_CONFIG);

        assertEquals(6, catalog.topics().size());
        assertEquals(2, catalog.feeds().size());
        assertEquals("defensivos", catalog.defaultTopicId());
        Topic soja = catalog.topic("soja").orElseThrow();
        assertTrue(soja.keywords().isEmpty());
        assertEquals("Notícias Agrícolas", soja.displaySource());
        assertEquals(ListingFormat.RSS, catalog.feeds().get(0).format());
        assertEquals(List.of("https://globalcropprotection.com/news/", "https://globalcropprotection.com/"),
                catalog.feeds().get(0).fallbackUrls());
        assertTrue(catalog.feeds().get(1).fallbackUrls().isEmpty());
        assertTrue(catalog.topic("defensivos").orElseThrow().keywords().contains("praga"));
    }

    @Test
    void loadsShippedAppConfig() {
        AppConfig app = ConfigLoader.loadApp(SHIPPED_CONFIG);

        assertEquals(8080, app.port());
        assertEquals(ZoneId.of("America/Sao_Paulo"), app.zone());
        assertEquals(Duration.ofMinutes(15), app.cacheTtl());
        assertEquals(15, app.aggregationSettings().maxArticles());
        assertEquals(1, app.fetchSettings().retries());
    }

    @Test
    void missingAppConfigFallsBackToDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");

        AppConfig app = ConfigLoader.loadApp(dir);

        assertEquals(AppConfig.defaults(), app);
        assertEquals(7, app.retentionDays());
        assertEquals(Duration.ofSeconds(45), app.firstLoadTimeout());
    }

    @Test
    void partialAppConfigKeepsDefaultsForAbsentKeys() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("app.json"), """
                {"port": 9090, "maxArticles": 12, "unknownKey": true}
                """);

        AppConfig app = ConfigLoader.loadApp(dir);

        assertEquals(9090, app.port());
        assertEquals(12, app.maxArticles());
        assertEquals(15, app.cacheTtlMinutes());
        assertEquals("America/Sao_Paulo", app.displayTimezone());
    }

    @Test
    void rejectsUnknownTimezone() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("app.json"), """
                {"displayTimezone": "Mars/Olympus"}
                """);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadApp(dir));
        assertTrue(error.getMessage().contains("Mars/Olympus"));
    }

    @Test
    void rejectsInvalidCatalogs() throws Exception {
        assertCatalogRejected("""
                {"topics": []}
                """, "No topics");
        assertCatalogRejected("""
                {"topics": [
                  {"id": "soja", "label": "Soja", "sourceRef": "https://a.example/soja/"},
                  {"id": "soja", "label": "Soja 2", "sourceRef": "https://a.example/soja2/"}
                ]}
                """, "Duplicate source id soja");
        assertCatalogRejected("""
                {"topics": [{"id": "soja", "label": "Soja", "sourceRef": "/noticias/soja/"}]}
                """, "absolute URL");
        assertCatalogRejected("""
                {"topics": [{"id": "soja", "label": "Soja", "sourceRef": "https://a.example/soja/"}],
                 "feeds": [{"id": "gcp", "name": "GCP", "format": "RSS", "listingUrls": []}]}
                """, "no listingUrls");
        assertCatalogRejected("""
                {"topics": [{"id": "soja", "label": "Soja", "sourceRef": "https://a.example/soja/"}],
                 "feeds": [{"id": "gcp", "name": "GCP", "format": "RSS", "listingUrls": ["https://gcp.example/feed/"],
                            "fallbackUrls": ["/news/"]}]}
                """, "absolute URL");
        assertCatalogRejected("""
                {"defaultTopicId": "cafe",
                 "topics": [{"id": "soja", "label": "Soja", "sourceRef": "https://a.example/soja/"}]}
                """, "defaultTopicId cafe");
        assertCatalogRejected("{ not json", "Failed loading config");
    }

    private static void assertCatalogRejected(String json, String expectedMessage) throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("topics.json"), json);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadCatalog(dir));
        assertTrue(error.getMessage().contains(expectedMessage), error.getMessage());
    }
}
