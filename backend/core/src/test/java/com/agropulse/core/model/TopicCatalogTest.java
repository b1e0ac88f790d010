package com.agropulse.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopicCatalogTest {
    private static final Topic DEFENSIVOS = new Topic(
            "defensivos", "Defensivos", "https://www.noticiasagricolas.com.br/noticias/agronegocio/", "Notícias Agrícolas",
            ListingFormat.DATED_SECTIONS, Set.of("Fungicida", "praga"), "#0FA66D", List.of("pesticide"));
    private static final Topic IRRIGACAO = new Topic(
            "irrigacao", "Irrigação", "https://www.noticiasagricolas.com.br/noticias/agronegocio/", null,
            null, Set.of("irrig"), "#1E90FF", List.of("irrigation"));
    private static final Topic SOJA = Topic.of("soja", "Soja", "https://www.noticiasagricolas.com.br/noticias/soja/", Set.of(), "#23A455");

    private final TopicCatalog catalog = new TopicCatalog(List.of(DEFENSIVOS, IRRIGACAO, SOJA), List.of(), "defensivos");

    @Test
    void topicNormalizesKeywordsAndDefaults() {
        assertEquals(Set.of("fungicida", "praga"), DEFENSIVOS.keywords());
        assertEquals(ListingFormat.DATED_SECTIONS, IRRIGACAO.format());
        assertEquals("#777777", new Topic("x", "X", null, null, null, null, null, null).color());
        assertThrows(NullPointerException.class, () -> new Topic(null, "X", null, null, null, null, null, null));
    }

    @Test
    void emptyKeywordSetAcceptsEverything() {
        assertTrue(SOJA.accepts("Qualquer manchete", ""));
        assertTrue(DEFENSIVOS.accepts("Nova praga ameaça lavouras", ""));
        assertFalse(DEFENSIVOS.accepts("Chuva volta ao Sul", "Previsão para a semana"));
    }

    @Test
    void displaySourcePrefersConfiguredNameThenHost() {
        assertEquals("Notícias Agrícolas", DEFENSIVOS.displaySource());
        assertEquals("www.noticiasagricolas.com.br", IRRIGACAO.displaySource());
        assertEquals("x", new Topic("x", "X", "not a uri", null, null, null, null, null).displaySource());
    }

    @Test
    void classifyUsesDeclarationOrderThenDefault() {
        assertEquals("irrigacao", catalog.classify("New irrigation pivots for soy farmers").id());
        assertEquals("soja", catalog.classify("Exportação de soja cresce").id());
        assertEquals("defensivos", catalog.classify("Market outlook for the week").id());
    }

    @Test
    void relevanceRequiresAnyTopicMention() {
        assertTrue(catalog.isRelevant("Pesticide registrations in Brazil"));
        assertFalse(catalog.isRelevant("Tractor sales slow down"));
        assertEquals(3, catalog.sourceCount());
    }

    @Test
    void snapshotCopiesAndReportsDegradation() {
        Article article = Article.of("  Soja  sobe ", "https://a/1", null, null, Instant.parse("2026-03-01T10:00:00Z"), "NA", SOJA);
        Snapshot snapshot = new Snapshot(List.of(article), Instant.parse("2026-03-01T12:00:00Z"), List.of("milho"));

        assertEquals("Soja sobe", snapshot.articles().get(0).title());
        assertFalse(article.hasSummary());
        assertFalse(article.hasImage());
        assertEquals("Soja", article.topicLabel());
        assertEquals(List.of("milho"), snapshot.degradedSources());
        assertEquals(1, snapshot.size());
    }
}
