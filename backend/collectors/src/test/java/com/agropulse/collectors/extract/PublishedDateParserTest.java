package com.agropulse.collectors.extract;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PublishedDateParserTest {
    private final PublishedDateParser parser = new PublishedDateParser(ZoneId.of("America/Sao_Paulo"));

    @Test
    void machineFormatsWithOffsetKeepTheirInstant() {
        assertEquals(at("2026-03-10T12:00:00Z"), parser.parseMachine("2026-03-10T12:00:00Z"));
        assertEquals(at("2026-03-10T15:00:00Z"), parser.parseMachine("2026-03-10T12:00:00-03:00"));
        assertEquals(at("2026-03-10T09:00:00Z"), parser.parseMachine("Tue, 10 Mar 2026 09:00:00 +0000"));
        assertEquals(at("2026-03-10T15:00:00Z"), parser.parseMachine("2026-03-10T12:00:00-0300"));
    }

    @Test
    void machineFormatsWithoutOffsetUseTheDisplayZone() {
        assertEquals(at("2026-03-10T11:30:00Z"), parser.parseMachine("2026-03-10T08:30:00"));
        assertEquals(at("2026-03-10T03:00:00Z"), parser.parseMachine("2026-03-10"));
    }

    @Test
    void garbageAndBlankAreEmpty() {
        assertTrue(parser.parseMachine("ontem").isEmpty());
        assertTrue(parser.parseMachine("  ").isEmpty());
        assertTrue(parser.parseMachine(null).isEmpty());
    }

    @Test
    void localTextPrefersDateWithTime() {
        assertEquals(at("2026-03-10T17:35:00Z"), parser.parseLocalText("Publicado em 10/03/2026 às 14:35"));
        assertEquals(at("2026-03-10T03:00:00Z"), parser.parseLocalText("Atualizado 10/03/2026"));
        assertTrue(parser.parseLocalText("sem data").isEmpty());
    }

    @Test
    void invalidTimeFallsBackToStartOfDay() {
        assertEquals(at("2026-03-01T03:00:00Z"), parser.combine("01/03/2026", "25:99"));
        assertEquals(at("2026-03-01T11:00:00Z"), parser.combine("01/03/2026", " 08:00 "));
        assertTrue(parser.combine("32/02/2026", null).isEmpty());
    }

    private static Optional<Instant> at(String instant) {
        return Optional.of(Instant.parse(instant));
    }
}
