package com.agropulse.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MainTest {
    @Test
    void portEnvironmentOverridesConfiguredPort() {
        assertEquals(9000, Main.resolvePort(Map.of("PORT", " 9000 "), 8080));
    }

    @Test
    void missingOrInvalidPortKeepsConfiguredPort() {
        assertEquals(8080, Main.resolvePort(Map.of(), 8080));
        assertEquals(8080, Main.resolvePort(Map.of("PORT", ""), 8080));
        assertEquals(8080, Main.resolvePort(Map.of("PORT", "oitenta"), 8080));
    }
}
