package com.agropulse.core.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlCanonicalizerTest {
    @Test
    void stripsQueryFragmentDefaultPortAndTrailingSlash() {
        assertEquals(
                Optional.of("https://www.noticiasagricolas.com.br/noticias/soja/123-safra"),
                UrlCanonicalizer.canonicalize("HTTPS://WWW.NoticiasAgricolas.com.br:443/noticias/soja/123-safra/?utm_source=x#topo")
        );
    }

    @Test
    void keepsPathCaseAndNonDefaultPort() {
        assertEquals(
                Optional.of("http://localhost:8081/Noticias/A"),
                UrlCanonicalizer.canonicalize("http://LOCALHOST:8081/Noticias/A/")
        );
    }

    @Test
    void rootPathBecomesSlash() {
        assertEquals(Optional.of("https://example.com/"), UrlCanonicalizer.canonicalize("https://example.com"));
    }

    @Test
    void rejectsBlankRelativeAndMalformedUrls() {
        assertTrue(UrlCanonicalizer.canonicalize(null).isEmpty());
        assertTrue(UrlCanonicalizer.canonicalize("   ").isEmpty());
        assertTrue(UrlCanonicalizer.canonicalize("/noticias/soja").isEmpty());
        assertTrue(UrlCanonicalizer.canonicalize("http://exa mple.com/a b").isEmpty());
    }
}
