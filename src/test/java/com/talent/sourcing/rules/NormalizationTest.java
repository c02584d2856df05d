package com.talent.sourcing.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Normalization Tests")
class NormalizationTest {

    @Nested
    @DisplayName("Organization names")
    class Names {

        private final NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();

        @Test
        @DisplayName("Should strip legal suffixes")
        void stripsSuffixes() {
            assertEquals("acme", engine.normalize("Acme Inc."));
            assertEquals("acme", engine.normalize("ACME, LLC"));
            assertEquals("globex", engine.normalize("Globex Corporation"));
            assertEquals("initech", engine.normalize("Initech GmbH"));
        }

        @Test
        @DisplayName("Should drop punctuation but keep hyphens")
        void punctuation() {
            assertEquals("rolls-royce holdings", engine.normalize("Rolls-Royce  Holdings!"));
        }

        @Test
        @DisplayName("Should return empty for blank input")
        void blank() {
            assertEquals("", engine.normalize("   "));
            assertEquals("", engine.normalize(null));
        }

        @Test
        @DisplayName("Should treat suffix variants as equivalent")
        void equivalent() {
            assertTrue(engine.areEquivalent("Acme Inc", "acme incorporated"));
            assertFalse(engine.areEquivalent("Acme", "Acme Labs"));
        }

        @Test
        @DisplayName("Should apply custom rules in priority order")
        void priorityOrder() {
            NormalizationEngine custom = new NormalizationEngine(List.of(
                    NormalizationRule.builder().name("second").pattern("b").replacement("c").priority(20).build(),
                    NormalizationRule.builder().name("first").pattern("a").replacement("b").priority(10).build()));

            assertEquals("c", custom.normalize("a"));
            assertEquals("first", custom.getRules().get(0).getName());
        }
    }

    @Nested
    @DisplayName("Websites")
    class Websites {

        @Test
        @DisplayName("Should reduce a full URL to its bare domain")
        void fullUrl() {
            assertEquals(Optional.of("acme.com"),
                    WebsiteNormalizer.normalize("https://user:pw@WWW.Acme.com:8443/about?x=1#team"));
        }

        @Test
        @DisplayName("Should accept a bare domain with a trailing dot")
        void bareDomain() {
            assertEquals(Optional.of("acme.com"), WebsiteNormalizer.normalize("acme.com."));
        }

        @Test
        @DisplayName("Should return empty for blank or host-less input")
        void empty() {
            assertTrue(WebsiteNormalizer.normalize(null).isEmpty());
            assertTrue(WebsiteNormalizer.normalize("  ").isEmpty());
            assertTrue(WebsiteNormalizer.normalize("https:///path").isEmpty());
        }
    }
}
