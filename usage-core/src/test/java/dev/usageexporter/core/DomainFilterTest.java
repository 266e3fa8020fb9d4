package dev.usageexporter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DomainFilter")
class DomainFilterTest {

    private static final Project ALPHA = new Project("p1", "genomics", "d-alpha", "alpha");
    private static final Project BETA = new Project("p2", "imaging", "d-beta", "beta");

    @Nested
    @DisplayName("Without configuration")
    class Unconfigured {

        @Test
        @DisplayName("should accept every project")
        void shouldAcceptEverything() {
            DomainFilter filter = DomainFilter.of(null, List.of());
            assertEquals("all domains", filter.toString());
            assertTrue(filter.accepts(ALPHA));
            assertTrue(filter.accepts(BETA));
        }

        @Test
        @DisplayName("should treat a blank domain id as absent")
        void shouldIgnoreBlankDomainId() {
            DomainFilter filter = DomainFilter.of("  ", List.of("beta"));
            assertFalse(filter.accepts(ALPHA));
            assertTrue(filter.accepts(BETA));
        }
    }

    @Nested
    @DisplayName("By domain names")
    class ByNames {

        @Test
        @DisplayName("should accept projects of any listed domain")
        void shouldMatchAnyName() {
            DomainFilter filter = DomainFilter.byDomainNames(List.of("alpha", "gamma"));
            assertTrue(filter.accepts(ALPHA));
            assertFalse(filter.accepts(BETA));
            assertTrue(filter.accepts(new Project("p3", "optics", "d-gamma", "gamma")));
        }

        @Test
        @DisplayName("should compare names exactly")
        void shouldBeCaseSensitive() {
            DomainFilter filter = DomainFilter.byDomainNames(List.of("Alpha"));
            assertFalse(filter.accepts(ALPHA));
        }
    }

    @Nested
    @DisplayName("By domain id")
    class ById {

        @Test
        @DisplayName("should ignore domain names whenever an id is configured")
        void idTakesPrecedence() {
            DomainFilter filter = DomainFilter.of("d-beta", List.of("alpha"));
            assertFalse(filter.accepts(ALPHA));
            assertTrue(filter.accepts(BETA));
            assertEquals(Optional.of("d-beta"), filter.domainId());
            assertEquals("domain_id=d-beta", filter.toString());
        }

        @Test
        @DisplayName("should not match on domain name equal to the id")
        void shouldNotMatchName() {
            DomainFilter filter = DomainFilter.byDomainId("alpha");
            assertFalse(filter.accepts(ALPHA));
        }
    }
}
