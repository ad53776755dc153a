package com.shipyard.core.tagging;

import com.shipyard.core.model.DerivedTags;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class TagDeriverTest {

    private final TagDeriver deriver = new TagDeriver("ghcr.io", "Acme", "Sample-App");

    static Stream<String> sanitizeInputs() {
        return Stream.of("main", "2/merge", "Feature/ÜNICODE ref", "--x--", "a..b__c", "UPPER/lower/123",
                "weird!@#$%^&*()chars", " spaces everywhere ", "x-".repeat(100), "Y/".repeat(200));
    }

    @Nested
    @DisplayName("sanitize")
    class Sanitize {

        @Test
        @DisplayName("pull request merge ref becomes 2-merge")
        void mergeRef() {
            assertEquals("2-merge", deriver.sanitize("2/merge"));
        }

        @Test
        @DisplayName("lower-cases and replaces disallowed characters")
        void lowerCasesAndReplaces() {
            assertEquals("feature-add-login", deriver.sanitize("Feature/Add Login"));
            assertEquals("release-1.2_rc", deriver.sanitize("release@1.2_RC"));
        }

        @Test
        @DisplayName("collapses dash runs and trims leading and trailing dashes")
        void collapsesAndTrims() {
            assertEquals("a-b", deriver.sanitize("--a//  b--"));
        }

        @Test
        @DisplayName("null and all-disallowed input give empty string")
        void emptyResults() {
            assertEquals("", deriver.sanitize(null));
            assertEquals("", deriver.sanitize("///"));
        }

        @Test
        @DisplayName("truncates to max length without a trailing dash")
        void truncates() {
            assertEquals("abcd", TagDeriver.sanitize("abcd-efgh", 5));
            assertEquals(128, deriver.sanitize("x".repeat(300)).length());
        }

        @ParameterizedTest
        @MethodSource("com.shipyard.core.tagging.TagDeriverTest#sanitizeInputs")
        @DisplayName("output is idempotent and uses only the allowed alphabet")
        void idempotentAndValid(String ref) {
            String once = deriver.sanitize(ref);
            assertEquals(once, deriver.sanitize(once));
            assertTrue(once.matches("[a-z0-9._-]*"), once);
            assertTrue(once.length() <= 128);
            assertFalse(once.startsWith("-"));
            assertFalse(once.endsWith("-"));
        }
    }

    @Nested
    @DisplayName("deriveTags")
    class DeriveTags {

        @Test
        @DisplayName("mutable from ref, immutable is the commit verbatim")
        void derivesBoth() {
            DerivedTags tags = deriver.deriveTags("2/merge", "3f2a9c1");

            assertEquals("ghcr.io/acme/sample-app:2-merge", tags.mutableTag().reference());
            assertEquals("ghcr.io/acme/sample-app:3f2a9c1", tags.immutableTag().reference());
            assertEquals(2, tags.asList().size());
        }

        @Test
        @DisplayName("deterministic for the same inputs")
        void deterministic() {
            assertEquals(deriver.deriveTags("main", "abc"), deriver.deriveTags("main", "abc"));
        }

        @Test
        @DisplayName("empty sanitized ref falls back to the placeholder")
        void placeholder() {
            assertEquals(TagDeriver.DEFAULT_PLACEHOLDER, deriver.deriveTags("", "abc").mutableTag().tag());
            assertEquals(TagDeriver.DEFAULT_PLACEHOLDER, deriver.deriveTags("///", "abc").mutableTag().tag());
            assertEquals(TagDeriver.DEFAULT_PLACEHOLDER, deriver.deriveTags(null, "abc").mutableTag().tag());
        }

        @Test
        @DisplayName("missing commit is rejected")
        void missingCommit() {
            assertThrows(IllegalArgumentException.class, () -> deriver.deriveTags("main", " "));
            assertThrows(IllegalArgumentException.class, () -> deriver.deriveTags("main", null));
        }

        @Test
        @DisplayName("invalid placeholder is sanitized too")
        void customPlaceholder() {
            var custom = new TagDeriver("r", "n", "p", 128, "No Ref!");
            assertEquals("no-ref", custom.mutableTag("").tag());
        }
    }
}
