package com.example.intake.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StringSanitizer")
class StringSanitizerTest {

    @Nested
    @DisplayName("forLog")
    class ForLog {

        @Test
        @DisplayName("should strip line breaks and tabs")
        void shouldStripLineBreaks() {
            assertThat(StringSanitizer.forLog("p1\r\nINFO forged\tline")).isEqualTo("p1INFO forgedline");
        }

        @Test
        @DisplayName("should truncate to the maximum length")
        void shouldTruncate() {
            assertThat(StringSanitizer.forLog("abcdef", 3)).isEqualTo("abc");
        }

        @Test
        @DisplayName("should render null as text")
        void shouldRenderNull() {
            assertThat(StringSanitizer.forLog(null)).isEqualTo("null");
        }
    }

    @Nested
    @DisplayName("maskIdentifier")
    class MaskIdentifier {

        @Test
        @DisplayName("should keep only the last four digits")
        void shouldKeepLastFourDigits() {
            assertThat(StringSanitizer.maskIdentifier("12345678901")).isEqualTo("*******8901");
        }

        @Test
        @DisplayName("should mask short identifiers entirely")
        void shouldMaskShortIdentifiers() {
            assertThat(StringSanitizer.maskIdentifier("123")).isEqualTo("***");
            assertThat(StringSanitizer.maskIdentifier(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("isValidSafeId")
    class IsValidSafeId {

        @ParameterizedTest
        @ValueSource(strings = {"p1", "doc-2024.03:1", "A_b"})
        @DisplayName("should accept safe ids")
        void shouldAcceptSafeIds(String id) {
            assertThat(StringSanitizer.isValidSafeId(id)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "p1 OR 1=1", "../etc", "a/b", "{\"$ne\":1}"})
        @DisplayName("should reject unsafe ids")
        void shouldRejectUnsafeIds(String id) {
            assertThat(StringSanitizer.isValidSafeId(id)).isFalse();
        }
    }
}
