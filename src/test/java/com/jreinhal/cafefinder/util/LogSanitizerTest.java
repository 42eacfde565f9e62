package com.jreinhal.cafefinder.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Nested
    @DisplayName("querySummary()")
    class QuerySummaryTest {
        @Test
        @DisplayName("Should return len=0 and id=none for null query")
        void shouldHandleNull() {
            assertThat(LogSanitizer.querySummary(null)).isEqualTo("[len=0,id=none]");
        }

        @Test
        @DisplayName("Should not include the query text")
        void shouldHideText() {
            String result = LogSanitizer.querySummary("who is sarah chen");

            assertThat(result).startsWith("[len=17,id=").endsWith("]").doesNotContain("sarah");
        }

        @Test
        @DisplayName("Should return consistent ids for the same input")
        void shouldBeConsistent() {
            assertThat(LogSanitizer.querySummary("next lop")).isEqualTo(LogSanitizer.querySummary("next lop"));
        }
    }

    @Nested
    @DisplayName("sanitize()")
    class SanitizeTest {
        @Test
        @DisplayName("Should flatten line breaks and drop control characters")
        void shouldFlattenLines() {
            assertThat(LogSanitizer.sanitize("jira\r\nINFO forged\u0007")).isEqualTo("jira INFO forged");
        }

        @Test
        @DisplayName("Should cut long values")
        void shouldTruncate() {
            String result = LogSanitizer.sanitize("x".repeat(200));

            assertThat(result).hasSize(123).endsWith("...");
        }

        @Test
        @DisplayName("Should return empty string for null")
        void shouldHandleNull() {
            assertThat(LogSanitizer.sanitize(null)).isEmpty();
        }
    }
}
