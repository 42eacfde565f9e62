package com.jreinhal.cafefinder.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SynonymDictionaryTest {

    private final SynonymDictionary dictionary = SynonymDictionary.defaults();

    @Nested
    @DisplayName("canonicalOf()")
    class CanonicalOfTest {
        @Test
        @DisplayName("Should map an alias to its canonical term")
        void shouldMapAlias() {
            assertEquals("jira", dictionary.canonicalOf("bug tracker"));
            assertEquals("figma", dictionary.canonicalOf("Wireframe"));
        }

        @Test
        @DisplayName("Should return the lowercased term when unknown")
        void shouldReturnUnknownTermLowercased() {
            assertEquals("espresso", dictionary.canonicalOf("  Espresso "));
        }

        @Test
        @DisplayName("Should let the last registration win for shared aliases")
        void shouldPreferLastRegistration() {
            // "wiki" is declared by confluence and later by notion
            assertEquals("notion", dictionary.canonicalOf("wiki"));
            assertEquals("lop", dictionary.canonicalOf("presentation"));
        }

        @Test
        @DisplayName("Should prefer alias ownership over a canonical key of the same name")
        void shouldPreferAliasOverKey() {
            assertEquals("compliance", dictionary.canonicalOf("hipaa"));
            assertEquals("legal", dictionary.canonicalOf("compliance"));
        }
    }

    @Nested
    @DisplayName("synonymsOf()")
    class SynonymsOfTest {
        @Test
        @DisplayName("Should list the canonical term first")
        void shouldListCanonicalFirst() {
            assertThat(dictionary.synonymsOf("jira"))
                    .containsExactly("jira", "atlassian", "issue tracker", "ticket system", "bug tracker", "issue management");
        }

        @Test
        @DisplayName("Should resolve aliases to the full group")
        void shouldResolveAliasToGroup() {
            assertThat(dictionary.synonymsOf("issue tracker")).first().isEqualTo("jira");
        }

        @Test
        @DisplayName("Should use the later table's aliases for a key declared twice")
        void shouldUseLaterTableForDuplicateKey() {
            assertThat(dictionary.synonymsOf("rcm")).containsExactly("rcm", "revenue cycle", "rcm team", "billing team");
        }

        @Test
        @DisplayName("Should return only the term when unknown")
        void shouldReturnTermWhenUnknown() {
            assertThat(dictionary.synonymsOf("Latte")).containsExactly("latte");
        }
    }

    @Test
    @DisplayName("Should treat aliases of the same concept as synonyms")
    void shouldDetectSynonyms() {
        assertTrue(dictionary.areSynonyms("issue tracker", "ticket system"));
        assertFalse(dictionary.areSynonyms("jira", "slack"));
    }

    @Test
    @DisplayName("Should extend the vocabulary from configured entries")
    void shouldMergeConfiguredEntries() {
        SynonymDictionary extended = new SynonymDictionary(true,
                Map.of("coffee", List.of("Espresso", "latte"), "jira", List.of("tickets")));

        assertEquals("coffee", extended.canonicalOf("espresso"));
        assertEquals("jira", extended.canonicalOf("tickets"));
        assertThat(extended.synonymsOf("jira")).contains("atlassian", "tickets");
        assertTrue(extended.isKnown("latte"));
        assertThat(extended.canonicalTerms()).contains("coffee");
    }

    @Test
    @DisplayName("Should report whether expansion is enabled")
    void shouldExposeEnabledFlag() {
        assertTrue(dictionary.isEnabled());
        assertFalse(new SynonymDictionary(false, Map.of()).isEnabled());
    }
}
