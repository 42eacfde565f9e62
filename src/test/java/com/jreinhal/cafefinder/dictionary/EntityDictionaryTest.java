package com.jreinhal.cafefinder.dictionary;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.cafefinder.search.entity.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EntityDictionaryTest {

    private final EntityDictionary dictionary = new EntityDictionary();

    @Test
    @DisplayName("Should resolve tools before any other table")
    void shouldResolveToolsFirst() {
        // "teams" is both a tool and part of team aliases
        assertThat(dictionary.lookupToken("teams"))
                .hasValueSatisfying(m -> {
                    assertThat(m.type()).isEqualTo(EntityType.TOOL);
                    assertThat(m.canonical()).isEqualTo("teams");
                    assertThat(m.confidence()).isEqualTo(0.95);
                });
    }

    @Test
    @DisplayName("Should map single-token aliases to their canonical value")
    void shouldMapAliases() {
        assertThat(dictionary.lookupToken("session")).hasValueSatisfying(m -> {
            assertThat(m.type()).isEqualTo(EntityType.TOPIC);
            assertThat(m.canonical()).isEqualTo("lop");
        });
        assertThat(dictionary.lookupToken("templates")).hasValueSatisfying(m -> {
            assertThat(m.type()).isEqualTo(EntityType.RESOURCE_TYPE);
            assertThat(m.canonical()).isEqualTo("template");
        });
        assertThat(dictionary.lookupToken("engineering")).hasValueSatisfying(m -> {
            assertThat(m.type()).isEqualTo(EntityType.TEAM);
            assertThat(m.canonical()).isEqualTo("engineering");
        });
    }

    @Test
    @DisplayName("Should return empty for unknown or blank tokens")
    void shouldReturnEmptyForUnknown() {
        assertThat(dictionary.lookupToken("cappuccino")).isEmpty();
        assertThat(dictionary.lookupToken("")).isEmpty();
        assertThat(dictionary.lookupToken(null)).isEmpty();
    }

    @Test
    @DisplayName("Should collect multi-word aliases of tools, topics and pillars")
    void shouldCollectMultiWordAliases() {
        assertThat(dictionary.multiWordAliases())
                .anySatisfy(a -> {
                    assertThat(a.phrase()).isEqualTo("coordination of benefits");
                    assertThat(a.canonical()).isEqualTo("cob");
                    assertThat(a.type()).isEqualTo(EntityType.TOPIC);
                })
                .anySatisfy(a -> {
                    assertThat(a.phrase()).isEqualTo("microsoft teams");
                    assertThat(a.type()).isEqualTo(EntityType.TOOL);
                })
                .anySatisfy(a -> {
                    assertThat(a.phrase()).isEqualTo("product craft");
                    assertThat(a.type()).isEqualTo(EntityType.PILLAR);
                })
                .allSatisfy(a -> assertThat(a.phrase()).contains(" "));
    }

    @Test
    @DisplayName("Should look up a surface form within one table")
    void shouldLookupWithinTable() {
        assertThat(dictionary.canonical(EntityType.TOOL, "Issue Tracker")).contains("jira");
        assertThat(dictionary.canonical(EntityType.TEAM, "jira")).isEmpty();
    }
}
