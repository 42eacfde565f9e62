package com.jreinhal.cafefinder.search.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FuzzyIndexTest {

    private record Doc(String title, String body, List<String> tags) {
    }

    private static final IndexOptions<Doc> OPTIONS = new IndexOptions<>(List.of(
            IndexField.text("title", 2.0, Doc::title),
            IndexField.text("body", 1.0, Doc::body),
            IndexField.list("tags", 1.0, Doc::tags)), 0.4);

    private static final List<Doc> DOCS = List.of(
            new Doc("Jira", "Issue tracking", List.of("jira", "tickets")),
            new Doc("Confluence", "Team wiki", List.of("docs")),
            new Doc("Jira Guide", "How to use jira", List.of("guide")));

    private final FuzzyIndex<Doc> index = new FuzzyIndex<>(DOCS, OPTIONS);

    @Nested
    @DisplayName("search()")
    class SearchTest {
        @Test
        @DisplayName("Should rank the exact title match first")
        void shouldRankExactMatchFirst() {
            List<FuzzyHit<Doc>> hits = index.search(List.of("jira"), 10);

            assertThat(hits).extracting(FuzzyHit::refIndex).containsExactly(0, 2);
            assertThat(hits.get(0).score()).isGreaterThan(hits.get(1).score());
            assertThat(hits.get(0).matchedValues()).contains("Jira", "jira");
        }

        @Test
        @DisplayName("Should tolerate a typo")
        void shouldTolerateTypo() {
            List<FuzzyHit<Doc>> hits = index.search(List.of("Confluense"), 10);

            assertEquals(1, hits.size());
            assertEquals("Confluence", hits.get(0).item().title());
            // one substitution in ten characters, title weight 2 of 4
            assertThat(hits.get(0).score()).isCloseTo(1.0 - Math.sqrt(0.1), within(1e-9));
        }

        @Test
        @DisplayName("Should scale the field distance by weight and value length")
        void shouldApplyFieldNorm() {
            FuzzyIndex<Doc> single = new FuzzyIndex<>(
                    List.of(new Doc("Onboarding checklist", "Start here", List.of())), OPTIONS);

            List<FuzzyHit<Doc>> hits = single.search(List.of("checklist"), 10);

            assertEquals(1, hits.size());
            assertThat(hits.get(0).distance()).isCloseTo(Math.pow(0.11, 0.5 / Math.sqrt(2)), within(1e-9));
        }

        @Test
        @DisplayName("Should return nothing when no field matches")
        void shouldReturnEmptyWithoutMatch() {
            assertThat(index.search(List.of("zzzz"), 10)).isEmpty();
        }

        @Test
        @DisplayName("Should ignore terms shorter than the minimum length")
        void shouldIgnoreShortTerms() {
            assertThat(index.search(List.of("j"), 10)).isEmpty();
            assertThat(index.search(List.of(), 10)).isEmpty();
            assertThat(index.search(null, 10)).isEmpty();
        }

        @Test
        @DisplayName("Should cap hits at the limit")
        void shouldApplyLimit() {
            assertThat(index.search(List.of("jira"), 1)).extracting(FuzzyHit::refIndex).containsExactly(0);
            assertThat(index.search(List.of("jira"), 0)).isEmpty();
        }

        @Test
        @DisplayName("Should keep collection order between equal distances")
        void shouldKeepCollectionOrderOnTies() {
            Doc first = new Doc("Alpha", null, List.of());
            Doc second = new Doc("Alpha", null, List.of());
            FuzzyIndex<Doc> twins = new FuzzyIndex<>(List.of(first, second), OPTIONS);

            List<FuzzyHit<Doc>> hits = twins.search(List.of("alpha"), 10);

            assertThat(hits).extracting(FuzzyHit::refIndex).containsExactly(0, 1);
            assertThat(hits.get(0).item()).isSameAs(first);
        }
    }

    @Nested
    @DisplayName("termDistance()")
    class TermDistanceTest {
        @Test
        @DisplayName("Should be zero for a match at the start")
        void shouldBeZeroAtStart() {
            assertEquals(0.0, FuzzyIndex.termDistance("jira", "jira", 0.4));
            assertEquals(0.0, FuzzyIndex.termDistance("jira", "jira guide", 0.4));
        }

        @Test
        @DisplayName("Should penalize later occurrences")
        void shouldPenalizeOffset() {
            assertEquals(0.03, FuzzyIndex.termDistance("jira", "my jira", 0.4), 1e-9);
        }

        @Test
        @DisplayName("Should count edit errors relative to term length")
        void shouldCountErrors() {
            assertEquals(0.1, FuzzyIndex.termDistance("confluense", "confluence", 0.4), 1e-9);
        }

        @Test
        @DisplayName("Should report no occurrence as MAX_VALUE")
        void shouldReportNoMatch() {
            assertEquals(Double.MAX_VALUE, FuzzyIndex.termDistance("jira", "confluence", 0.4));
            assertEquals(Double.MAX_VALUE, FuzzyIndex.termDistance("jira", "", 0.4));
        }
    }

    @Test
    @DisplayName("Should reject invalid options")
    void shouldRejectInvalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> new IndexOptions<Doc>(List.of(), 0.4));
        assertThrows(IllegalArgumentException.class, () -> new IndexOptions<>(List.of(IndexField.text("title", 1.0, Doc::title)), 1.5));
        assertThrows(IllegalArgumentException.class, () -> IndexField.text("title", 0.0, Doc::title));
        assertEquals(4.0, OPTIONS.totalWeight());
    }
}
