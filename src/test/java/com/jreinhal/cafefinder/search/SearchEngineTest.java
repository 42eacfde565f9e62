package com.jreinhal.cafefinder.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.cafefinder.exception.IndexInitializationException;
import com.jreinhal.cafefinder.search.answer.AnswerType;
import com.jreinhal.cafefinder.search.entity.Entity;
import com.jreinhal.cafefinder.search.entity.EntityType;
import com.jreinhal.cafefinder.search.index.MultiIndexSearch;
import com.jreinhal.cafefinder.search.intent.IntentType;
import com.jreinhal.cafefinder.search.query.QueryProcessor;
import com.jreinhal.cafefinder.search.result.LopSessionResult;
import com.jreinhal.cafefinder.search.result.PersonResult;
import com.jreinhal.cafefinder.search.result.SearchResult;
import com.jreinhal.cafefinder.search.result.SearchResultType;
import com.jreinhal.cafefinder.search.result.SearchResults;
import com.jreinhal.cafefinder.support.CorpusFixtures;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SearchEngineTest {

    private static final List<String> ZERO_SUGGESTIONS = List.of("Browse all resources", "Start a discussion");

    private final SearchEngine engine = CorpusFixtures.engine(CorpusFixtures.standardCorpus());

    @Nested
    @DisplayName("search()")
    class SearchTest {
        @Test
        @DisplayName("Should answer a bare tool name with a tool card")
        void shouldAnswerToolQuery() {
            SearchResponse response = engine.search("jira");

            assertEquals(IntentType.FIND_TOOL, response.query().intent().primary());
            assertEquals("tool-jira", response.results().get(SearchResultType.TOOL).get(0).id());
            assertEquals(1.0, response.results().get(SearchResultType.TOOL).get(0).score());
            assertNotNull(response.answer());
            assertEquals(AnswerType.TOOL_CARD, response.answer().type());
            assertEquals("Jira: Issue tracking for engineering teams", response.answer().text());
            assertEquals(response.results().totalCount(), response.totalCount());
            assertThat(response.suggestions()).isEmpty();
        }

        @Test
        @DisplayName("Should return the zero-results answer and suggestions for nonsense")
        void shouldHandleZeroResults() {
            SearchResponse response = engine.search("zzqqxxnonsense999");

            assertEquals(0, response.totalCount());
            assertEquals(IntentType.GENERAL_SEARCH, response.query().intent().primary());
            assertEquals(0.5, response.query().intent().confidence());
            assertEquals(AnswerType.ZERO_RESULTS, response.answer().type());
            assertEquals(ZERO_SUGGESTIONS, response.suggestions());
            assertThat(response.results().asMap()).hasSize(SearchResultType.values().length);
        }

        @Test
        @DisplayName("Should announce the next LOP session")
        void shouldAnswerNextLop() {
            SearchResponse response = engine.search("next lop");

            assertEquals(IntentType.LOP_NEXT, response.query().intent().primary());
            List<SearchResult> sessions = response.results().get(SearchResultType.LOP_SESSION);
            assertThat(sessions).extracting(SearchResult::id).containsExactly("lop-3", "lop-2");
            assertEquals(LopSessionResult.UNKNOWN_SPEAKER, ((LopSessionResult) sessions.get(0)).speakerName());
            assertEquals(AnswerType.LOP_SESSION, response.answer().type());
            assertEquals("The next Love of Product session is \"Revenue Deep Dive\" on March 25, 2026.",
                    response.answer().text());
        }

        @Test
        @DisplayName("Should return the empty envelope for blank input")
        void shouldHandleBlankQuery() {
            for (String blank : new String[] {null, "", "   ", "\t\n"}) {
                SearchResponse response = engine.search(blank);

                assertEquals("", response.query().raw());
                assertEquals(0, response.totalCount());
                assertNull(response.answer());
                assertEquals(ZERO_SUGGESTIONS, response.suggestions());
                assertEquals(CorpusFixtures.CLOCK.instant(), response.metrics().timestamp());
            }
        }

        @Test
        @DisplayName("Should keep quoted phrases as single tokens")
        void shouldKeepQuotedPhrase() {
            SearchResponse response = engine.search("\"prior authorization\" faq");

            assertThat(response.query().tokens()).contains("prior authorization", "faq");
            assertThat(response.results().get(SearchResultType.FAQ)).extracting(SearchResult::id).contains("faq-1");
        }

        @Test
        @DisplayName("Should bound query length and expansion")
        void shouldBoundInput() {
            SearchResponse truncated = engine.search("jira ".repeat(120));
            String manyWords = IntStream.range(0, 80).mapToObj(i -> "word" + i).collect(Collectors.joining(" "));
            SearchResponse expanded = engine.search(manyWords);

            assertThat(truncated.query().raw().length()).isLessThanOrEqualTo(QueryProcessor.MAX_QUERY_LENGTH);
            assertThat(expanded.query().expandedTokens()).hasSizeLessThanOrEqualTo(QueryProcessor.MAX_EXPANDED_TOKENS);
        }

        @Test
        @DisplayName("Should return the zero-results envelope for a long garbage query")
        void shouldSurviveLongGarbage() {
            Random random = new Random(42);
            StringBuilder garbage = new StringBuilder();
            while (garbage.length() < 10_000) {
                for (int i = 0; i < 8; i++) {
                    garbage.append("qxz".charAt(random.nextInt(3)));
                }
                garbage.append(" #%").append("&~^".charAt(random.nextInt(3))).append(' ');
            }
            garbage.setLength(10_000);

            SearchResponse response = engine.search(garbage.toString());

            assertNotNull(response);
            assertNotNull(response.query().intent().primary());
            assertEquals(0, response.totalCount());
            assertEquals(AnswerType.ZERO_RESULTS, response.answer().type());
            assertEquals(ZERO_SUGGESTIONS, response.suggestions());
        }

        @Test
        @DisplayName("Should keep every score within [0, 1] before and after reranking")
        void shouldBoundScores() {
            MultiIndexSearch index = CorpusFixtures.index(CorpusFixtures.standardCorpus());
            SearchEngine scoped = CorpusFixtures.engine(index, new SearchProperties());
            for (String q : List.of("jira", "who is Sarah Chen", "next lop", "prior authorization faq",
                    "confluense docs", "payer competitors")) {
                SearchResponse response = scoped.search(q);
                SearchResults raw = index.searchAll(response.query().searchTerms(), response.query().entities(), 20);

                for (SearchResults results : List.of(raw, response.results())) {
                    results.asMap().values().forEach(list -> assertThat(list)
                            .allSatisfy(r -> assertThat(r.score()).as("%s %s", q, r.id()).isBetween(0.0, 1.0)));
                }
            }
        }

        @Test
        @DisplayName("Should carry the search context through")
        void shouldCarryContext() {
            SearchContext context = new SearchContext("/library", "res-1", List.of("onboarding"));

            assertEquals(context, engine.search("jira", context).query().context());
        }

        @Test
        @DisplayName("Should skip the answer when synthesis is disabled")
        void shouldRespectAnswerFlag() {
            SearchProperties props = new SearchProperties();
            props.setAnswerSynthesis(false);
            SearchEngine quiet = CorpusFixtures.engine(CorpusFixtures.index(CorpusFixtures.standardCorpus()), props);

            SearchResponse response = quiet.search("jira");

            assertNull(response.answer());
            assertThat(response.totalCount()).isPositive();
        }

        @Test
        @DisplayName("Should record stage timings")
        void shouldRecordMetrics() {
            SearchMetrics metrics = engine.search("jira").metrics();

            assertEquals(CorpusFixtures.CLOCK.instant(), metrics.timestamp());
            assertThat(metrics.totalTimeMs()).isGreaterThanOrEqualTo(metrics.searchExecutionMs());
            assertThat(metrics.queryProcessingMs()).isNotNegative();
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTest {
        @Test
        @DisplayName("Should degrade to failure suggestions when the index cannot be built")
        void shouldHandleInitializationFailure() {
            MultiIndexSearch index = mock(MultiIndexSearch.class);
            when(index.isInitialized()).thenReturn(false);
            doThrow(new IndexInitializationException("corpus down", new IllegalStateException("io")))
                    .when(index).initialize();

            SearchResponse response = CorpusFixtures.engine(index, new SearchProperties()).search("jira");

            assertEquals("jira", response.query().raw());
            assertEquals(0, response.totalCount());
            assertEquals(SearchEngine.FAILURE_SUGGESTIONS, response.suggestions());
            verify(index, never()).searchAll(anyList(), anyList(), anyInt());
        }

        @Test
        @DisplayName("Should degrade to failure suggestions when a stage throws")
        void shouldHandleStageFailure() {
            MultiIndexSearch index = mock(MultiIndexSearch.class);
            when(index.isInitialized()).thenReturn(true);
            when(index.searchAll(anyList(), anyList(), anyInt())).thenThrow(new IllegalStateException("boom"));

            SearchResponse response = CorpusFixtures.engine(index, new SearchProperties()).search("jira");

            assertNull(response.answer());
            assertEquals(SearchEngine.FAILURE_SUGGESTIONS, response.suggestions());
        }

        @Test
        @DisplayName("Should swallow warm-up failures so the next search retries")
        void shouldSurviveWarmUpFailure() {
            MultiIndexSearch index = mock(MultiIndexSearch.class);
            doThrow(new IndexInitializationException("corpus down", new IllegalStateException("io")))
                    .when(index).initialize();

            assertDoesNotThrow(() -> CorpusFixtures.engine(index, new SearchProperties()).warmUp());
        }
    }

    @Nested
    @DisplayName("quickSearch()")
    class QuickSearchTest {
        @Test
        @DisplayName("Should return people, FAQs and resources")
        void shouldSearchThreeCategories() {
            QuickSearchResponse response = engine.quickSearch("sarah chen");

            assertThat(response.people()).extracting(PersonResult::id).first().isEqualTo("user-1");
        }

        @Test
        @DisplayName("Should honour the limit")
        void shouldApplyLimit() {
            QuickSearchResponse response = engine.quickSearch("payer", 1);

            assertThat(response.people()).hasSizeLessThanOrEqualTo(1);
            assertThat(response.faqs()).hasSizeLessThanOrEqualTo(1);
            assertThat(response.resources()).hasSizeLessThanOrEqualTo(1);
        }

        @Test
        @DisplayName("Should return empty lists for blank input or index failure")
        void shouldReturnEmpty() {
            MultiIndexSearch index = mock(MultiIndexSearch.class);
            when(index.searchPeople(anyList(), anyList(), anyInt())).thenThrow(new IllegalStateException("boom"));

            assertEquals(QuickSearchResponse.empty(), engine.quickSearch("  "));
            assertEquals(QuickSearchResponse.empty(),
                    CorpusFixtures.engine(index, new SearchProperties()).quickSearch("sarah"));
        }
    }

    @Nested
    @DisplayName("Index lifecycle")
    class LifecycleTest {
        @Test
        @DisplayName("Should report status keyed by category")
        void shouldReportStatus() {
            assertFalse(engine.status().initialized());
            assertThat(engine.status().indexSizes()).isEmpty();

            engine.search("jira");

            IndexStatus status = engine.status();
            assertTrue(status.initialized());
            assertThat(status.indexSizes().keySet()).first().isEqualTo("people");
            assertEquals(2, status.indexSizes().get("tools"));
        }

        @Test
        @DisplayName("Should warm up only when configured to")
        void shouldWarmUpOnStartup() {
            SearchProperties lazy = new SearchProperties();
            lazy.setInitializeOnStartup(false);
            SearchEngine lazyEngine = CorpusFixtures.engine(CorpusFixtures.index(CorpusFixtures.standardCorpus()), lazy);

            lazyEngine.warmUp();
            engine.warmUp();

            assertFalse(lazyEngine.status().initialized());
            assertTrue(engine.status().initialized());
        }

        @Test
        @DisplayName("Should rebuild on reindex")
        void shouldReindex() {
            IndexStatus status = engine.reindex();

            assertTrue(status.initialized());
            assertEquals(3, status.indexSizes().get("lopSessions"));
        }
    }

    @Test
    @DisplayName("Should suggest topic follow-ups only when nothing matched")
    void shouldSuggestFollowUps() {
        Entity topic = new Entity(EntityType.TOPIC, "session", "lop", 0.85, new Entity.Position(0, 7));

        assertEquals(List.of("lop guide", "lop faq", "lop expert", "Browse all resources", "Start a discussion"),
                SearchEngine.suggestionsFor(List.of(topic), SearchResults.empty()));
        assertEquals(ZERO_SUGGESTIONS, SearchEngine.suggestionsFor(List.of(), SearchResults.empty()));

        SearchResults some = SearchResults.of(Map.of(SearchResultType.PERSON, List.of(PersonResult.of(
                CorpusFixtures.person("user-1", "Sarah Chen", "Product Manager", "Product"), 0.5, List.of()))));
        assertThat(SearchEngine.suggestionsFor(List.of(topic), some)).isEmpty();
    }
}
