package com.jreinhal.cafefinder.search.intent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.jreinhal.cafefinder.search.query.TextNormalizer;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier();

    private IntentResult classify(String query) {
        List<String> tokens = TextNormalizer.tokenize(query).stream().map(TextNormalizer::normalizeToken).toList();
        return classifier.classify(query, tokens);
    }

    @Nested
    @DisplayName("classify()")
    class ClassifyTest {
        @Test
        @DisplayName("Should saturate FIND_TOOL on a bare tool name")
        void shouldFindTool() {
            IntentResult result = classify("jira");

            assertEquals(IntentType.FIND_TOOL, result.primary());
            assertEquals(1.0, result.confidence());
            assertEquals(ExpectedResultType.ENTITY_CARD, result.expectedResult());
            assertEquals(QueryType.KEYWORD, result.queryType());
        }

        @Test
        @DisplayName("Should prefer TOOL_ACCESS over FIND_TOOL when both saturate")
        void shouldPreferToolAccessOnTie() {
            IntentResult result = classify("how do I get access to jira");

            assertEquals(IntentType.TOOL_ACCESS, result.primary());
            assertEquals(1.0, result.confidence());
            assertThat(result.secondary()).extracting(ScoredIntent::intent).contains(IntentType.FIND_TOOL);
            assertThat(result.secondary()).hasSizeLessThanOrEqualTo(3);
        }

        @Test
        @DisplayName("Should add the keyword bonus to a pattern match")
        void shouldAddKeywordBonus() {
            IntentResult result = classify("who is Sarah Chen");

            assertEquals(IntentType.FIND_PERSON, result.primary());
            assertEquals(0.95, result.confidence(), 1e-9);
            assertEquals(QueryType.QUESTION, result.queryType());
        }

        @Test
        @DisplayName("Should classify the next LOP session")
        void shouldClassifyNextLop() {
            IntentResult result = classify("next lop");

            assertEquals(IntentType.LOP_NEXT, result.primary());
            assertEquals(1.0, result.confidence());
        }

        @Test
        @DisplayName("Should fall back to GENERAL_SEARCH at 0.5 when nothing matches")
        void shouldFallBack() {
            IntentResult result = classify("zzqqxxnonsense999");

            assertEquals(IntentType.GENERAL_SEARCH, result.primary());
            assertEquals(0.5, result.confidence());
            assertEquals(ExpectedResultType.MIXED, result.expectedResult());
            assertThat(result.secondary()).isEmpty();
        }

        @Test
        @DisplayName("Should always produce a primary intent")
        void shouldAlwaysHavePrimary() {
            for (String query : List.of("", "?", "compare jira vs confluence", "steps for enrollment", "latest docs")) {
                assertNotNull(classify(query).primary(), query);
            }
        }

        @Test
        @DisplayName("Should be deterministic")
        void shouldBeDeterministic() {
            assertEquals(classify("where is the prd template"), classify("where is the prd template"));
        }

        @Test
        @DisplayName("Should count the words of a quoted phrase token as keywords")
        void shouldSplitQuotedPhraseToken() {
            IntentResult result = classifier.classify("\"login problems\"", List.of("login problems"));

            assertEquals(IntentType.TOOL_ACCESS, result.primary());
            assertEquals(IntentClassifier.KEYWORD_BONUS, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Should fall back to a primary intent on long garbage input")
        void shouldSurviveLongGarbage() {
            String garbage = "x#9\u00e9 ".repeat(1_600) + "q".repeat(2_000);

            IntentResult result = classify(garbage);

            assertNotNull(result.primary());
            assertThat(result.confidence()).isBetween(0.0, 1.0);
        }
    }

    @Test
    @DisplayName("Should sum base confidence per matching pattern and clamp at 1.0")
    void shouldScoreDefinitions() {
        IntentDefinition definition = new IntentDefinition(IntentType.BROWSE,
                List.of(IntentPattern.phrase("browse"), IntentPattern.keyword("all")),
                List.of("list"), ExpectedResultType.RESOURCE_LIST, 0.4);

        assertEquals(0.8, IntentClassifier.score(definition, "browse all", Set.of("browse", "all")), 1e-9);
        assertEquals(0.9, IntentClassifier.score(definition, "browse all list", Set.of("browse", "all", "list")), 1e-9);
        assertEquals(0.1, IntentClassifier.score(definition, "list", Set.of("list")), 1e-9);
    }

    @Test
    @DisplayName("Should break ties by catalog order")
    void shouldBreakTiesByCatalogOrder() {
        IntentDefinition first = new IntentDefinition(IntentType.RECENT,
                List.of(IntentPattern.keyword("docs")), List.of(), ExpectedResultType.RESOURCE_LIST, 0.7);
        IntentDefinition second = new IntentDefinition(IntentType.POPULAR,
                List.of(IntentPattern.keyword("docs")), List.of(), ExpectedResultType.RESOURCE_LIST, 0.7);

        IntentResult result = new IntentClassifier(List.of(first, second)).classify("docs", List.of("docs"));

        assertEquals(IntentType.RECENT, result.primary());
        assertThat(result.secondary()).containsExactly(new ScoredIntent(IntentType.POPULAR, 0.7));
    }

    @Test
    @DisplayName("Should detect the surface shape of a query")
    void shouldDetectQueryType() {
        assertEquals(QueryType.QUESTION, IntentClassifier.detectQueryType("How do I reset my password"));
        assertEquals(QueryType.COMMAND, IntentClassifier.detectQueryType("open jira"));
        assertEquals(QueryType.NAME, IntentClassifier.detectQueryType("Sarah Chen"));
        assertEquals(QueryType.KEYWORD, IntentClassifier.detectQueryType("cob guide"));
        assertEquals(QueryType.PHRASE, IntentClassifier.detectQueryType("quarterly roadmap planning template"));
        assertEquals(QueryType.KEYWORD, IntentClassifier.detectQueryType(""));
    }

    @Test
    @DisplayName("Should only trust a primary intent at or above 0.5")
    void shouldApplyTrustThreshold() {
        IntentResult weak = new IntentResult(IntentType.FIND_FAQ, 0.4, List.of(), QueryType.KEYWORD, ExpectedResultType.DIRECT_ANSWER);
        IntentResult strong = new IntentResult(IntentType.FIND_FAQ, 0.5, List.of(), QueryType.KEYWORD, ExpectedResultType.DIRECT_ANSWER);

        assertEquals(IntentType.GENERAL_SEARCH, IntentClassifier.effectiveIntent(weak, IntentType.GENERAL_SEARCH));
        assertEquals(IntentType.FIND_FAQ, IntentClassifier.effectiveIntent(strong, IntentType.GENERAL_SEARCH));
        assertEquals(IntentType.BROWSE, IntentClassifier.effectiveIntent(null, IntentType.BROWSE));
    }

    @Test
    @DisplayName("Should group intents by purpose")
    void shouldGroupIntents() {
        assertThat(IntentType.FIND_PERSON.isFind()).isTrue();
        assertThat(IntentType.TOOL_ACCESS.isAction()).isTrue();
        assertThat(IntentType.COMPARE.isLearn()).isTrue();
        assertThat(IntentType.LOP_NEXT.isLop()).isTrue();
        assertThat(IntentType.GENERAL_SEARCH.isFind()).isFalse();
    }
}
