package com.jreinhal.cafefinder.search.intent;

import com.jreinhal.cafefinder.search.query.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores a query against {@link IntentCatalog} and detects its surface shape.
 *
 * A definition scores its base confidence once per matching pattern, plus a flat keyword bonus,
 * clamped to 1.0. Callers decide how far to trust the result; see {@link #TRUST_THRESHOLD}.
 */
@Component
public class IntentClassifier {
    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    /** Below this confidence the primary intent should not drive behaviour on its own. */
    public static final double TRUST_THRESHOLD = 0.5;
    static final double KEYWORD_BONUS = 0.10;
    static final double NO_MATCH_CONFIDENCE = 0.5;
    private static final int MAX_SECONDARY = 3;

    private static final Pattern QUESTION_START = Pattern.compile(
            "^(how|what|who|where|when|why|which|can|is|does|do|are|will|would|could|should)\\b");
    private static final Pattern COMMAND_START = Pattern.compile(
            "^(show|open|go|find|get|list|browse|take|navigate)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<IntentDefinition> catalog;

    public IntentClassifier() {
        this(IntentCatalog.DEFINITIONS);
    }

    IntentClassifier(List<IntentDefinition> catalog) {
        this.catalog = List.copyOf(catalog);
    }

    /**
     * @param query the sanitized query; capitalization is used for shape detection
     * @param tokens the query tokens
     */
    public IntentResult classify(String query, List<String> tokens) {
        String normalized = TextNormalizer.normalizeQuery(query);
        Set<String> tokenSet = new HashSet<>();
        for (String token : tokens == null ? List.<String>of() : tokens) {
            // Quoted phrases arrive as one token; their words count individually.
            for (String word : WHITESPACE.split(TextNormalizer.normalizeTerm(token))) {
                String t = TextNormalizer.normalizeToken(word);
                if (!t.isEmpty()) {
                    tokenSet.add(t);
                }
            }
        }
        QueryType queryType = detectQueryType(query);

        List<Candidate> candidates = new ArrayList<>();
        for (IntentDefinition definition : this.catalog) {
            double score = score(definition, normalized, tokenSet);
            if (score > 0) {
                candidates.add(new Candidate(definition, score));
            }
        }
        if (candidates.isEmpty()) {
            return new IntentResult(IntentType.GENERAL_SEARCH, NO_MATCH_CONFIDENCE, List.of(), queryType, ExpectedResultType.MIXED);
        }
        // List.sort is stable, so catalog order breaks ties.
        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());
        Candidate top = candidates.get(0);
        List<ScoredIntent> secondary = candidates.stream()
                .skip(1)
                .limit(MAX_SECONDARY)
                .map(c -> new ScoredIntent(c.definition().intent(), c.score()))
                .toList();
        if (log.isDebugEnabled()) {
            log.debug("Intent {} ({}) with {} runner-ups, shape {}", top.definition().intent(),
                    String.format("%.2f", top.score()), secondary.size(), queryType);
        }
        return new IntentResult(top.definition().intent(), top.score(), secondary, queryType,
                top.definition().expectedResult());
    }

    static double score(IntentDefinition definition, String normalized, Set<String> tokenSet) {
        double score = 0.0;
        for (IntentPattern pattern : definition.patterns()) {
            if (pattern.matches(normalized, tokenSet)) {
                score += definition.baseConfidence();
            }
        }
        if (containsKeyword(tokenSet, definition.keywords())) {
            score += KEYWORD_BONUS;
        }
        return Math.min(score, 1.0);
    }

    private static boolean containsKeyword(Set<String> tokenSet, List<String> keywords) {
        for (String keyword : keywords) {
            boolean all = true;
            for (String part : WHITESPACE.split(keyword.trim())) {
                if (!tokenSet.contains(part)) {
                    all = false;
                    break;
                }
            }
            if (all) {
                return true;
            }
        }
        return false;
    }

    public static QueryType detectQueryType(String query) {
        String normalized = TextNormalizer.normalizeQuery(query);
        if (normalized.isEmpty()) {
            return QueryType.KEYWORD;
        }
        if (QUESTION_START.matcher(normalized).find()) {
            return QueryType.QUESTION;
        }
        if (COMMAND_START.matcher(normalized).find()) {
            return QueryType.COMMAND;
        }
        String[] words = WHITESPACE.split(query.trim());
        if (words.length <= 4) {
            boolean allCapitalized = true;
            for (String word : words) {
                if (word.isEmpty() || !Character.isUpperCase(word.charAt(0))) {
                    allCapitalized = false;
                    break;
                }
            }
            if (allCapitalized) {
                return QueryType.NAME;
            }
        }
        return words.length <= 2 ? QueryType.KEYWORD : QueryType.PHRASE;
    }

    /**
     * The primary intent when it clears {@link #TRUST_THRESHOLD}, otherwise {@code fallback}.
     */
    public static IntentType effectiveIntent(IntentResult result, IntentType fallback) {
        if (result == null) {
            return fallback;
        }
        return result.confidence() >= TRUST_THRESHOLD ? result.primary() : fallback;
    }

    private record Candidate(IntentDefinition definition, double score) {
    }
}
