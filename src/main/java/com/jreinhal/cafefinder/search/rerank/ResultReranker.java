package com.jreinhal.cafefinder.search.rerank;

import com.jreinhal.cafefinder.search.SearchQuery;
import com.jreinhal.cafefinder.search.entity.Entity;
import com.jreinhal.cafefinder.search.entity.EntityType;
import com.jreinhal.cafefinder.search.intent.IntentType;
import com.jreinhal.cafefinder.search.result.SearchResult;
import com.jreinhal.cafefinder.search.result.SearchResultType;
import com.jreinhal.cafefinder.search.result.SearchResults;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Applies intent and entity boosts, then re-sorts each category by score.
 *
 * Pure: the input is never modified. Boosted scores are clamped to 1.0.
 */
@Component
public class ResultReranker {
    static final double STRONG_INTENT_BOOST = 1.3;
    static final double INTENT_BOOST = 1.2;
    static final double ENTITY_BOOST = 1.5;

    public SearchResults rerank(SearchResults results, SearchQuery query) {
        Optional<IntentBoost> intentBoost = intentBoost(query.intent().primary());
        List<Entity> people = query.entities().stream().filter(e -> e.type() == EntityType.PERSON).toList();
        List<Entity> tools = query.entities().stream().filter(e -> e.type() == EntityType.TOOL).toList();

        return results.map((type, list) -> {
            List<SearchResult> boosted = new ArrayList<>(list.size());
            for (SearchResult result : list) {
                double score = result.score();
                if (intentBoost.isPresent() && intentBoost.get().type() == type) {
                    score *= intentBoost.get().factor();
                }
                if (type == SearchResultType.PERSON) {
                    score *= entityBoost(result, people);
                }
                else if (type == SearchResultType.TOOL) {
                    score *= entityBoost(result, tools);
                }
                boosted.add(score == result.score() ? result : result.withScore(Math.min(1.0, score)));
            }
            boosted.sort(Comparator.comparingDouble(SearchResult::score).reversed());
            return boosted;
        });
    }

    /**
     * The category an intent favours, if any.
     */
    static Optional<IntentBoost> intentBoost(IntentType intent) {
        return switch (intent) {
            case FIND_PERSON, CONTACT_EXPERT -> Optional.of(new IntentBoost(SearchResultType.PERSON, STRONG_INTENT_BOOST));
            case FIND_TOOL, TOOL_ACCESS -> Optional.of(new IntentBoost(SearchResultType.TOOL, STRONG_INTENT_BOOST));
            case FIND_FAQ, EXPLAIN_CONCEPT, LEARN_PROCESS -> Optional.of(new IntentBoost(SearchResultType.FAQ, STRONG_INTENT_BOOST));
            case FIND_RESOURCE, BROWSE -> Optional.of(new IntentBoost(SearchResultType.RESOURCE, INTENT_BOOST));
            case START_DISCUSSION -> Optional.of(new IntentBoost(SearchResultType.DISCUSSION, INTENT_BOOST));
            case COMPARE, FIND_TEAM, NAVIGATE, LOP_NEXT, LOP_FIND, LOP_SPEAKER, RECENT, POPULAR, GENERAL_SEARCH -> Optional.empty();
        };
    }

    private static double entityBoost(SearchResult result, List<Entity> entities) {
        String label = result.label() == null ? "" : result.label().toLowerCase(Locale.ROOT);
        double factor = 1.0;
        for (Entity entity : entities) {
            String value = entity.normalizedValue().toLowerCase(Locale.ROOT);
            if (!value.isEmpty() && label.contains(value)) {
                factor *= ENTITY_BOOST;
            }
        }
        return factor;
    }

    record IntentBoost(SearchResultType type, double factor) {
    }
}
