package com.jreinhal.cafefinder.search.query;

import com.jreinhal.cafefinder.search.SearchContext;
import java.util.List;

/**
 * Output of {@link QueryProcessor}: the query before entity extraction and intent classification.
 */
public record ProcessedQuery(
        String raw,
        String normalized,
        List<String> tokens,
        List<String> expandedTokens,
        SearchContext context) {

    public ProcessedQuery {
        raw = raw == null ? "" : raw;
        normalized = normalized == null ? "" : normalized;
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        expandedTokens = expandedTokens == null ? List.of() : List.copyOf(expandedTokens);
    }

    public static ProcessedQuery empty(SearchContext context) {
        return new ProcessedQuery("", "", List.of(), List.of(), context);
    }

    public boolean isEmpty() {
        return this.tokens.isEmpty() && this.normalized.isEmpty();
    }
}
