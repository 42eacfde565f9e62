package com.jreinhal.cafefinder.search;

import com.jreinhal.cafefinder.search.entity.Entity;
import com.jreinhal.cafefinder.search.intent.IntentResult;
import com.jreinhal.cafefinder.search.query.ProcessedQuery;
import java.util.List;

/**
 * The fully analysed query, built once per request.
 */
public record SearchQuery(
        String raw,
        String normalized,
        List<String> tokens,
        List<String> expandedTokens,
        List<Entity> entities,
        IntentResult intent,
        SearchContext context) {

    public SearchQuery {
        raw = raw == null ? "" : raw;
        normalized = normalized == null ? "" : normalized;
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        expandedTokens = expandedTokens == null ? List.of() : List.copyOf(expandedTokens);
        entities = entities == null ? List.of() : List.copyOf(entities);
        intent = intent == null ? IntentResult.none() : intent;
    }

    public static SearchQuery of(ProcessedQuery processed, List<Entity> entities, IntentResult intent) {
        return new SearchQuery(processed.raw(), processed.normalized(), processed.tokens(),
                processed.expandedTokens(), entities, intent, processed.context());
    }

    public static SearchQuery empty(String raw, SearchContext context) {
        return new SearchQuery(raw, "", List.of(), List.of(), List.of(), IntentResult.none(), context);
    }

    /**
     * Terms handed to the indexes: the expanded tokens, or the normalized query when expansion produced none.
     */
    public List<String> searchTerms() {
        if (!this.expandedTokens.isEmpty()) {
            return this.expandedTokens;
        }
        return this.normalized.isEmpty() ? List.of() : List.of(this.normalized);
    }
}
