package com.jreinhal.cafefinder.search;

import java.util.List;

/**
 * Where the user was when searching. Carried through the pipeline; not yet used for scoring.
 */
public record SearchContext(String currentPage, String currentResourceId, List<String> currentTopics) {

    public SearchContext {
        currentTopics = currentTopics == null ? List.of() : List.copyOf(currentTopics);
    }

    public static SearchContext page(String currentPage) {
        return new SearchContext(currentPage, null, List.of());
    }
}
