package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A typed, scored hit. Scores are in {@code [0, 1]} with 1 a perfect match; implementations are
 * immutable and {@link #withScore} returns a copy.
 */
public interface SearchResult {

    String id();

    @JsonProperty("type")
    SearchResultType type();

    double score();

    List<String> matchedTerms();

    SearchResult withScore(double score);

    /** Display name used for boosts, answers and citations. */
    String label();
}
