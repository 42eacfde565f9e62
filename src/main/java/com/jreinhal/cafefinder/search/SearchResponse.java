package com.jreinhal.cafefinder.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jreinhal.cafefinder.search.answer.SynthesizedAnswer;
import com.jreinhal.cafefinder.search.result.SearchResults;
import java.util.List;

public record SearchResponse(
        SearchQuery query,
        @JsonInclude(JsonInclude.Include.NON_NULL) SynthesizedAnswer answer,
        SearchResults results,
        int totalCount,
        SearchMetrics metrics,
        List<String> suggestions) {

    public SearchResponse {
        results = results == null ? SearchResults.empty() : results;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
