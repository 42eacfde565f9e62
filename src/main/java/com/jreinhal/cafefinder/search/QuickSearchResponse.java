package com.jreinhal.cafefinder.search;

import com.jreinhal.cafefinder.search.result.FaqResult;
import com.jreinhal.cafefinder.search.result.PersonResult;
import com.jreinhal.cafefinder.search.result.ResourceResult;
import java.util.List;

/**
 * Autocomplete payload: raw fuzzy hits for three categories, not reranked.
 */
public record QuickSearchResponse(List<PersonResult> people, List<FaqResult> faqs, List<ResourceResult> resources) {

    public QuickSearchResponse {
        people = people == null ? List.of() : List.copyOf(people);
        faqs = faqs == null ? List.of() : List.copyOf(faqs);
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public static QuickSearchResponse empty() {
        return new QuickSearchResponse(List.of(), List.of(), List.of());
    }
}
