package com.jreinhal.cafefinder.search.index;

import java.util.List;

/**
 * @param distance 0 is a perfect match, 1 no match
 * @param refIndex position of {@code item} in the indexed collection
 * @param matchedValues field values that matched at least one term
 */
public record FuzzyHit<T>(T item, int refIndex, double distance, List<String> matchedValues) {

    public FuzzyHit {
        matchedValues = matchedValues == null ? List.of() : List.copyOf(matchedValues);
    }

    public double score() {
        return 1.0 - this.distance;
    }
}
