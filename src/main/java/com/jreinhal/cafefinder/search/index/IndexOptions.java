package com.jreinhal.cafefinder.search.index;

import java.util.List;

/**
 * @param threshold highest per-field distance that still counts as a match, in {@code [0, 1]}
 * @param minMatchCharLength terms shorter than this are ignored
 */
public record IndexOptions<T>(List<IndexField<T>> fields, double threshold, int minMatchCharLength) {

    public static final int DEFAULT_MIN_MATCH_CHAR_LENGTH = 2;

    public IndexOptions {
        fields = List.copyOf(fields);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("An index needs at least one field");
        }
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("Threshold must be in [0, 1]: " + threshold);
        }
    }

    public IndexOptions(List<IndexField<T>> fields, double threshold) {
        this(fields, threshold, DEFAULT_MIN_MATCH_CHAR_LENGTH);
    }

    public double totalWeight() {
        return this.fields.stream().mapToDouble(IndexField::weight).sum();
    }
}
