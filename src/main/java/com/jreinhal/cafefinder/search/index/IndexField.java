package com.jreinhal.cafefinder.search.index;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A searchable field: a name, a relative weight and an extractor yielding zero or more string values.
 */
public record IndexField<T>(String name, double weight, Function<T, List<String>> extractor) {

    public IndexField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(extractor, "extractor");
        if (!(weight > 0)) {
            throw new IllegalArgumentException("Field weight must be positive: " + name);
        }
    }

    public static <T> IndexField<T> text(String name, double weight, Function<T, String> extractor) {
        return new IndexField<>(name, weight, item -> {
            String value = extractor.apply(item);
            return value == null ? List.of() : List.of(value);
        });
    }

    public static <T> IndexField<T> list(String name, double weight, Function<T, List<String>> extractor) {
        return new IndexField<>(name, weight, item -> {
            List<String> values = extractor.apply(item);
            return values == null ? List.of() : values;
        });
    }
}
