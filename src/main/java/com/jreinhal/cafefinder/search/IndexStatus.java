package com.jreinhal.cafefinder.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param indexSizes indexed record count keyed by result category ({@code people}, {@code tools}, ...)
 */
public record IndexStatus(boolean initialized, Map<String, Integer> indexSizes) {

    public IndexStatus {
        indexSizes = indexSizes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(indexSizes));
    }
}
