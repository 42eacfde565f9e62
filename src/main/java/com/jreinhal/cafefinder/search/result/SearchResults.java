package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Immutable per-category result lists. Every category is always present, possibly empty, and
 * serializes as {@code {people: [...], tools: [...], ...}}.
 */
public final class SearchResults {
    private static final SearchResults EMPTY = new SearchResults(new EnumMap<>(SearchResultType.class));

    private final Map<SearchResultType, List<SearchResult>> byType;

    private SearchResults(Map<SearchResultType, List<SearchResult>> source) {
        EnumMap<SearchResultType, List<SearchResult>> copy = new EnumMap<>(SearchResultType.class);
        for (SearchResultType type : SearchResultType.values()) {
            List<SearchResult> list = source.get(type);
            if (list != null) {
                for (SearchResult result : list) {
                    if (result.type() != type) {
                        throw new IllegalArgumentException("Result " + result.id() + " of type " + result.type()
                                + " filed under " + type);
                    }
                }
            }
            copy.put(type, list == null ? List.of() : List.copyOf(list));
        }
        this.byType = Collections.unmodifiableMap(copy);
    }

    public static SearchResults empty() {
        return EMPTY;
    }

    public static SearchResults of(Map<SearchResultType, ? extends List<? extends SearchResult>> results) {
        Map<SearchResultType, List<SearchResult>> widened = new EnumMap<>(SearchResultType.class);
        results.forEach((type, list) -> widened.put(type, new ArrayList<>(list)));
        return new SearchResults(widened);
    }

    public List<SearchResult> get(SearchResultType type) {
        return this.byType.get(type);
    }

    /**
     * The list for {@code type} narrowed to its concrete result class.
     */
    public <T extends SearchResult> List<T> get(SearchResultType type, Class<T> resultClass) {
        return this.byType.get(type).stream().map(resultClass::cast).toList();
    }

    public SearchResults with(SearchResultType type, List<? extends SearchResult> results) {
        Map<SearchResultType, List<SearchResult>> next = new EnumMap<>(this.byType);
        next.put(type, new ArrayList<>(results));
        return new SearchResults(next);
    }

    /**
     * Applies {@code fn} to every category list and collects the results into a new instance.
     */
    public SearchResults map(BiFunction<SearchResultType, List<SearchResult>, List<? extends SearchResult>> fn) {
        Map<SearchResultType, List<SearchResult>> next = new EnumMap<>(SearchResultType.class);
        this.byType.forEach((type, list) -> next.put(type, new ArrayList<>(fn.apply(type, list))));
        return new SearchResults(next);
    }

    public int totalCount() {
        return this.byType.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return this.totalCount() == 0;
    }

    /**
     * All results by descending score; category order then list order break ties.
     */
    public List<SearchResult> flattened() {
        List<SearchResult> all = new ArrayList<>();
        this.byType.values().forEach(all::addAll);
        all.sort(Comparator.comparingDouble(SearchResult::score).reversed());
        return all;
    }

    public Optional<SearchResult> topResult() {
        List<SearchResult> all = this.flattened();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    @JsonValue
    public Map<String, List<SearchResult>> asMap() {
        Map<String, List<SearchResult>> out = new LinkedHashMap<>();
        this.byType.forEach((type, list) -> out.put(type.categoryKey(), list));
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SearchResults{");
        this.byType.forEach((type, list) -> sb.append(type.categoryKey()).append('=').append(list.size()).append(' '));
        return sb.append("total=").append(this.totalCount()).append('}').toString();
    }
}
