package com.jreinhal.cafefinder.search.index;

import com.jreinhal.cafefinder.search.query.TextNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Weighted approximate-substring index over an immutable list of records.
 *
 * <p>For each term and field value the distance is the best {@code errors / termLength + offset / 100}
 * over all approximate occurrences of the term in the value, where {@code offset} is where the
 * occurrence starts. A field matches when its best distance is within the threshold. The record
 * distance is the product over matched fields of {@code max(d, eps) ^ (w * norm)}, with {@code w} the
 * field weight over the total weight and {@code norm = 1 / sqrt(words in the matched value)}.
 * Records without a matched field are not returned.</p>
 */
public final class FuzzyIndex<T> {
    static final int MAX_TERM_LENGTH = 32;
    static final double LOCATION_DISTANCE = 100.0;
    private static final double EPSILON = Math.ulp(1.0);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<T> items;
    private final IndexOptions<T> options;
    private final double totalWeight;
    // entries[record][field] -> normalized values
    private final List<List<List<Entry>>> entries;

    public FuzzyIndex(List<T> items, IndexOptions<T> options) {
        this.items = List.copyOf(items);
        this.options = options;
        this.totalWeight = options.totalWeight();
        List<List<List<Entry>>> built = new ArrayList<>(this.items.size());
        for (T item : this.items) {
            List<List<Entry>> perField = new ArrayList<>(options.fields().size());
            for (IndexField<T> field : options.fields()) {
                List<Entry> values = new ArrayList<>();
                for (String raw : field.extractor().apply(item)) {
                    if (raw != null && !raw.isBlank()) {
                        values.add(new Entry(raw, TextNormalizer.normalizeQuery(raw)));
                    }
                }
                perField.add(values);
            }
            built.add(perField);
        }
        this.entries = built;
    }

    public int size() {
        return this.items.size();
    }

    public List<T> items() {
        return this.items;
    }

    public IndexOptions<T> options() {
        return this.options;
    }

    /**
     * Best hits first; ties keep collection order.
     */
    public List<FuzzyHit<T>> search(List<String> terms, int limit) {
        List<String> prepared = this.prepare(terms);
        if (prepared.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<FuzzyHit<T>> hits = new ArrayList<>();
        for (int i = 0; i < this.items.size(); i++) {
            FuzzyHit<T> hit = this.score(i, prepared);
            if (hit != null) {
                hits.add(hit);
            }
        }
        hits.sort(Comparator.comparingDouble((FuzzyHit<T> h) -> h.distance()).thenComparingInt(FuzzyHit::refIndex));
        return hits.size() > limit ? Collections.unmodifiableList(hits.subList(0, limit)) : Collections.unmodifiableList(hits);
    }

    private List<String> prepare(List<String> terms) {
        Set<String> out = new LinkedHashSet<>();
        if (terms == null) {
            return List.of();
        }
        for (String term : terms) {
            String normalized = TextNormalizer.normalizeQuery(term);
            if (normalized.length() < this.options.minMatchCharLength()) {
                continue;
            }
            out.add(normalized.length() > MAX_TERM_LENGTH ? normalized.substring(0, MAX_TERM_LENGTH) : normalized);
        }
        return List.copyOf(out);
    }

    private FuzzyHit<T> score(int index, List<String> terms) {
        List<List<Entry>> fields = this.entries.get(index);
        double total = 1.0;
        boolean matched = false;
        Set<String> matchedValues = new LinkedHashSet<>();
        for (int f = 0; f < fields.size(); f++) {
            double best = Double.MAX_VALUE;
            Entry bestEntry = null;
            for (Entry entry : fields.get(f)) {
                boolean entryMatched = false;
                for (String term : terms) {
                    double d = termDistance(term, entry.normalized(), this.options.threshold());
                    if (d <= this.options.threshold()) {
                        entryMatched = true;
                        if (d < best) {
                            best = d;
                            bestEntry = entry;
                        }
                    }
                }
                if (entryMatched) {
                    matchedValues.add(entry.raw());
                }
            }
            if (bestEntry == null) {
                continue;
            }
            matched = true;
            double weight = this.options.fields().get(f).weight() / this.totalWeight;
            double norm = 1.0 / Math.sqrt(WHITESPACE.split(bestEntry.normalized()).length);
            total *= Math.pow(Math.max(best, EPSILON), weight * norm);
        }
        if (!matched) {
            return null;
        }
        return new FuzzyHit<>(this.items.get(index), index, total, List.copyOf(matchedValues));
    }

    /**
     * Lowest {@code errors / |term| + start / 100} over approximate occurrences of {@code term} in
     * {@code text} that stay within {@code threshold}; {@code Double.MAX_VALUE} when there is none.
     */
    static double termDistance(String term, String text, double threshold) {
        int m = term.length();
        int n = text.length();
        if (m == 0 || n == 0) {
            return Double.MAX_VALUE;
        }
        int exact = text.indexOf(term);
        double best = exact >= 0 ? exact / LOCATION_DISTANCE : Double.MAX_VALUE;
        if (best == 0.0) {
            return 0.0;
        }
        // Sellers' algorithm: column j holds edit distances of term prefixes to substrings ending at j.
        int[] col = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            col[i] = i;
        }
        for (int j = 1; j <= n; j++) {
            int start = Math.max(0, j - m);
            double proximity = start / LOCATION_DISTANCE;
            if (proximity > threshold || proximity >= best) {
                break;
            }
            int diag = col[0];
            col[0] = 0;
            char c = text.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                int above = col[i];
                int cost = term.charAt(i - 1) == c ? 0 : 1;
                col[i] = Math.min(Math.min(above + 1, col[i - 1] + 1), diag + cost);
                diag = above;
            }
            double candidate = col[m] / (double) m + proximity;
            if (candidate <= threshold && candidate < best) {
                best = candidate;
            }
        }
        return best;
    }

    private record Entry(String raw, String normalized) {
    }
}
