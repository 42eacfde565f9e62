package com.jreinhal.cafefinder.dictionary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bidirectional synonym lookup over the domain vocabulary.
 *
 * Canonical keys from all tables share one namespace. When two tables declare the same key
 * the later table's aliases win; when an alias belongs to several canonicals the last
 * registration wins.
 */
@Component
public class SynonymDictionary {
    private static final Logger log = LoggerFactory.getLogger(SynonymDictionary.class);

    private final boolean enabled;
    private final Map<String, List<String>> byCanonical;
    private final Map<String, String> canonicalByAlias;

    @Autowired
    public SynonymDictionary(SynonymProperties props) {
        this(props.isEnabled(), props.getEntries());
    }

    public SynonymDictionary(boolean enabled, Map<String, List<String>> extraEntries) {
        this.enabled = enabled;
        Map<String, List<String>> merged = new LinkedHashMap<>();
        merged.putAll(DomainVocabulary.TOOLS);
        merged.putAll(DomainVocabulary.TOPICS);
        merged.putAll(DomainVocabulary.ACTIONS);
        merged.putAll(DomainVocabulary.RESOURCE_TYPES);
        merged.putAll(DomainVocabulary.TEAMS);
        int extra = 0;
        if (extraEntries != null) {
            for (Map.Entry<String, List<String>> entry : extraEntries.entrySet()) {
                String canonical = lower(entry.getKey());
                if (canonical.isEmpty() || entry.getValue() == null) {
                    continue;
                }
                LinkedHashSet<String> aliases = new LinkedHashSet<>(merged.getOrDefault(canonical, List.of()));
                for (String alias : entry.getValue()) {
                    String normalized = lower(alias);
                    if (!normalized.isEmpty() && !normalized.equals(canonical)) {
                        aliases.add(normalized);
                        extra++;
                    }
                }
                merged.put(canonical, List.copyOf(aliases));
            }
        }
        Map<String, String> reverse = new LinkedHashMap<>();
        merged.forEach((canonical, aliases) -> aliases.forEach(alias -> reverse.put(lower(alias), canonical)));
        this.byCanonical = Collections.unmodifiableMap(merged);
        this.canonicalByAlias = Collections.unmodifiableMap(reverse);
        if (extra > 0) {
            log.info("Synonym dictionary loaded with {} configured aliases ({} canonical terms)", extra, merged.size());
        }
    }

    public static SynonymDictionary defaults() {
        return new SynonymDictionary(true, Map.of());
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    /**
     * Canonical form of {@code term}; the lowercased term itself when it is not a known alias.
     * Alias lookup takes precedence, so a term that is both a key and an alias maps to the alias owner.
     */
    public String canonicalOf(String term) {
        String normalized = lower(term);
        return this.canonicalByAlias.getOrDefault(normalized, normalized);
    }

    /**
     * The canonical term followed by all of its aliases, or just the lowercased term when unknown.
     */
    public List<String> synonymsOf(String term) {
        String normalized = lower(term);
        List<String> direct = this.byCanonical.get(normalized);
        if (direct != null) {
            return prepend(normalized, direct);
        }
        String canonical = this.canonicalByAlias.get(normalized);
        if (canonical != null) {
            return prepend(canonical, this.byCanonical.getOrDefault(canonical, List.of()));
        }
        return List.of(normalized);
    }

    public boolean areSynonyms(String first, String second) {
        return this.canonicalOf(first).equals(this.canonicalOf(second));
    }

    public boolean isKnown(String term) {
        String normalized = lower(term);
        return this.byCanonical.containsKey(normalized) || this.canonicalByAlias.containsKey(normalized);
    }

    public Set<String> canonicalTerms() {
        return this.byCanonical.keySet();
    }

    private static List<String> prepend(String head, List<String> tail) {
        List<String> out = new ArrayList<>(tail.size() + 1);
        out.add(head);
        out.addAll(tail);
        return Collections.unmodifiableList(out);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }
}
