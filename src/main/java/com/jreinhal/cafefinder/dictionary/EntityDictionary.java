package com.jreinhal.cafefinder.dictionary;

import com.jreinhal.cafefinder.search.entity.EntityType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Surface form to canonical value tables used by entity extraction.
 */
@Component
public class EntityDictionary {
    /** Single-token lookup order; the first table containing a token wins. */
    public static final List<EntityType> TOKEN_LOOKUP_ORDER = List.of(
            EntityType.TOOL, EntityType.TOPIC, EntityType.TEAM,
            EntityType.RESOURCE_TYPE, EntityType.ACTION, EntityType.PILLAR);

    private final Map<EntityType, Map<String, String>> aliases = new EnumMap<>(EntityType.class);
    private final List<MultiWordAlias> multiWordAliases;

    public EntityDictionary() {
        this.aliases.put(EntityType.TOOL, flatten(DomainVocabulary.TOOLS));
        this.aliases.put(EntityType.TOPIC, flatten(DomainVocabulary.TOPICS));
        this.aliases.put(EntityType.TEAM, flatten(DomainVocabulary.TEAMS));
        this.aliases.put(EntityType.RESOURCE_TYPE, DomainVocabulary.RESOURCE_TYPE_KEYWORDS);
        this.aliases.put(EntityType.ACTION, DomainVocabulary.ACTION_KEYWORDS);
        this.aliases.put(EntityType.PILLAR, DomainVocabulary.PILLAR_KEYWORDS);

        List<MultiWordAlias> multi = new ArrayList<>();
        collectMultiWord(multi, EntityType.TOOL, DomainVocabulary.TOOLS, 0.95);
        collectMultiWord(multi, EntityType.TOPIC, DomainVocabulary.TOPICS, 0.90);
        DomainVocabulary.PILLAR_KEYWORDS.forEach((phrase, pillar) -> {
            if (phrase.contains(" ")) {
                multi.add(new MultiWordAlias(EntityType.PILLAR, phrase, pillar, 0.90));
            }
        });
        this.multiWordAliases = Collections.unmodifiableList(multi);
    }

    /**
     * Resolves a normalized token against the tables in {@link #TOKEN_LOOKUP_ORDER}.
     */
    public Optional<TokenMatch> lookupToken(String normalizedToken) {
        if (normalizedToken == null || normalizedToken.isEmpty()) {
            return Optional.empty();
        }
        for (EntityType type : TOKEN_LOOKUP_ORDER) {
            String canonical = this.aliases.get(type).get(normalizedToken);
            if (canonical != null) {
                return Optional.of(new TokenMatch(type, canonical, tokenConfidence(type)));
            }
        }
        return Optional.empty();
    }

    public Optional<String> canonical(EntityType type, String surface) {
        Map<String, String> table = this.aliases.get(type);
        if (table == null || surface == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get(surface.toLowerCase(Locale.ROOT).trim()));
    }

    public List<MultiWordAlias> multiWordAliases() {
        return this.multiWordAliases;
    }

    static double tokenConfidence(EntityType type) {
        return switch (type) {
            case TOOL -> 0.95;
            case TOPIC, RESOURCE_TYPE, PILLAR -> 0.90;
            case TEAM, ACTION -> 0.85;
            default -> 0.70;
        };
    }

    private static Map<String, String> flatten(Map<String, List<String>> table) {
        Map<String, String> flat = new LinkedHashMap<>();
        table.forEach((canonical, list) -> {
            flat.put(canonical, canonical);
            list.forEach(alias -> flat.put(alias.toLowerCase(Locale.ROOT), canonical));
        });
        return Collections.unmodifiableMap(flat);
    }

    private static void collectMultiWord(List<MultiWordAlias> out, EntityType type,
                                         Map<String, List<String>> table, double confidence) {
        table.forEach((canonical, list) -> {
            List<String> forms = new ArrayList<>(list.size() + 1);
            forms.add(canonical);
            forms.addAll(list);
            for (String form : forms) {
                String lower = form.toLowerCase(Locale.ROOT);
                if (lower.contains(" ")) {
                    out.add(new MultiWordAlias(type, lower, canonical, confidence));
                }
            }
        });
    }

    public record TokenMatch(EntityType type, String canonical, double confidence) {
    }

    public record MultiWordAlias(EntityType type, String phrase, String canonical, double confidence) {
    }
}
