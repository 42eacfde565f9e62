package com.jreinhal.cafefinder.search.entity;

import com.jreinhal.cafefinder.dictionary.EntityDictionary;
import com.jreinhal.cafefinder.search.query.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Dictionary and rule based entity recognition.
 *
 * Passes run in priority order (multi-word aliases, single tokens, time expressions, capitalized
 * names) and a span claimed by an earlier pass is never claimed again, so the result contains no
 * overlapping entities.
 */
@Component
public class EntityExtractor {
    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    private static final Pattern CAPITALIZED_RUN = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(\\p{Lu}\\p{Ll}+(?:\\s+\\p{Lu}\\p{Ll}+){0,2})(?![\\p{L}\\p{N}])");
    private static final Pattern WORD = Pattern.compile("\\p{Lu}\\p{Ll}+");
    private static final Set<String> NAME_STOPLIST = Set.of(
            "how", "what", "when", "where", "why", "which", "who", "whom", "whose",
            "the", "this", "that", "these", "those", "is", "are", "can", "could", "should", "would", "do", "does",
            "find", "show", "get", "open", "go", "list", "browse", "search", "tell", "give", "help",
            "contact", "message", "email", "ask", "explain", "define", "compare", "request", "launch",
            "start", "create", "submit", "post", "please", "my", "me", "we", "our", "next", "upcoming");
    static final double PERSON_CONFIDENCE = 0.70;

    private final EntityDictionary dictionary;
    private final TemporalEntityRecognizer temporal;

    public EntityExtractor(EntityDictionary dictionary, TemporalEntityRecognizer temporal) {
        this.dictionary = dictionary;
        this.temporal = temporal;
    }

    public List<Entity> extract(String query, List<String> tokens) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String lower = TextNormalizer.foldPreservingOffsets(query);
        List<Entity> entities = new ArrayList<>();

        for (EntityDictionary.MultiWordAlias alias : this.dictionary.multiWordAliases()) {
            int index = indexOfWord(lower, alias.phrase(), 0);
            if (index < 0) {
                continue;
            }
            Entity.Position span = new Entity.Position(index, index + alias.phrase().length());
            claim(entities, new Entity(alias.type(), query.substring(span.start(), span.end()),
                    alias.canonical(), alias.confidence(), span));
        }

        int cursor = 0;
        for (String token : tokens == null ? List.<String>of() : tokens) {
            String needle = token.toLowerCase(Locale.ROOT);
            if (needle.isEmpty()) {
                continue;
            }
            int index = indexOfWord(lower, needle, cursor);
            if (index < 0) {
                index = indexOfWord(lower, needle, 0);
            }
            if (index < 0) {
                continue;
            }
            Entity.Position span = new Entity.Position(index, index + needle.length());
            cursor = span.end();
            Optional<EntityDictionary.TokenMatch> match = this.dictionary.lookupToken(TextNormalizer.normalizeToken(needle));
            if (match.isPresent()) {
                EntityDictionary.TokenMatch hit = match.get();
                claim(entities, new Entity(hit.type(), query.substring(span.start(), span.end()),
                        hit.canonical(), hit.confidence(), span));
            }
        }

        for (TemporalEntityRecognizer.TemporalMatch match : this.temporal.recognize(lower)) {
            Entity entity = match.entity();
            if (!claim(entities, entity) && !match.qualifier().equals(entity.position())) {
                Entity.Position q = match.qualifier();
                claim(entities, new Entity(entity.type(), query.substring(q.start(), q.end()),
                        entity.normalizedValue(), entity.confidence(), q));
            }
        }

        Matcher names = CAPITALIZED_RUN.matcher(query);
        while (names.find()) {
            personName(query, names.start(1), names.end(1)).ifPresent(person -> claim(entities, person));
        }

        entities.sort(Comparator.comparingInt(e -> e.position().start()));
        if (log.isDebugEnabled()) {
            log.debug("Extracted {} entities from {} tokens", entities.size(), tokens == null ? 0 : tokens.size());
        }
        return List.copyOf(entities);
    }

    /**
     * Strips leading stop-list words from a capitalized run; what remains is the candidate name.
     */
    private static Optional<Entity> personName(String query, int start, int end) {
        Matcher words = WORD.matcher(query).region(start, end);
        int nameStart = -1;
        while (words.find()) {
            if (!NAME_STOPLIST.contains(words.group().toLowerCase(Locale.ROOT))) {
                nameStart = words.start();
                break;
            }
        }
        if (nameStart < 0) {
            return Optional.empty();
        }
        String name = query.substring(nameStart, end);
        return Optional.of(new Entity(EntityType.PERSON, name, TextNormalizer.normalizeQuery(name),
                PERSON_CONFIDENCE, new Entity.Position(nameStart, end)));
    }

    private static boolean claim(List<Entity> entities, Entity candidate) {
        for (Entity existing : entities) {
            if (existing.overlaps(candidate)) {
                return false;
            }
        }
        entities.add(candidate);
        return true;
    }

    static int indexOfWord(String haystack, String needle, int from) {
        int index = haystack.indexOf(needle, Math.max(0, from));
        while (index >= 0) {
            int end = index + needle.length();
            boolean startOk = index == 0 || !Character.isLetterOrDigit(haystack.charAt(index - 1));
            boolean endOk = end >= haystack.length() || !Character.isLetterOrDigit(haystack.charAt(end));
            if (startOk && endOk) {
                return index;
            }
            index = haystack.indexOf(needle, index + 1);
        }
        return -1;
    }

    public static List<Entity> ofType(List<Entity> entities, EntityType type) {
        return entities.stream().filter(e -> e.type() == type).toList();
    }

    public static boolean hasType(List<Entity> entities, EntityType type) {
        return entities.stream().anyMatch(e -> e.type() == type);
    }

    /**
     * Highest-confidence entity of {@code type}; the earliest one wins ties.
     */
    public static Optional<Entity> best(List<Entity> entities, EntityType type) {
        Entity best = null;
        for (Entity entity : entities) {
            if (entity.type() == type && (best == null || entity.confidence() > best.confidence())) {
                best = entity;
            }
        }
        return Optional.ofNullable(best);
    }
}
