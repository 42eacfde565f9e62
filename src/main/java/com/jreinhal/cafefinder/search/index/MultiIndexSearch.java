package com.jreinhal.cafefinder.search.index;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.cafefinder.constant.StopWords;
import com.jreinhal.cafefinder.corpus.CorpusCatalog;
import com.jreinhal.cafefinder.dictionary.SynonymDictionary;
import com.jreinhal.cafefinder.exception.IndexInitializationException;
import com.jreinhal.cafefinder.model.LopSession;
import com.jreinhal.cafefinder.model.Person;
import com.jreinhal.cafefinder.model.Resource;
import com.jreinhal.cafefinder.search.SearchProperties;
import com.jreinhal.cafefinder.search.entity.Entity;
import com.jreinhal.cafefinder.search.entity.EntityType;
import com.jreinhal.cafefinder.search.entity.TemporalEntityRecognizer;
import com.jreinhal.cafefinder.search.result.CompetitorResult;
import com.jreinhal.cafefinder.search.result.DiscussionResult;
import com.jreinhal.cafefinder.search.result.FaqResult;
import com.jreinhal.cafefinder.search.result.LopSessionResult;
import com.jreinhal.cafefinder.search.result.PersonResult;
import com.jreinhal.cafefinder.search.result.PulseSignalResult;
import com.jreinhal.cafefinder.search.result.ResourceResult;
import com.jreinhal.cafefinder.search.result.SearchResult;
import com.jreinhal.cafefinder.search.result.SearchResultType;
import com.jreinhal.cafefinder.search.result.SearchResults;
import com.jreinhal.cafefinder.search.result.ToolResult;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fuzzy search over one index per corpus category, with entity pre-filtering.
 *
 * <p>Indexes are built lazily on first use or explicitly via {@link #initialize()}. Searches run
 * under the read lock against an immutable {@link IndexSet}; {@link #rebuild()} takes the write lock,
 * so it waits for in-flight searches and swaps in a fresh generation atomically.</p>
 */
@Component
public class MultiIndexSearch {
    private static final Logger log = LoggerFactory.getLogger(MultiIndexSearch.class);

    static final double NEXT_OCCURRENCE_SCORE = 0.99;
    static final String DEFAULT_PERSON_TERM = "person";
    static final String DEFAULT_RESOURCE_TERM = "resource";
    static final String DEFAULT_SESSION_TERM = "session";
    private static final String LOP_CANONICAL = "lop";
    private static final String TOOL_INDEX_KEY = "tools";

    private final CorpusCatalog catalog;
    private final SynonymDictionary synonyms;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Cache<String, FuzzyIndex<Resource>> toolIndexCache;
    private volatile IndexSet current;

    public MultiIndexSearch(CorpusCatalog catalog, SynonymDictionary synonyms, Clock clock, SearchProperties props) {
        this.catalog = catalog;
        this.synonyms = synonyms;
        this.clock = clock;
        this.toolIndexCache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Duration.ofSeconds(Math.max(0L, props.getToolIndexCacheTtlSeconds())))
                .build();
    }

    /**
     * Builds the indexes if they are not built yet. Safe to call repeatedly and concurrently.
     *
     * @throws IndexInitializationException when the corpus cannot be loaded
     */
    public void initialize() {
        if (this.current != null) {
            return;
        }
        this.lock.writeLock().lock();
        try {
            if (this.current == null) {
                this.current = this.buildIndexes();
            }
        }
        finally {
            this.lock.writeLock().unlock();
        }
    }

    public boolean isInitialized() {
        return this.current != null;
    }

    /**
     * Reloads the corpus and replaces every index. The previous generation stays in place if loading fails.
     */
    public void rebuild() {
        this.lock.writeLock().lock();
        try {
            this.current = this.buildIndexes();
            this.toolIndexCache.invalidateAll();
        }
        finally {
            this.lock.writeLock().unlock();
        }
    }

    /**
     * Indexed record count per category; empty before initialization.
     */
    public Map<SearchResultType, Integer> stats() {
        IndexSet set = this.current;
        return set == null ? new EnumMap<>(SearchResultType.class) : set.sizes();
    }

    public SearchResults searchAll(List<String> terms, List<Entity> entities, int limitPerType) {
        return this.read(set -> {
            List<String> prepared = prepareTerms(terms);
            Map<SearchResultType, List<? extends SearchResult>> results = new EnumMap<>(SearchResultType.class);
            results.put(SearchResultType.PERSON, this.people(set, prepared, entities, limitPerType));
            results.put(SearchResultType.TOOL, this.tools(set, prepared, limitPerType));
            results.put(SearchResultType.FAQ, faqs(set, prepared, limitPerType));
            results.put(SearchResultType.RESOURCE, resources(set, prepared, entities, limitPerType));
            results.put(SearchResultType.DISCUSSION, discussions(set, prepared, limitPerType));
            results.put(SearchResultType.LOP_SESSION, this.lopSessions(set, prepared, entities, limitPerType));
            results.put(SearchResultType.PULSE_SIGNAL, pulseSignals(set, prepared, limitPerType));
            results.put(SearchResultType.COMPETITOR, competitors(set, prepared, limitPerType));
            SearchResults all = SearchResults.of(results);
            if (log.isDebugEnabled()) {
                log.debug("Searched {} terms with {} entities: {}", prepared.size(), entities.size(), all);
            }
            return all;
        });
    }

    public List<PersonResult> searchPeople(List<String> terms, List<Entity> entities, int limit) {
        return this.read(set -> this.people(set, prepareTerms(terms), entities, limit));
    }

    public List<ToolResult> searchTools(List<String> terms, int limit) {
        return this.read(set -> this.tools(set, prepareTerms(terms), limit));
    }

    public List<FaqResult> searchFaqs(List<String> terms, int limit) {
        return this.read(set -> faqs(set, prepareTerms(terms), limit));
    }

    public List<ResourceResult> searchResources(List<String> terms, List<Entity> entities, int limit) {
        return this.read(set -> resources(set, prepareTerms(terms), entities, limit));
    }

    public List<DiscussionResult> searchDiscussions(List<String> terms, int limit) {
        return this.read(set -> discussions(set, prepareTerms(terms), limit));
    }

    public List<LopSessionResult> searchLopSessions(List<String> terms, List<Entity> entities, int limit) {
        return this.read(set -> this.lopSessions(set, prepareTerms(terms), entities, limit));
    }

    public List<PulseSignalResult> searchPulseSignals(List<String> terms, int limit) {
        return this.read(set -> pulseSignals(set, prepareTerms(terms), limit));
    }

    public List<CompetitorResult> searchCompetitors(List<String> terms, int limit) {
        return this.read(set -> competitors(set, prepareTerms(terms), limit));
    }

    private <R> R read(Function<IndexSet, R> search) {
        this.initialize();
        this.lock.readLock().lock();
        try {
            return search.apply(this.current);
        }
        finally {
            this.lock.readLock().unlock();
        }
    }

    private IndexSet buildIndexes() {
        long start = System.nanoTime();
        try {
            IndexSet set = IndexSet.build(this.catalog.snapshot());
            log.info("Search indexes built in {} ms: {}", (System.nanoTime() - start) / 1_000_000L, set.sizes());
            return set;
        }
        catch (RuntimeException e) {
            throw new IndexInitializationException("Failed to build search indexes", e);
        }
    }

    private List<PersonResult> people(IndexSet set, List<String> terms, List<Entity> entities, int limit) {
        List<FuzzyHit<Person>> hits;
        Optional<Entity> team = first(entities, EntityType.TEAM);
        if (team.isPresent()) {
            String value = lower(team.get().normalizedValue());
            List<Person> subset = set.people.items().stream()
                    .filter(p -> p.team() != null && lower(p.team()).contains(value))
                    .toList();
            hits = subset.size() < set.people.size()
                    ? new FuzzyIndex<>(subset, IndexProfiles.PEOPLE).search(
                            orDefault(terms, () -> List.of(team.get().value(), DEFAULT_PERSON_TERM)), limit)
                    : set.people.search(terms, limit);
        }
        else {
            hits = set.people.search(terms, limit);
        }
        return hits.stream().map(h -> PersonResult.of(h.item(), h.score(), h.matchedValues())).toList();
    }

    private List<ToolResult> tools(IndexSet set, List<String> terms, int limit) {
        FuzzyIndex<Resource> index = this.toolIndexCache.get(TOOL_INDEX_KEY,
                key -> new FuzzyIndex<>(set.tools, IndexProfiles.TOOLS));
        return index.search(terms, limit).stream()
                .map(h -> ToolResult.of(h.item(), h.score(), h.matchedValues()))
                .toList();
    }

    private static List<FaqResult> faqs(IndexSet set, List<String> terms, int limit) {
        return set.faqs.search(terms, limit).stream()
                .map(h -> FaqResult.of(h.item(), h.score(), h.matchedValues()))
                .toList();
    }

    private static List<ResourceResult> resources(IndexSet set, List<String> terms, List<Entity> entities, int limit) {
        List<Resource> subset = set.resources.items();
        Optional<Entity> pillar = first(entities, EntityType.PILLAR);
        if (pillar.isPresent()) {
            String value = lower(pillar.get().normalizedValue());
            subset = subset.stream().filter(r -> lower(r.pillar()).equals(value)).toList();
        }
        Optional<Entity> type = first(entities, EntityType.RESOURCE_TYPE);
        if (type.isPresent()) {
            String value = lower(type.get().normalizedValue());
            subset = subset.stream()
                    .filter(r -> lower(r.contentType()).equals(value) || lower(r.category()).contains(value))
                    .toList();
        }
        List<FuzzyHit<Resource>> hits = subset.size() < set.resources.size()
                ? new FuzzyIndex<>(subset, IndexProfiles.RESOURCES).search(
                        orDefault(terms, () -> List.of(DEFAULT_RESOURCE_TERM)), limit)
                : set.resources.search(terms, limit);
        return hits.stream().map(h -> ResourceResult.of(h.item(), h.score(), h.matchedValues())).toList();
    }

    private static List<DiscussionResult> discussions(IndexSet set, List<String> terms, int limit) {
        return set.discussions.search(terms, limit).stream()
                .map(h -> DiscussionResult.of(h.item(), h.score(), h.matchedValues()))
                .toList();
    }

    private List<LopSessionResult> lopSessions(IndexSet set, List<String> terms, List<Entity> entities, int limit) {
        Optional<Entity> temporal = entities.stream().filter(e -> e.type().isTemporal()).findFirst();
        if (temporal.isEmpty()) {
            return toLopResults(set, set.lopSessions.search(terms, limit));
        }
        String value = temporal.get().normalizedValue();
        List<LopSession> subset = TemporalSessionFilter.apply(set.lopSessions.items(), value, LocalDate.now(this.clock));
        if (TemporalEntityRecognizer.NEXT_OCCURRENCE.equals(value) && this.freeText(terms).isEmpty()) {
            List<FuzzyHit<LopSession>> upcoming = new ArrayList<>();
            List<LopSession> byDate = subset.stream().sorted(Comparator.comparing(LopSession::date)).limit(limit).toList();
            for (int i = 0; i < byDate.size(); i++) {
                upcoming.add(new FuzzyHit<>(byDate.get(i), i, 1.0 - NEXT_OCCURRENCE_SCORE, List.of()));
            }
            return toLopResults(set, upcoming);
        }
        List<FuzzyHit<LopSession>> hits = subset.size() < set.lopSessions.size()
                ? new FuzzyIndex<>(subset, IndexProfiles.LOP_SESSIONS).search(
                        orDefault(terms, () -> List.of(DEFAULT_SESSION_TERM)), limit)
                : set.lopSessions.search(terms, limit);
        return toLopResults(set, hits);
    }

    /**
     * Terms left once time words and every form of "lop" are removed.
     */
    private List<String> freeText(List<String> terms) {
        List<String> remaining = new ArrayList<>();
        for (String term : terms) {
            if (StopWords.LOP_TEMPORAL_NOISE.contains(term) || LOP_CANONICAL.equals(this.synonyms.canonicalOf(term))) {
                continue;
            }
            if (term.length() >= IndexOptions.DEFAULT_MIN_MATCH_CHAR_LENGTH) {
                remaining.add(term);
            }
        }
        return remaining;
    }

    private static List<LopSessionResult> toLopResults(IndexSet set, List<FuzzyHit<LopSession>> hits) {
        return hits.stream().map(h -> {
            String speakerName = h.item().speakerIds().stream()
                    .map(set::person)
                    .flatMap(Optional::stream)
                    .map(Person::displayName)
                    .findFirst()
                    .orElse(LopSessionResult.UNKNOWN_SPEAKER);
            return LopSessionResult.of(h.item(), speakerName, h.score(), h.matchedValues());
        }).toList();
    }

    private static List<PulseSignalResult> pulseSignals(IndexSet set, List<String> terms, int limit) {
        return set.pulseSignals.search(terms, limit).stream()
                .map(h -> PulseSignalResult.of(h.item(), h.score(), h.matchedValues()))
                .toList();
    }

    private static List<CompetitorResult> competitors(IndexSet set, List<String> terms, int limit) {
        return set.competitors.search(terms, limit).stream()
                .map(h -> CompetitorResult.of(h.item(), h.score(), h.matchedValues()))
                .toList();
    }

    /**
     * Lowercased, deduplicated terms without stop words, unless stop words are all there is.
     */
    static List<String> prepareTerms(List<String> terms) {
        Set<String> all = new LinkedHashSet<>();
        if (terms != null) {
            for (String term : terms) {
                String t = lower(term);
                if (!t.isEmpty()) {
                    all.add(t);
                }
            }
        }
        List<String> content = all.stream().filter(t -> !StopWords.SEARCH_TERMS.contains(t)).toList();
        return content.isEmpty() ? List.copyOf(all) : content;
    }

    private static List<String> orDefault(List<String> terms, Supplier<List<String>> defaults) {
        if (!terms.isEmpty()) {
            return terms;
        }
        return defaults.get().stream().filter(t -> t != null && !t.isBlank()).limit(1).toList();
    }

    private static Optional<Entity> first(List<Entity> entities, EntityType type) {
        return entities.stream().filter(e -> e.type() == type).findFirst();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).trim();
    }
}
