package com.jreinhal.cafefinder.search;

import com.jreinhal.cafefinder.search.answer.AnswerSynthesizer;
import com.jreinhal.cafefinder.search.answer.SynthesizedAnswer;
import com.jreinhal.cafefinder.search.entity.Entity;
import com.jreinhal.cafefinder.search.entity.EntityExtractor;
import com.jreinhal.cafefinder.search.entity.EntityType;
import com.jreinhal.cafefinder.search.index.MultiIndexSearch;
import com.jreinhal.cafefinder.search.intent.IntentClassifier;
import com.jreinhal.cafefinder.search.intent.IntentResult;
import com.jreinhal.cafefinder.search.query.ProcessedQuery;
import com.jreinhal.cafefinder.search.query.QueryProcessor;
import com.jreinhal.cafefinder.search.rerank.ResultReranker;
import com.jreinhal.cafefinder.search.result.SearchResults;
import com.jreinhal.cafefinder.util.LogSanitizer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Runs the search pipeline: process, extract entities, classify, search, rerank, synthesize.
 *
 * <p>{@link #search} never throws. Invalid input yields an empty envelope; initialization or stage
 * failures are logged once here and yield an empty envelope with generic suggestions.</p>
 */
@Service
public class SearchEngine {
    private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);

    static final List<String> FAILURE_SUGGESTIONS = List.of("Try a different search", "Browse all resources");
    static final String BROWSE_SUGGESTION = "Browse all resources";
    static final String DISCUSSION_SUGGESTION = "Start a discussion";

    private final QueryProcessor queryProcessor;
    private final EntityExtractor entityExtractor;
    private final IntentClassifier intentClassifier;
    private final MultiIndexSearch index;
    private final ResultReranker reranker;
    private final AnswerSynthesizer answerSynthesizer;
    private final SearchProperties props;
    private final Clock clock;

    public SearchEngine(QueryProcessor queryProcessor, EntityExtractor entityExtractor,
            IntentClassifier intentClassifier, MultiIndexSearch index, ResultReranker reranker,
            AnswerSynthesizer answerSynthesizer, SearchProperties props, Clock clock) {
        this.queryProcessor = queryProcessor;
        this.entityExtractor = entityExtractor;
        this.intentClassifier = intentClassifier;
        this.index = index;
        this.reranker = reranker;
        this.answerSynthesizer = answerSynthesizer;
        this.props = props;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        if (!this.props.isInitializeOnStartup()) {
            log.info("Index warm-up disabled; indexes will be built on first search");
            return;
        }
        try {
            this.index.initialize();
            log.info("Search indexes ready: {}", this.index.stats());
        }
        catch (RuntimeException e) {
            log.error("Index warm-up failed; the next search will retry", e);
        }
    }

    public SearchResponse search(String rawQuery) {
        return this.search(rawQuery, null);
    }

    public SearchResponse search(String rawQuery, SearchContext context) {
        long start = System.nanoTime();
        if (!this.index.isInitialized()) {
            try {
                this.index.initialize();
            }
            catch (RuntimeException e) {
                log.error("Search engine initialization failed", e);
                return this.emptyResponse(rawQuery, context, start, true);
            }
        }
        if (rawQuery == null || rawQuery.isBlank()) {
            return this.emptyResponse("", context, start, false);
        }
        Instant timestamp = this.clock.instant();
        try {
            long processingStart = System.nanoTime();
            ProcessedQuery processed = this.queryProcessor.process(rawQuery, context);
            if (processed.isEmpty()) {
                return this.emptyResponse(rawQuery, context, start, false);
            }
            List<Entity> entities = this.entityExtractor.extract(processed.raw(), processed.tokens());
            IntentResult intent = this.intentClassifier.classify(processed.raw(), processed.tokens());
            SearchQuery query = SearchQuery.of(processed, entities, intent);
            double queryProcessingMs = elapsedMs(processingStart);

            List<String> terms = query.searchTerms();
            if (terms.isEmpty()) {
                return this.emptyResponse(rawQuery, context, start, false);
            }
            long searchStart = System.nanoTime();
            SearchResults raw = this.index.searchAll(terms, entities, this.props.getMaxResultsPerType());
            double searchExecutionMs = elapsedMs(searchStart);

            SearchResults results = this.reranker.rerank(raw, query);

            long answerStart = System.nanoTime();
            Optional<SynthesizedAnswer> answer = this.answerSynthesizer.synthesize(query, results, this.props.isAnswerSynthesis());
            double answerSynthesisMs = elapsedMs(answerStart);

            SearchMetrics metrics = new SearchMetrics(elapsedMs(start), queryProcessingMs, searchExecutionMs,
                    answerSynthesisMs, timestamp);
            SearchResponse response = new SearchResponse(query, answer.orElse(null), results, results.totalCount(),
                    metrics, suggestionsFor(query.entities(), results));
            if (log.isDebugEnabled()) {
                log.debug("Search {} -> {} results in {} ms ({}, answer {})", LogSanitizer.querySummary(rawQuery),
                        response.totalCount(), String.format("%.1f", metrics.totalTimeMs()), intent.primary(),
                        answer.map(a -> a.type().name()).orElse("none"));
            }
            return response;
        }
        catch (RuntimeException e) {
            log.error("Search failed for {}", LogSanitizer.querySummary(rawQuery), e);
            return this.emptyResponse(rawQuery, context, start, true);
        }
    }

    /**
     * Fuzzy hits for people, FAQs and resources only; no entity filtering, reranking or answer.
     */
    public QuickSearchResponse quickSearch(String rawQuery, int limit) {
        ProcessedQuery processed = this.queryProcessor.process(rawQuery);
        List<String> terms = SearchQuery.of(processed, List.of(), IntentResult.none()).searchTerms();
        if (terms.isEmpty()) {
            return QuickSearchResponse.empty();
        }
        try {
            this.index.initialize();
            return new QuickSearchResponse(
                    this.index.searchPeople(terms, List.of(), limit),
                    this.index.searchFaqs(terms, limit),
                    this.index.searchResources(terms, List.of(), limit));
        }
        catch (RuntimeException e) {
            log.error("Quick search failed for {}", LogSanitizer.querySummary(rawQuery), e);
            return QuickSearchResponse.empty();
        }
    }

    public QuickSearchResponse quickSearch(String rawQuery) {
        return this.quickSearch(rawQuery, this.props.getQuickSearchLimit());
    }

    public IndexStatus status() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        this.index.stats().forEach((type, count) -> sizes.put(type.categoryKey(), count));
        return new IndexStatus(this.index.isInitialized(), sizes);
    }

    /**
     * Reloads the corpus and rebuilds every index.
     *
     * @throws com.jreinhal.cafefinder.exception.IndexInitializationException when the corpus cannot be loaded
     */
    public IndexStatus reindex() {
        this.index.rebuild();
        IndexStatus status = this.status();
        log.info("Reindexed: {}", status.indexSizes());
        return status;
    }

    /**
     * Follow-up queries, offered only when nothing matched.
     */
    static List<String> suggestionsFor(List<Entity> entities, SearchResults results) {
        if (results.totalCount() > 0) {
            return List.of();
        }
        List<String> suggestions = new ArrayList<>();
        if (!entities.isEmpty() && entities.get(0).type() == EntityType.TOPIC) {
            String topic = entities.get(0).normalizedValue();
            suggestions.add(topic + " guide");
            suggestions.add(topic + " faq");
            suggestions.add(topic + " expert");
        }
        suggestions.add(BROWSE_SUGGESTION);
        suggestions.add(DISCUSSION_SUGGESTION);
        return suggestions;
    }

    private SearchResponse emptyResponse(String rawQuery, SearchContext context, long start, boolean failed) {
        SearchResults results = SearchResults.empty();
        List<String> suggestions = failed ? FAILURE_SUGGESTIONS : suggestionsFor(List.of(), results);
        return new SearchResponse(SearchQuery.empty(rawQuery, context), null, results, 0,
                SearchMetrics.untimed(elapsedMs(start), this.clock.instant()), suggestions);
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
