package com.jreinhal.cafefinder.search.answer;

import com.jreinhal.cafefinder.search.SearchQuery;
import com.jreinhal.cafefinder.search.intent.IntentType;
import com.jreinhal.cafefinder.search.result.FaqResult;
import com.jreinhal.cafefinder.search.result.LopSessionResult;
import com.jreinhal.cafefinder.search.result.PersonResult;
import com.jreinhal.cafefinder.search.result.SearchResult;
import com.jreinhal.cafefinder.search.result.SearchResults;
import com.jreinhal.cafefinder.search.result.ToolResult;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks an answer template for the query intent and the best result, or declines.
 *
 * An answer is only produced when the top result is strong enough; concept questions are
 * answered from weaker matches as well.
 */
@Component
public class AnswerSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);

    static final double MIN_TOP_SCORE = 0.6;
    static final double TYPE_FALLBACK_SCORE = 0.9;

    public Optional<SynthesizedAnswer> synthesize(SearchQuery query, SearchResults results, boolean enabled) {
        if (!enabled) {
            return Optional.empty();
        }
        Optional<SearchResult> top = results.topResult();
        if (results.totalCount() == 0 || top.isEmpty()) {
            return Optional.of(AnswerTemplates.zeroResults(query));
        }
        SearchResult best = top.get();
        IntentType intent = query.intent().primary();
        if (best.score() < MIN_TOP_SCORE && intent != IntentType.EXPLAIN_CONCEPT) {
            if (log.isDebugEnabled()) {
                log.debug("No answer: top {} score {} below {}", best.type(), best.score(), MIN_TOP_SCORE);
            }
            return Optional.empty();
        }
        Optional<SynthesizedAnswer> byIntent = byIntent(query, intent, best);
        if (byIntent.isPresent()) {
            return byIntent;
        }
        if (best.score() > TYPE_FALLBACK_SCORE) {
            return byType(query, best);
        }
        return Optional.empty();
    }

    private static Optional<SynthesizedAnswer> byIntent(SearchQuery query, IntentType intent, SearchResult best) {
        return switch (intent) {
            case FIND_PERSON, CONTACT_EXPERT, FIND_TEAM -> best instanceof PersonResult person
                    ? Optional.of(AnswerTemplates.person(person)) : Optional.empty();
            case FIND_TOOL, TOOL_ACCESS -> best instanceof ToolResult tool
                    ? Optional.of(AnswerTemplates.tool(query, tool)) : Optional.empty();
            case FIND_FAQ -> best instanceof FaqResult faq
                    ? Optional.of(AnswerTemplates.faq(faq)) : Optional.empty();
            case EXPLAIN_CONCEPT, LEARN_PROCESS -> best instanceof FaqResult faq
                    ? Optional.of(AnswerTemplates.concept(faq)) : Optional.empty();
            case LOP_NEXT, LOP_FIND, LOP_SPEAKER -> best instanceof LopSessionResult session
                    ? Optional.of(AnswerTemplates.lopSession(query, session)) : Optional.empty();
            case COMPARE, FIND_RESOURCE, START_DISCUSSION, NAVIGATE, BROWSE, RECENT, POPULAR, GENERAL_SEARCH -> Optional.empty();
        };
    }

    private static Optional<SynthesizedAnswer> byType(SearchQuery query, SearchResult best) {
        if (best instanceof PersonResult person) {
            return Optional.of(AnswerTemplates.person(person));
        }
        if (best instanceof ToolResult tool) {
            return Optional.of(AnswerTemplates.tool(query, tool));
        }
        if (best instanceof FaqResult faq) {
            return Optional.of(AnswerTemplates.faq(faq));
        }
        if (best instanceof LopSessionResult session) {
            return Optional.of(AnswerTemplates.lopSession(query, session));
        }
        return Optional.empty();
    }
}
