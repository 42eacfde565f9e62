package com.jreinhal.cafefinder.search.query;

import com.jreinhal.cafefinder.dictionary.SynonymDictionary;
import com.jreinhal.cafefinder.search.SearchContext;
import com.jreinhal.cafefinder.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw user input into a {@link ProcessedQuery}: sanitize, normalize, tokenize, expand.
 *
 * Never throws. Internal failures degrade to a whitespace split with no expansion.
 */
@Component
public class QueryProcessor {
    private static final Logger log = LoggerFactory.getLogger(QueryProcessor.class);

    public static final int MAX_QUERY_LENGTH = 500;
    public static final int MAX_EXPANDED_TOKENS = 50;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"([^\"]+)\"");
    // Apostrophes inside words ("what's") are not phrase delimiters.
    private static final Pattern SINGLE_QUOTED = Pattern.compile("(?<![\\p{L}\\p{N}])'([^']+)'(?![\\p{L}\\p{N}])");
    private static final List<Pattern> SUSPICIOUS_PATTERNS = List.of(
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("on\\w+=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("data:", Pattern.CASE_INSENSITIVE));

    private final SynonymDictionary synonyms;

    public QueryProcessor(SynonymDictionary synonyms) {
        this.synonyms = synonyms;
    }

    public ProcessedQuery process(String rawQuery, SearchContext context) {
        String sanitized = sanitize(rawQuery);
        if (sanitized.length() > MAX_QUERY_LENGTH) {
            if (log.isDebugEnabled()) {
                log.debug("Truncating query {} to {} characters", LogSanitizer.querySummary(sanitized), MAX_QUERY_LENGTH);
            }
            sanitized = sanitized.substring(0, MAX_QUERY_LENGTH).trim();
        }
        if (sanitized.isEmpty()) {
            return ProcessedQuery.empty(context);
        }
        if (containsSuspiciousPatterns(sanitized)) {
            log.warn("Suspicious pattern detected in query {}", LogSanitizer.querySummary(sanitized));
        }
        try {
            String normalized = TextNormalizer.normalizeQuery(sanitized);
            QuotedPhrases quoted = extractQuotedPhrases(sanitized);
            List<String> tokens = new ArrayList<>();
            for (String token : TextNormalizer.tokenize(quoted.remainder())) {
                String normalizedToken = TextNormalizer.normalizeToken(token);
                if (!normalizedToken.isEmpty()) {
                    tokens.add(normalizedToken);
                }
            }
            for (String phrase : quoted.phrases()) {
                tokens.add(phrase.toLowerCase(Locale.ROOT));
            }
            return new ProcessedQuery(sanitized, normalized, tokens, this.expand(tokens), context);
        }
        catch (RuntimeException e) {
            log.error("Query processing failed for {}, falling back to whitespace split", LogSanitizer.querySummary(sanitized), e);
            String lowered = sanitized.toLowerCase(Locale.ROOT).trim();
            List<String> naive = Arrays.stream(lowered.split("\\s+")).filter(t -> !t.isEmpty()).toList();
            return new ProcessedQuery(sanitized, lowered, naive, List.of(), context);
        }
    }

    public ProcessedQuery process(String rawQuery) {
        return this.process(rawQuery, null);
    }

    /**
     * Normalized form, canonical form and every registered synonym per token, first-seen order, capped.
     */
    List<String> expand(List<String> tokens) {
        Set<String> expanded = new LinkedHashSet<>();
        for (String token : tokens) {
            String normalized = TextNormalizer.normalizeTerm(token);
            if (normalized.isEmpty()) {
                continue;
            }
            expanded.add(normalized);
            if (this.synonyms.isEnabled()) {
                expanded.add(this.synonyms.canonicalOf(normalized));
                for (String synonym : this.synonyms.synonymsOf(normalized)) {
                    expanded.add(synonym.toLowerCase(Locale.ROOT));
                }
            }
            if (expanded.size() >= MAX_EXPANDED_TOKENS) {
                break;
            }
        }
        return expanded.stream().limit(MAX_EXPANDED_TOKENS).toList();
    }

    public static String sanitize(String input) {
        if (input == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(input).replaceAll("").trim();
    }

    public static boolean containsSuspiciousPatterns(String query) {
        return SUSPICIOUS_PATTERNS.stream().anyMatch(p -> p.matcher(query).find());
    }

    static QuotedPhrases extractQuotedPhrases(String query) {
        List<String> phrases = new ArrayList<>();
        String remainder = collect(DOUBLE_QUOTED, query, phrases);
        remainder = collect(SINGLE_QUOTED, remainder, phrases);
        return new QuotedPhrases(phrases, TextNormalizer.collapseWhitespace(remainder));
    }

    private static String collect(Pattern pattern, String text, List<String> phrases) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder remainder = new StringBuilder();
        while (matcher.find()) {
            String phrase = TextNormalizer.collapseWhitespace(matcher.group(1));
            if (!phrase.isEmpty()) {
                phrases.add(phrase);
            }
            matcher.appendReplacement(remainder, " ");
        }
        matcher.appendTail(remainder);
        return remainder.toString();
    }

    record QuotedPhrases(List<String> phrases, String remainder) {
    }
}
