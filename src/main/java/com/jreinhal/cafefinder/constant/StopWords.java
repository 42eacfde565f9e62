package com.jreinhal.cafefinder.constant;

import java.util.Set;

public final class StopWords {
    /** Function words dropped from index search terms. */
    public static final Set<String> SEARCH_TERMS = Set.of(
            "a", "an", "the", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "were", "been",
            "be", "have", "has", "had", "do", "does", "did", "will", "would",
            "could", "should", "may", "might", "must", "shall", "can",
            "i", "me", "my", "we", "our", "you", "your", "it", "its", "this", "that",
            "how", "what", "who", "where", "when", "why", "which", "there");

    /** Words that carry only time or LOP meaning, removed before matching LOP session text. */
    public static final Set<String> LOP_TEMPORAL_NOISE = Set.of(
            "next", "upcoming", "future", "session", "sessions", "lop", "lops", "meeting", "talk", "talks",
            "q1", "q2", "q3", "q4", "tomorrow", "today", "tonight", "yesterday",
            "this", "last", "past", "week", "month", "quarter", "year");

    private StopWords() {
    }
}
