package com.jreinhal.cafefinder.search;

import java.time.Instant;

/**
 * Stage timings of one search, in milliseconds.
 */
public record SearchMetrics(
        double totalTimeMs,
        double queryProcessingMs,
        double searchExecutionMs,
        double answerSynthesisMs,
        Instant timestamp) {

    public static SearchMetrics untimed(double totalTimeMs, Instant timestamp) {
        return new SearchMetrics(totalTimeMs, 0, 0, 0, timestamp);
    }
}
