package com.jreinhal.cafefinder.search.intent;

import java.util.List;

/**
 * @param keywords bonus phrases; a phrase counts when every one of its words is a query token
 * @param baseConfidence added once per matching pattern
 */
public record IntentDefinition(
        IntentType intent,
        List<IntentPattern> patterns,
        List<String> keywords,
        ExpectedResultType expectedResult,
        double baseConfidence) {

    public IntentDefinition {
        patterns = List.copyOf(patterns);
        keywords = List.copyOf(keywords);
    }
}
