package com.jreinhal.cafefinder.search.intent;

import java.util.List;
import java.util.Objects;

public record IntentResult(
        IntentType primary,
        double confidence,
        List<ScoredIntent> secondary,
        QueryType queryType,
        ExpectedResultType expectedResult) {

    public IntentResult {
        Objects.requireNonNull(primary, "primary");
        secondary = secondary == null ? List.of() : List.copyOf(secondary);
        queryType = queryType == null ? QueryType.KEYWORD : queryType;
        expectedResult = expectedResult == null ? ExpectedResultType.MIXED : expectedResult;
    }

    /**
     * The intent attached to responses that never reached classification.
     */
    public static IntentResult none() {
        return new IntentResult(IntentType.GENERAL_SEARCH, 0.0, List.of(), QueryType.KEYWORD, ExpectedResultType.MIXED);
    }
}
