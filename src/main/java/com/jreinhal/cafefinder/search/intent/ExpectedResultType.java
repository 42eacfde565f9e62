package com.jreinhal.cafefinder.search.intent;

public enum ExpectedResultType {
    DIRECT_ANSWER,
    ENTITY_CARD,
    RESOURCE_LIST,
    ACTIONABLE_ANSWER,
    NAVIGATION,
    MIXED
}
