package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result categories, in response order. {@code wireName} tags a single result, {@code categoryKey}
 * names its list in the response envelope.
 */
public enum SearchResultType {
    PERSON("person", "people"),
    TOOL("tool", "tools"),
    FAQ("faq", "faqs"),
    RESOURCE("resource", "resources"),
    DISCUSSION("discussion", "discussions"),
    LOP_SESSION("lop_session", "lopSessions"),
    PULSE_SIGNAL("pulse_signal", "pulseSignals"),
    COMPETITOR("competitor", "competitors");

    private final String wireName;
    private final String categoryKey;

    SearchResultType(String wireName, String categoryKey) {
        this.wireName = wireName;
        this.categoryKey = categoryKey;
    }

    @JsonValue
    public String wireName() {
        return this.wireName;
    }

    public String categoryKey() {
        return this.categoryKey;
    }
}
