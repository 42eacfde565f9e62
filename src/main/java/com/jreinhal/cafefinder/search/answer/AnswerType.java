package com.jreinhal.cafefinder.search.answer;

public enum AnswerType {
    INSTANT_ANSWER,
    PERSON_CARD,
    TOOL_CARD,
    CONCEPT_EXPLANATION,
    RESOURCE_LIST,
    LOP_SESSION,
    NO_DIRECT_ANSWER,
    ZERO_RESULTS
}
