package com.jreinhal.cafefinder.search.intent;

/**
 * Surface shape of a query, independent of what it asks for.
 */
public enum QueryType {
    QUESTION,
    COMMAND,
    NAME,
    KEYWORD,
    PHRASE
}
