package com.jreinhal.cafefinder.search.intent;

public enum IntentType {
    FIND_PERSON,
    FIND_TOOL,
    TOOL_ACCESS,
    FIND_FAQ,
    EXPLAIN_CONCEPT,
    LEARN_PROCESS,
    COMPARE,
    FIND_RESOURCE,
    FIND_TEAM,
    START_DISCUSSION,
    CONTACT_EXPERT,
    NAVIGATE,
    LOP_NEXT,
    LOP_FIND,
    LOP_SPEAKER,
    BROWSE,
    RECENT,
    POPULAR,
    GENERAL_SEARCH;

    /** Seeking a specific thing. */
    public boolean isFind() {
        return this == FIND_PERSON || this == FIND_TOOL || this == FIND_RESOURCE || this == FIND_FAQ || this == FIND_TEAM;
    }

    /** Wanting to do something. */
    public boolean isAction() {
        return this == TOOL_ACCESS || this == START_DISCUSSION || this == CONTACT_EXPERT || this == NAVIGATE;
    }

    /** Wanting to understand something. */
    public boolean isLearn() {
        return this == EXPLAIN_CONCEPT || this == LEARN_PROCESS || this == COMPARE;
    }

    public boolean isLop() {
        return this == LOP_NEXT || this == LOP_FIND || this == LOP_SPEAKER;
    }
}
