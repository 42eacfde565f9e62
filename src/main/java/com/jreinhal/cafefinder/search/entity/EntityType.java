package com.jreinhal.cafefinder.search.entity;

public enum EntityType {
    TOOL,
    PERSON,
    TOPIC,
    TEAM,
    RESOURCE_TYPE,
    ACTION,
    PILLAR,
    DATE,
    TIME_RANGE;

    public boolean isTemporal() {
        return this == DATE || this == TIME_RANGE;
    }
}
