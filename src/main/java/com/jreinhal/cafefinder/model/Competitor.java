package com.jreinhal.cafefinder.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Competitor(
        String id,
        String name,
        int tier,
        String category,
        String description,
        String website,
        int signalCount,
        boolean watchlisted,
        List<String> markets) {

    public Competitor {
        markets = markets == null ? List.of() : List.copyOf(markets);
    }
}
