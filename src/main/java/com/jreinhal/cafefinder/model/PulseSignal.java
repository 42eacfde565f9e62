package com.jreinhal.cafefinder.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A market-intelligence item.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PulseSignal(
        String id,
        String title,
        String summary,
        String url,
        String publishedAt,
        String domain,
        String priority,
        Source source,
        Entities entities,
        @JsonAlias("isRead") boolean read) {

    public PulseSignal {
        source = source == null ? new Source(null, "") : source;
        entities = entities == null ? new Entities(List.of(), List.of()) : entities;
    }

    public List<String> companies() {
        return this.entities.companies();
    }

    public List<String> topics() {
        return this.entities.topics();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Source(String id, String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entities(List<String> companies, List<String> topics) {

        public Entities {
            companies = companies == null ? List.of() : List.copyOf(companies);
            topics = topics == null ? List.of() : List.copyOf(topics);
        }
    }
}
