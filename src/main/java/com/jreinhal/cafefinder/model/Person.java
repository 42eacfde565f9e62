package com.jreinhal.cafefinder.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Person(
        String id,
        String email,
        String displayName,
        String title,
        String team,
        String location,
        String avatarUrl,
        List<String> expertiseAreas,
        List<String> canHelpWith,
        String teamsDeepLink,
        String slackHandle,
        int points,
        int badgeCount,
        @JsonAlias("isActive") Boolean active) {

    public Person {
        expertiseAreas = expertiseAreas == null ? List.of() : List.copyOf(expertiseAreas);
        canHelpWith = canHelpWith == null ? List.of() : List.copyOf(canHelpWith);
        active = active == null ? Boolean.TRUE : active;
    }
}
