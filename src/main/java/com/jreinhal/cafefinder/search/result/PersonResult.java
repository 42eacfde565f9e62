package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.cafefinder.model.Person;
import java.util.List;

public record PersonResult(
        String id,
        double score,
        List<String> matchedTerms,
        String name,
        String email,
        String title,
        String team,
        String location,
        String avatarUrl,
        List<String> expertiseAreas,
        int points,
        int badgeCount,
        String teamsDeepLink,
        String slackHandle) implements SearchResult {

    public PersonResult {
        score = Scores.clamp(score);
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        expertiseAreas = expertiseAreas == null ? List.of() : List.copyOf(expertiseAreas);
        location = location == null ? "" : location;
        avatarUrl = avatarUrl == null ? "" : avatarUrl;
    }

    public static PersonResult of(Person person, double score, List<String> matchedTerms) {
        return new PersonResult(person.id(), score, matchedTerms, person.displayName(), person.email(),
                person.title(), person.team(), person.location(), person.avatarUrl(), person.expertiseAreas(),
                person.points(), person.badgeCount(), person.teamsDeepLink(), person.slackHandle());
    }

    @Override
    @JsonProperty("type")
    public SearchResultType type() {
        return SearchResultType.PERSON;
    }

    @Override
    public PersonResult withScore(double newScore) {
        return new PersonResult(this.id, newScore, this.matchedTerms, this.name, this.email, this.title, this.team,
                this.location, this.avatarUrl, this.expertiseAreas, this.points, this.badgeCount,
                this.teamsDeepLink, this.slackHandle);
    }

    @Override
    public String label() {
        return this.name;
    }
}
