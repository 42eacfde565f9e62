package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.cafefinder.model.Competitor;
import java.util.List;

public record CompetitorResult(
        String id,
        double score,
        List<String> matchedTerms,
        String name,
        String category,
        int tier,
        String description,
        int signalCount,
        boolean watchlisted,
        List<String> markets) implements SearchResult {

    public CompetitorResult {
        score = Scores.clamp(score);
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        markets = markets == null ? List.of() : List.copyOf(markets);
    }

    public static CompetitorResult of(Competitor competitor, double score, List<String> matchedTerms) {
        String description = competitor.description() == null || competitor.description().isBlank()
                ? competitor.category() + " competitor"
                : competitor.description();
        return new CompetitorResult(competitor.id(), score, matchedTerms, competitor.name(), competitor.category(),
                competitor.tier(), description, competitor.signalCount(), competitor.watchlisted(),
                competitor.markets());
    }

    @Override
    @JsonProperty("type")
    public SearchResultType type() {
        return SearchResultType.COMPETITOR;
    }

    @Override
    public CompetitorResult withScore(double newScore) {
        return new CompetitorResult(this.id, newScore, this.matchedTerms, this.name, this.category, this.tier,
                this.description, this.signalCount, this.watchlisted, this.markets);
    }

    @Override
    public String label() {
        return this.name;
    }
}
