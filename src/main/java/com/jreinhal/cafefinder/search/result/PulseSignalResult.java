package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.cafefinder.model.PulseSignal;
import java.util.List;

public record PulseSignalResult(
        String id,
        double score,
        List<String> matchedTerms,
        String title,
        String summary,
        String domain,
        String priority,
        String source,
        String publishedAt,
        List<String> companies,
        @JsonProperty("isRead") boolean read) implements SearchResult {

    public PulseSignalResult {
        score = Scores.clamp(score);
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        companies = companies == null ? List.of() : List.copyOf(companies);
    }

    public static PulseSignalResult of(PulseSignal signal, double score, List<String> matchedTerms) {
        return new PulseSignalResult(signal.id(), score, matchedTerms, signal.title(), signal.summary(),
                signal.domain(), signal.priority(), signal.source().name(), signal.publishedAt(),
                signal.companies(), signal.read());
    }

    @Override
    @JsonProperty("type")
    public SearchResultType type() {
        return SearchResultType.PULSE_SIGNAL;
    }

    @Override
    public PulseSignalResult withScore(double newScore) {
        return new PulseSignalResult(this.id, newScore, this.matchedTerms, this.title, this.summary, this.domain,
                this.priority, this.source, this.publishedAt, this.companies, this.read);
    }

    @Override
    public String label() {
        return this.title;
    }
}
