package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.cafefinder.model.Resource;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record ToolResult(
        String id,
        double score,
        List<String> matchedTerms,
        String name,
        String description,
        String category,
        String accessUrl,
        String requestUrl,
        String guideUrl,
        String status,
        String turnaround) implements SearchResult {

    public static final String AVAILABLE = "available";
    public static final String UNAVAILABLE = "unavailable";
    private static final Set<String> STATUSES = Set.of(AVAILABLE, "limited", UNAVAILABLE, "coming_soon");

    public ToolResult {
        score = Scores.clamp(score);
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        status = status == null || !STATUSES.contains(status.toLowerCase(Locale.ROOT))
                ? AVAILABLE : status.toLowerCase(Locale.ROOT);
    }

    public static ToolResult of(Resource resource, double score, List<String> matchedTerms) {
        return new ToolResult(resource.id(), score, matchedTerms, resource.title(), resource.description(),
                resource.category(), resource.url(), resource.accessRequestUrl(), resource.guideUrl(),
                resource.toolStatus(), resource.turnaround());
    }

    @Override
    @JsonProperty("type")
    public SearchResultType type() {
        return SearchResultType.TOOL;
    }

    @Override
    public ToolResult withScore(double newScore) {
        return new ToolResult(this.id, newScore, this.matchedTerms, this.name, this.description, this.category,
                this.accessUrl, this.requestUrl, this.guideUrl, this.status, this.turnaround);
    }

    @Override
    public String label() {
        return this.name;
    }
}
