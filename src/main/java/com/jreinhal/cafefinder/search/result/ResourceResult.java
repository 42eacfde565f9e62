package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.cafefinder.model.Resource;
import java.util.List;

public record ResourceResult(
        String id,
        double score,
        List<String> matchedTerms,
        String title,
        String description,
        String url,
        String pillar,
        String category,
        String resourceType,
        List<String> tags,
        String authorId,
        int viewCount,
        String createdAt,
        String updatedAt) implements SearchResult {

    public ResourceResult {
        score = Scores.clamp(score);
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ResourceResult of(Resource resource, double score, List<String> matchedTerms) {
        return new ResourceResult(resource.id(), score, matchedTerms, resource.title(), resource.description(),
                resource.url(), resource.pillar(), resource.category(), resource.contentType(), resource.tags(),
                resource.owner(), resource.viewCount(), resource.createdAt(), resource.updatedAt());
    }

    @Override
    @JsonProperty("type")
    public SearchResultType type() {
        return SearchResultType.RESOURCE;
    }

    @Override
    public ResourceResult withScore(double newScore) {
        return new ResourceResult(this.id, newScore, this.matchedTerms, this.title, this.description, this.url,
                this.pillar, this.category, this.resourceType, this.tags, this.authorId, this.viewCount,
                this.createdAt, this.updatedAt);
    }

    @Override
    public String label() {
        return this.title;
    }
}
