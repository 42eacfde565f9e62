package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.cafefinder.model.Discussion;
import java.util.List;

public record DiscussionResult(
        String id,
        double score,
        List<String> matchedTerms,
        String title,
        String bodyPreview,
        String authorName,
        String authorId,
        String status,
        int replyCount,
        int upvoteCount,
        boolean hasAcceptedAnswer,
        String createdAt,
        List<String> tags) implements SearchResult {

    static final int PREVIEW_LENGTH = 150;

    public DiscussionResult {
        score = Scores.clamp(score);
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static DiscussionResult of(Discussion discussion, double score, List<String> matchedTerms) {
        return new DiscussionResult(discussion.id(), score, matchedTerms, discussion.title(),
                preview(discussion.body()), discussion.authorName(), discussion.authorId(), discussion.status(),
                discussion.replyCount(), discussion.upvoteCount(), discussion.acceptedReplyId() != null,
                discussion.createdAt(), discussion.tags());
    }

    static String preview(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > PREVIEW_LENGTH ? body.substring(0, PREVIEW_LENGTH) + "..." : body;
    }

    @Override
    @JsonProperty("type")
    public SearchResultType type() {
        return SearchResultType.DISCUSSION;
    }

    @Override
    public DiscussionResult withScore(double newScore) {
        return new DiscussionResult(this.id, newScore, this.matchedTerms, this.title, this.bodyPreview,
                this.authorName, this.authorId, this.status, this.replyCount, this.upvoteCount,
                this.hasAcceptedAnswer, this.createdAt, this.tags);
    }

    @Override
    public String label() {
        return this.title;
    }
}
