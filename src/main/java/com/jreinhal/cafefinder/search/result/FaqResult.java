package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.cafefinder.model.Faq;
import java.util.List;

public record FaqResult(
        String id,
        double score,
        List<String> matchedTerms,
        String question,
        String answer,
        String answerSummary,
        String category,
        List<String> tags,
        int viewCount,
        int helpfulCount,
        String expertId,
        List<String> relatedResourceIds) implements SearchResult {

    public FaqResult {
        score = Scores.clamp(score);
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        tags = tags == null ? List.of() : List.copyOf(tags);
        relatedResourceIds = relatedResourceIds == null ? List.of() : List.copyOf(relatedResourceIds);
        answerSummary = answerSummary == null ? "" : answerSummary;
        answer = answer == null ? answerSummary : answer;
    }

    public static FaqResult of(Faq faq, double score, List<String> matchedTerms) {
        String expertId = faq.expertIds().isEmpty() ? null : faq.expertIds().get(0);
        return new FaqResult(faq.id(), score, matchedTerms, faq.question(), faq.fullAnswer(), faq.answerSummary(),
                faq.category(), faq.tags(), faq.viewCount(), faq.helpfulCount(), expertId, faq.relatedResourceIds());
    }

    @Override
    @JsonProperty("type")
    public SearchResultType type() {
        return SearchResultType.FAQ;
    }

    @Override
    public FaqResult withScore(double newScore) {
        return new FaqResult(this.id, newScore, this.matchedTerms, this.question, this.answer, this.answerSummary,
                this.category, this.tags, this.viewCount, this.helpfulCount, this.expertId, this.relatedResourceIds);
    }

    @Override
    public String label() {
        return this.question;
    }
}
