package com.jreinhal.cafefinder.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Faq(
        String id,
        String question,
        List<String> alternateQuestions,
        String answerSummary,
        List<FaqStep> answerSteps,
        String category,
        List<String> tags,
        List<String> relatedResourceIds,
        List<String> expertIds,
        int viewCount,
        int helpfulCount) {

    public Faq {
        alternateQuestions = alternateQuestions == null ? List.of() : List.copyOf(alternateQuestions);
        answerSteps = answerSteps == null ? List.of() : List.copyOf(answerSteps);
        tags = tags == null ? List.of() : List.copyOf(tags);
        relatedResourceIds = relatedResourceIds == null ? List.of() : List.copyOf(relatedResourceIds);
        expertIds = expertIds == null ? List.of() : List.copyOf(expertIds);
    }

    /**
     * The step instructions joined with spaces, or the summary when the FAQ has no steps.
     */
    public String fullAnswer() {
        if (this.answerSteps.isEmpty()) {
            return this.answerSummary == null ? "" : this.answerSummary;
        }
        return String.join(" ", this.answerSteps.stream().map(FaqStep::instruction).toList());
    }
}
