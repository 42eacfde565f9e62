package com.jreinhal.cafefinder.search.answer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jreinhal.cafefinder.search.result.SearchResult;
import java.util.List;

/**
 * A direct answer rendered above the result lists. Optional parts are null when a template does not use them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SynthesizedAnswer(
        AnswerType type,
        double confidence,
        String text,
        List<String> steps,
        List<String> keyPoints,
        List<AnswerAction> actions,
        List<AnswerSource> sources,
        SearchResult featuredResult) {

    public SynthesizedAnswer {
        steps = steps == null ? null : List.copyOf(steps);
        keyPoints = keyPoints == null ? null : List.copyOf(keyPoints);
        actions = actions == null ? List.of() : List.copyOf(actions);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
