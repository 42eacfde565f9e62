package com.jreinhal.cafefinder.search.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jreinhal.cafefinder.model.LopSession;
import java.time.LocalDate;
import java.util.List;

public record LopSessionResult(
        String id,
        double score,
        List<String> matchedTerms,
        int sessionNumber,
        String title,
        String description,
        String speakerName,
        String speakerId,
        LocalDate sessionDate,
        String duration,
        List<String> topics,
        String videoUrl,
        String slidesUrl) implements SearchResult {

    public static final String UNKNOWN_SPEAKER = "Unknown Speaker";
    static final String DEFAULT_DURATION = "60 min";

    public LopSessionResult {
        score = Scores.clamp(score);
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        topics = topics == null ? List.of() : List.copyOf(topics);
        speakerName = speakerName == null || speakerName.isBlank() ? UNKNOWN_SPEAKER : speakerName;
        duration = duration == null || duration.isBlank() ? DEFAULT_DURATION : duration;
    }

    public static LopSessionResult of(LopSession session, String speakerName, double score, List<String> matchedTerms) {
        String speakerId = session.speakerIds().isEmpty() ? "" : session.speakerIds().get(0);
        return new LopSessionResult(session.id(), score, matchedTerms, session.sessionNumber(), session.title(),
                session.description(), speakerName, speakerId, session.date(), session.duration(), session.tags(),
                session.recordingUrl(), session.slidesUrl());
    }

    @Override
    @JsonProperty("type")
    public SearchResultType type() {
        return SearchResultType.LOP_SESSION;
    }

    @Override
    public LopSessionResult withScore(double newScore) {
        return new LopSessionResult(this.id, newScore, this.matchedTerms, this.sessionNumber, this.title,
                this.description, this.speakerName, this.speakerId, this.sessionDate, this.duration, this.topics,
                this.videoUrl, this.slidesUrl);
    }

    @Override
    public String label() {
        return this.title;
    }
}
