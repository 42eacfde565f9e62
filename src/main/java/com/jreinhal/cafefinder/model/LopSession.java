package com.jreinhal.cafefinder.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.LocalDate;
import java.util.List;

/**
 * A Love of Product talk.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LopSession(
        String id,
        int sessionNumber,
        String title,
        String description,
        LocalDate date,
        List<String> speakerIds,
        String recordingUrl,
        String slidesUrl,
        List<String> tags,
        String duration) {

    public LopSession {
        speakerIds = speakerIds == null ? List.of() : List.copyOf(speakerIds);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
