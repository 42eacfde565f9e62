package com.jreinhal.cafefinder.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Discussion(
        String id,
        String title,
        String body,
        String authorId,
        String authorName,
        String status,
        String acceptedReplyId,
        int replyCount,
        int upvoteCount,
        String createdAt,
        List<String> tags) {

    public Discussion {
        body = body == null ? "" : body;
        status = status == null ? "open" : status;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
