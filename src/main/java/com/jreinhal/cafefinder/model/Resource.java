package com.jreinhal.cafefinder.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A library entry. Entries with content type {@code tool} or pillar {@code tools-access} double as tools;
 * the access fields only apply to those.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Resource(
        String id,
        String slug,
        String title,
        String description,
        String url,
        String category,
        String pillar,
        String contentType,
        List<String> tags,
        String owner,
        String createdAt,
        String updatedAt,
        int viewCount,
        @JsonAlias("isArchived") boolean archived,
        String accessRequestUrl,
        String guideUrl,
        String toolStatus,
        String turnaround) {

    public static final String TOOL_CONTENT_TYPE = "tool";
    public static final String TOOLS_PILLAR = "tools-access";

    public Resource {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean isTool() {
        return TOOL_CONTENT_TYPE.equalsIgnoreCase(this.contentType) || TOOLS_PILLAR.equalsIgnoreCase(this.pillar);
    }
}
