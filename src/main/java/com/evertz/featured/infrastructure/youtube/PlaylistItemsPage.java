package com.evertz.featured.infrastructure.youtube;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Subset of the YouTube Data API {@code playlistItems.list} response that the client reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistItemsPage(
        String nextPageToken,
        List<Item> items
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(Snippet snippet) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Snippet(
            String publishedAt,
            String title,
            String description,
            Map<String, Thumbnail> thumbnails,
            ResourceId resourceId
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Thumbnail(String url) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResourceId(String videoId) {}
}
