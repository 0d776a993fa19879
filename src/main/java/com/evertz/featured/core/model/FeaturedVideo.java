package com.evertz.featured.core.model;

import java.util.Objects;

/**
 * Domain entity representing a video in the featured rotation pool.
 * Pure domain object with no framework dependencies.
 */
public class FeaturedVideo {

    private static final String WATCH_URL_PREFIX = "https://youtube.com/watch?v=";

    private final String videoId;
    private final String title;
    private final String description;
    private final String thumbnailUrl;

    public FeaturedVideo(String videoId, String title, String description, String thumbnailUrl) {
        this.videoId = Objects.requireNonNull(videoId, "videoId must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.description = description == null ? "" : description;
        this.thumbnailUrl = thumbnailUrl == null ? "" : thumbnailUrl;
    }

    public String getVideoId() {
        return videoId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public String getVideoUrl() {
        return WATCH_URL_PREFIX + videoId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FeaturedVideo that = (FeaturedVideo) o;
        return Objects.equals(videoId, that.videoId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(videoId);
    }

    @Override
    public String toString() {
        return "FeaturedVideo{videoId='" + videoId + "', title='" + title + "'}";
    }
}
