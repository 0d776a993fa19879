package com.evertz.featured.infrastructure.api.dto;

/**
 * Response DTO for a single featured video.
 */
public record FeaturedVideoResponse(
        String videoId,
        String title,
        String description,
        String thumbnailUrl,
        String videoUrl
) {}
