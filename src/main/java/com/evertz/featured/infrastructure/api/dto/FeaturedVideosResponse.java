package com.evertz.featured.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for the current featured selection.
 */
public record FeaturedVideosResponse(
        List<FeaturedVideoResponse> videos,
        int poolSize
) {}
