package com.evertz.featured.infrastructure.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for one video of a replacement pool.
 * Length limits follow the {@code featured_videos} columns.
 */
public record VideoRequest(
        @NotBlank(message = "videoId must not be empty or blank")
        @Size(max = 64, message = "videoId must be at most 64 characters")
        String videoId,
        @NotBlank(message = "title must not be empty or blank")
        @Size(max = 500, message = "title must be at most 500 characters")
        String title,
        @Size(max = 5000, message = "description must be at most 5000 characters")
        String description,
        @Size(max = 1000, message = "thumbnailUrl must be at most 1000 characters")
        String thumbnailUrl
) {}
