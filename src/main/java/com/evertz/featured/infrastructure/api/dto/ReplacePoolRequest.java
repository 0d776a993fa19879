package com.evertz.featured.infrastructure.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO for replacing the featured video pool. The first video is the newest.
 */
public record ReplacePoolRequest(
        @NotNull(message = "videos is required")
        List<@Valid @NotNull VideoRequest> videos
) {}
