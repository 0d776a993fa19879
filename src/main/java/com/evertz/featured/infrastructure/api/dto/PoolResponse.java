package com.evertz.featured.infrastructure.api.dto;

/**
 * Response DTO for pool replacement and refresh operations.
 */
public record PoolResponse(
        int poolSize
) {}
