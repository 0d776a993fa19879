package com.evertz.featured.infrastructure.api.controller;

import com.evertz.featured.application.service.FeaturedVideoService;
import com.evertz.featured.core.model.FeaturedVideo;
import com.evertz.featured.infrastructure.api.dto.FeaturedVideoResponse;
import com.evertz.featured.infrastructure.api.dto.FeaturedVideosResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller serving the current featured video selection.
 */
@RestController
@RequestMapping("/api/featured-videos")
public class FeaturedVideoController {

    private final FeaturedVideoService featuredVideoService;

    public FeaturedVideoController(FeaturedVideoService featuredVideoService) {
        this.featuredVideoService = featuredVideoService;
    }

    @GetMapping
    public ResponseEntity<FeaturedVideosResponse> getFeatured(
            @RequestParam(required = false) Integer count
    ) {
        FeaturedVideoService.FeaturedResult result = count == null
                ? featuredVideoService.getFeatured()
                : featuredVideoService.getFeatured(count);

        return ResponseEntity.ok(new FeaturedVideosResponse(
                result.videos().stream().map(FeaturedVideoController::toResponse).toList(),
                result.poolSize()
        ));
    }

    static FeaturedVideoResponse toResponse(FeaturedVideo video) {
        return new FeaturedVideoResponse(
                video.getVideoId(),
                video.getTitle(),
                video.getDescription(),
                video.getThumbnailUrl(),
                video.getVideoUrl()
        );
    }
}
