package com.evertz.featured.infrastructure.api.controller;

import com.evertz.featured.application.service.FeaturedVideoService;
import com.evertz.featured.core.model.FeaturedVideo;
import com.evertz.featured.infrastructure.api.dto.PoolResponse;
import com.evertz.featured.infrastructure.api.dto.ReplacePoolRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for replacing or reloading the featured video pool.
 */
@RestController
@RequestMapping("/api/admin/featured-videos")
public class AdminFeaturedVideoController {

    private final FeaturedVideoService featuredVideoService;

    public AdminFeaturedVideoController(FeaturedVideoService featuredVideoService) {
        this.featuredVideoService = featuredVideoService;
    }

    @PutMapping
    public ResponseEntity<PoolResponse> replacePool(@Valid @RequestBody ReplacePoolRequest request) {
        List<FeaturedVideo> videos = request.videos().stream()
                .map(video -> new FeaturedVideo(
                        video.videoId(),
                        video.title(),
                        video.description(),
                        video.thumbnailUrl()
                ))
                .toList();

        FeaturedVideoService.PoolResult result = featuredVideoService.setPool(videos);
        return ResponseEntity.ok(new PoolResponse(result.poolSize()));
    }

    @PostMapping("/refresh")
    public ResponseEntity<PoolResponse> refresh() {
        FeaturedVideoService.PoolResult result = featuredVideoService.refreshFromSource();
        return ResponseEntity.ok(new PoolResponse(result.poolSize()));
    }
}
