package com.evertz.featured.infrastructure.scheduling;

import com.evertz.featured.application.service.FeaturedVideoService;
import com.evertz.featured.core.exception.VideoSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reloads the pool from the YouTube playlist.
 * Registered only when the YouTube source is enabled and an api key is set.
 * A failed refresh leaves the previous pool in place.
 */
@Component
@ConditionalOnExpression(
        "${featured-videos.youtube.enabled:false} and !'${featured-videos.youtube.api-key:}'.isBlank()")
public class FeaturedVideoRefreshJob {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeaturedVideoRefreshJob.class);

    private final FeaturedVideoService featuredVideoService;

    public FeaturedVideoRefreshJob(FeaturedVideoService featuredVideoService) {
        this.featuredVideoService = featuredVideoService;
    }

    @Scheduled(
            initialDelayString = "${featured-videos.youtube.initial-delay:PT10S}",
            fixedDelayString = "${featured-videos.youtube.refresh-interval:PT6H}"
    )
    public void refresh() {
        try {
            FeaturedVideoService.PoolResult result = featuredVideoService.refreshFromSource();
            LOGGER.info("Featured video refresh done poolSize={}", result.poolSize());
        } catch (VideoSourceException e) {
            LOGGER.warn("Featured video refresh failed, keeping previous pool: {}", e.getMessage(), e);
        }
    }
}
