package com.evertz.featured.application.service;

import com.evertz.featured.application.port.FeaturedVideoPoolPort;
import com.evertz.featured.application.port.VideoSourcePort;
import com.evertz.featured.core.exception.InvalidSelectionException;
import com.evertz.featured.core.exception.VideoSourceException;
import com.evertz.featured.core.model.FeaturedVideo;
import com.evertz.featured.core.selection.RandomSource;
import com.evertz.featured.core.selection.RotatingSelectionPicker;
import com.evertz.featured.infrastructure.config.FeaturedVideoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Service for the featured video rotation.
 */
@Service
public class FeaturedVideoService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeaturedVideoService.class);

    private final FeaturedVideoPoolPort poolPort;
    private final RandomSource randomSource;
    private final ObjectProvider<VideoSourcePort> videoSourceProvider;
    private final TransactionTemplate transactionTemplate;
    private final int defaultCount;
    private final int maxCount;

    public FeaturedVideoService(
            FeaturedVideoPoolPort poolPort,
            RandomSource randomSource,
            ObjectProvider<VideoSourcePort> videoSourceProvider,
            PlatformTransactionManager transactionManager,
            FeaturedVideoProperties properties
    ) {
        this.poolPort = poolPort;
        this.randomSource = randomSource;
        this.videoSourceProvider = videoSourceProvider;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.defaultCount = properties.getDefaultCount();
        this.maxCount = properties.getMaxCount();
    }

    /**
     * Result record containing the current selection and the size of the pool it was drawn from.
     */
    public record FeaturedResult(
            List<FeaturedVideo> videos,
            int poolSize
    ) {}

    /**
     * Result record for pool replacement and refresh operations.
     */
    public record PoolResult(
            int poolSize
    ) {}

    /**
     * Gets a fresh selection using the configured default count.
     *
     * @return the featured result
     */
    @Transactional(readOnly = true)
    public FeaturedResult getFeatured() {
        return getFeatured(defaultCount);
    }

    /**
     * Gets a fresh selection from the current pool.
     * An empty pool yields an empty selection, and a count above the pool size is clamped to it.
     *
     * @param count the requested number of videos
     * @return the featured result with the newest video first
     */
    @Transactional(readOnly = true)
    public FeaturedResult getFeatured(int count) {
        validateCount(count);

        List<FeaturedVideo> pool = poolPort.findAllOrderedByPosition();
        if (pool.isEmpty()) {
            return new FeaturedResult(List.of(), 0);
        }

        List<FeaturedVideo> selected = RotatingSelectionPicker.select(
                randomSource, pool, Math.min(count, pool.size()));
        LOGGER.debug("Featured selection count={} poolSize={} ids={}", selected.size(), pool.size(),
                selected.stream().map(FeaturedVideo::getVideoId).toList());
        return new FeaturedResult(selected, pool.size());
    }

    /**
     * Replaces the stored pool in a single transaction.
     *
     * @param videos the new pool, newest video first
     * @return the pool result with the new size
     */
    @Transactional
    public PoolResult setPool(List<FeaturedVideo> videos) {
        if (videos == null) {
            throw new InvalidSelectionException("Pool must not be null");
        }
        if (videos.stream().anyMatch(video -> video == null)) {
            throw new InvalidSelectionException("Pool must not contain null videos");
        }
        return storePool(videos);
    }

    /**
     * Fetches the playlist from the configured video source and stores it as the new pool.
     * The fetch runs without a transaction; only the store does. An empty fetch keeps the existing pool.
     *
     * @return the pool result with the size after the refresh
     * @throws VideoSourceException if no source is configured or the fetch fails
     */
    public PoolResult refreshFromSource() {
        VideoSourcePort videoSource = videoSourceProvider.getIfAvailable();
        if (videoSource == null) {
            throw new VideoSourceException("No video source is configured");
        }

        List<FeaturedVideo> fetched = videoSource.fetchPlaylistVideos();
        if (fetched.isEmpty()) {
            int kept = poolPort.count();
            LOGGER.warn("Video source returned no videos, keeping existing pool size={}", kept);
            return new PoolResult(kept);
        }

        return transactionTemplate.execute(status -> storePool(fetched));
    }

    /**
     * Empties the pool.
     */
    @Transactional
    public void clearPool() {
        poolPort.clear();
        LOGGER.info("Cleared featured video pool");
    }

    private PoolResult storePool(List<FeaturedVideo> videos) {
        poolPort.replaceAll(List.copyOf(videos));
        LOGGER.info("Replaced featured video pool size={} leading={}", videos.size(),
                videos.isEmpty() ? null : videos.get(0).getVideoId());
        return new PoolResult(videos.size());
    }

    private void validateCount(int count) {
        if (count < 1 || count > maxCount) {
            throw new InvalidSelectionException("Count must be between 1 and " + maxCount);
        }
    }
}
