package com.evertz.featured.application.port;

import com.evertz.featured.core.model.FeaturedVideo;

import java.util.List;

/**
 * Persistence interface for the featured video pool. Storage plugs into here for the actual implementation.
 * The pool is ordered: position 0 holds the newest video.
 */
public interface FeaturedVideoPoolPort {

    /**
     * Finds every video in the pool ordered by position.
     *
     * @return the pool, empty if nothing has been stored yet
     */
    List<FeaturedVideo> findAllOrderedByPosition();

    /**
     * Counts the videos in the pool.
     *
     * @return the pool size
     */
    int count();

    /**
     * Replaces the whole pool. Callers run this inside a transaction so that readers
     * observe either the previous pool or the new one, never a mix.
     *
     * @param videos the new pool in position order
     */
    void replaceAll(List<FeaturedVideo> videos);

    /**
     * Removes every video from the pool.
     */
    void clear();
}
