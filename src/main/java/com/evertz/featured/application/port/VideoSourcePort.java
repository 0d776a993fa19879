package com.evertz.featured.application.port;

import com.evertz.featured.core.model.FeaturedVideo;

import java.util.List;

/**
 * External source of candidate videos, such as a YouTube playlist.
 */
public interface VideoSourcePort {

    /**
     * Fetches the current playlist, newest video first.
     *
     * @return the fetched videos, possibly empty
     * @throws com.evertz.featured.core.exception.VideoSourceException if the source cannot be read
     */
    List<FeaturedVideo> fetchPlaylistVideos();
}
