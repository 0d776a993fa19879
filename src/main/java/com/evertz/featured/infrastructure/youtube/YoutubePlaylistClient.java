package com.evertz.featured.infrastructure.youtube;

import com.evertz.featured.application.port.VideoSourcePort;
import com.evertz.featured.core.exception.VideoSourceException;
import com.evertz.featured.core.model.FeaturedVideo;
import com.evertz.featured.infrastructure.config.FeaturedVideoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the featured playlist from the YouTube Data API.
 * Follows page tokens up to the configured page limit and returns the videos newest first.
 */
public class YoutubePlaylistClient implements VideoSourcePort {

    private static final Logger LOGGER = LoggerFactory.getLogger(YoutubePlaylistClient.class);
    private static final int PAGE_SIZE = 50;
    private static final List<String> THUMBNAIL_PREFERENCE = List.of("high", "medium", "default");

    private final RestTemplate restTemplate;
    private final FeaturedVideoProperties.Youtube settings;

    public YoutubePlaylistClient(RestTemplate restTemplate, FeaturedVideoProperties.Youtube settings) {
        this.restTemplate = restTemplate;
        this.settings = settings;
    }

    private record DatedVideo(FeaturedVideo video, Instant publishedAt) {}

    @Override
    public List<FeaturedVideo> fetchPlaylistVideos() {
        if (isBlank(settings.getApiKey()) || isBlank(settings.getPlaylistId())) {
            throw new VideoSourceException("YouTube api key and playlist id must be configured");
        }

        List<DatedVideo> collected = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        String pageToken = null;
        int pages = 0;

        do {
            PlaylistItemsPage page = fetchPage(pageToken);
            pages++;
            if (page == null) {
                break;
            }
            if (page.items() != null) {
                for (PlaylistItemsPage.Item item : page.items()) {
                    DatedVideo dated = toDatedVideo(item);
                    if (dated != null && seenIds.add(dated.video().getVideoId())) {
                        collected.add(dated);
                    }
                }
            }
            pageToken = page.nextPageToken();
        } while (!isBlank(pageToken) && pages < settings.getMaxPages());

        LOGGER.info("Fetched YouTube playlist playlistId={} pages={} videos={}",
                settings.getPlaylistId(), pages, collected.size());

        // List.sort is stable, so videos sharing a timestamp keep playlist order.
        collected.sort(Comparator.comparing(DatedVideo::publishedAt).reversed());
        return collected.stream().map(DatedVideo::video).toList();
    }

    private PlaylistItemsPage fetchPage(String pageToken) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                .path("/playlistItems")
                .queryParam("part", "snippet")
                .queryParam("maxResults", PAGE_SIZE)
                .queryParam("playlistId", settings.getPlaylistId())
                .queryParam("key", settings.getApiKey());
        if (pageToken != null) {
            builder.queryParam("pageToken", pageToken);
        }
        URI uri = builder.encode().build().toUri();

        try {
            return restTemplate.getForObject(uri, PlaylistItemsPage.class);
        } catch (RestClientException e) {
            throw new VideoSourceException("Failed to fetch YouTube playlist " + settings.getPlaylistId(), e);
        }
    }

    private DatedVideo toDatedVideo(PlaylistItemsPage.Item item) {
        PlaylistItemsPage.Snippet snippet = item == null ? null : item.snippet();
        if (snippet == null || snippet.resourceId() == null || isBlank(snippet.resourceId().videoId())) {
            return null;
        }

        FeaturedVideo video = new FeaturedVideo(
                snippet.resourceId().videoId(),
                snippet.title() == null ? "" : snippet.title(),
                snippet.description(),
                pickThumbnail(snippet.thumbnails())
        );
        return new DatedVideo(video, parsePublishedAt(snippet.publishedAt()));
    }

    private String pickThumbnail(Map<String, PlaylistItemsPage.Thumbnail> thumbnails) {
        if (thumbnails == null) {
            return null;
        }
        for (String key : THUMBNAIL_PREFERENCE) {
            PlaylistItemsPage.Thumbnail thumbnail = thumbnails.get(key);
            if (thumbnail != null && !isBlank(thumbnail.url())) {
                return thumbnail.url();
            }
        }
        return null;
    }

    private Instant parsePublishedAt(String publishedAt) {
        if (isBlank(publishedAt)) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(publishedAt);
        } catch (DateTimeParseException e) {
            LOGGER.debug("Unparseable publishedAt value={}", publishedAt);
            return Instant.EPOCH;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
