package com.evertz.featured.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the featured video rotation and its YouTube playlist source.
 */
@ConfigurationProperties(prefix = "featured-videos")
public class FeaturedVideoProperties {

    private int defaultCount = 4;
    private int maxCount = 50;
    /**
     * Fixed seed for reproducible selections; leave unset in production.
     */
    private Long randomSeed;
    private final Youtube youtube = new Youtube();

    public int getDefaultCount() {
        return defaultCount;
    }

    public void setDefaultCount(int defaultCount) {
        this.defaultCount = defaultCount;
    }

    public int getMaxCount() {
        return maxCount;
    }

    public void setMaxCount(int maxCount) {
        this.maxCount = maxCount;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public Youtube getYoutube() {
        return youtube;
    }

    public static class Youtube {
        private boolean enabled = false;
        private String apiKey;
        private String playlistId;
        private String baseUrl = "https://www.googleapis.com/youtube/v3";
        private int maxPages = 4;
        private Duration initialDelay = Duration.ofSeconds(10);
        private Duration refreshInterval = Duration.ofHours(6);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getPlaylistId() {
            return playlistId;
        }

        public void setPlaylistId(String playlistId) {
            this.playlistId = playlistId;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getRefreshInterval() {
            return refreshInterval;
        }

        public void setRefreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
        }
    }
}
