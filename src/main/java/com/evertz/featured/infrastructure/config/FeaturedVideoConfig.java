package com.evertz.featured.infrastructure.config;

import com.evertz.featured.application.port.VideoSourcePort;
import com.evertz.featured.core.selection.RandomSource;
import com.evertz.featured.core.selection.SeededRandomSource;
import com.evertz.featured.core.selection.ThreadLocalRandomSource;
import com.evertz.featured.infrastructure.youtube.YoutubePlaylistClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the random source and the optional YouTube playlist source.
 */
@Configuration
@EnableConfigurationProperties(FeaturedVideoProperties.class)
public class FeaturedVideoConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeaturedVideoConfig.class);

    @Bean
    public RandomSource featuredVideoRandomSource(FeaturedVideoProperties properties) {
        Long seed = properties.getRandomSeed();
        if (seed != null) {
            LOGGER.warn("Featured video selection uses a fixed random seed={}", seed);
            return new SeededRandomSource(seed);
        }
        return new ThreadLocalRandomSource();
    }

    @Bean
    @ConditionalOnProperty(prefix = "featured-videos.youtube", name = "enabled", havingValue = "true")
    public VideoSourcePort youtubePlaylistClient(RestTemplateBuilder restTemplateBuilder,
                                                 FeaturedVideoProperties properties) {
        LOGGER.info("YouTube playlist source enabled playlistId={}", properties.getYoutube().getPlaylistId());
        return new YoutubePlaylistClient(
                restTemplateBuilder
                        .setConnectTimeout(Duration.ofSeconds(5))
                        .setReadTimeout(Duration.ofSeconds(15))
                        .build(),
                properties.getYoutube());
    }
}
