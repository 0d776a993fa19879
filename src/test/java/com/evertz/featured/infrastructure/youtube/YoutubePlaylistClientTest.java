package com.evertz.featured.infrastructure.youtube;

import com.evertz.featured.core.exception.VideoSourceException;
import com.evertz.featured.core.model.FeaturedVideo;
import com.evertz.featured.infrastructure.config.FeaturedVideoProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.http.HttpMethod.GET;

class YoutubePlaylistClientTest {

    private static final String BASE_URL = "https://youtube.test/v3";

    private MockRestServiceServer server;
    private FeaturedVideoProperties.Youtube settings;
    private YoutubePlaylistClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        settings = new FeaturedVideoProperties().getYoutube();
        settings.setApiKey("test-key");
        settings.setPlaylistId("PL123");
        settings.setBaseUrl(BASE_URL);
        settings.setMaxPages(3);
        client = new YoutubePlaylistClient(restTemplate, settings);
    }

    private static String item(String videoId, String publishedAt, String title) {
        return String.format("{\"kind\": \"youtube#playlistItem\", \"snippet\": {"
                        + "\"publishedAt\": \"%s\", \"title\": \"%s\", \"description\": \"About %s\", "
                        + "\"thumbnails\": {\"default\": {\"url\": \"https://i.ytimg.com/%s/default.jpg\"}, "
                        + "\"high\": {\"url\": \"https://i.ytimg.com/%s/hqdefault.jpg\"}}, "
                        + "\"resourceId\": {\"kind\": \"youtube#video\", \"videoId\": \"%s\"}}}",
                publishedAt, title, title, videoId, videoId, videoId);
    }

    private static String page(String nextPageToken, String... items) {
        String token = nextPageToken == null ? "" : "\"nextPageToken\": \"" + nextPageToken + "\",";
        return "{" + token + "\"items\": [" + String.join(",", items) + "]}";
    }

    @Test
    void fetchesAllPagesAndSortsNewestFirst() {
        server.expect(requestTo(startsWith(BASE_URL + "/playlistItems")))
                .andExpect(method(GET))
                .andExpect(queryParam("playlistId", "PL123"))
                .andExpect(queryParam("key", "test-key"))
                .andExpect(queryParam("part", "snippet"))
                .andRespond(withSuccess(page("NEXT",
                        item("old", "2021-01-04T10:00:00Z", "Package A"),
                        item("new", "2021-03-01T10:00:00Z", "Package B")), MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE_URL + "/playlistItems")))
                .andExpect(queryParam("pageToken", "NEXT"))
                .andRespond(withSuccess(page(null,
                        item("mid", "2021-02-01T10:00:00Z", "Package C")), MediaType.APPLICATION_JSON));

        List<FeaturedVideo> videos = client.fetchPlaylistVideos();

        server.verify();
        assertThat(videos).extracting(FeaturedVideo::getVideoId).containsExactly("new", "mid", "old");
        FeaturedVideo newest = videos.get(0);
        assertThat(newest.getTitle()).isEqualTo("Package B");
        assertThat(newest.getDescription()).isEqualTo("About Package B");
        assertThat(newest.getThumbnailUrl()).isEqualTo("https://i.ytimg.com/new/hqdefault.jpg");
        assertThat(newest.getVideoUrl()).isEqualTo("https://youtube.com/watch?v=new");
    }

    @Test
    void stopsAtConfiguredPageLimit() {
        settings.setMaxPages(1);
        server.expect(requestTo(startsWith(BASE_URL + "/playlistItems")))
                .andRespond(withSuccess(page("MORE",
                        item("a", "2021-01-01T00:00:00Z", "A")), MediaType.APPLICATION_JSON));

        List<FeaturedVideo> videos = client.fetchPlaylistVideos();

        server.verify();
        assertThat(videos).extracting(FeaturedVideo::getVideoId).containsExactly("a");
    }

    @Test
    void dropsItemsWithoutVideoIdAndDuplicates() {
        String noVideoId = "{\"snippet\": {\"title\": \"Deleted video\", \"resourceId\": {}}}";
        server.expect(requestTo(startsWith(BASE_URL + "/playlistItems")))
                .andRespond(withSuccess(page(null,
                        item("dup", "2021-02-01T00:00:00Z", "First"),
                        noVideoId,
                        item("dup", "2021-03-01T00:00:00Z", "Second")), MediaType.APPLICATION_JSON));

        List<FeaturedVideo> videos = client.fetchPlaylistVideos();

        assertThat(videos).hasSize(1);
        assertThat(videos.get(0).getTitle()).isEqualTo("First");
    }

    @Test
    void serverErrorBecomesVideoSourceException() {
        server.expect(requestTo(startsWith(BASE_URL + "/playlistItems")))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.fetchPlaylistVideos())
                .isInstanceOf(VideoSourceException.class)
                .hasMessageContaining("PL123");
    }

    @Test
    void missingApiKeyIsRejectedWithoutCallingYoutube() {
        settings.setApiKey(" ");

        assertThatThrownBy(() -> client.fetchPlaylistVideos())
                .isInstanceOf(VideoSourceException.class);
        server.verify();
    }

    @Test
    @EnabledIfEnvironmentVariable(named = "YOUTUBE_API_KEY", matches = ".+")
    @EnabledIfEnvironmentVariable(named = "YOUTUBE_PLAYLIST_ID", matches = ".+")
    void liveKeyReturnsPlaylistItems() {
        settings.setApiKey(System.getenv("YOUTUBE_API_KEY"));
        settings.setPlaylistId(System.getenv("YOUTUBE_PLAYLIST_ID"));
        settings.setBaseUrl("https://www.googleapis.com/youtube/v3");
        YoutubePlaylistClient liveClient = new YoutubePlaylistClient(new RestTemplate(), settings);

        assertThat(liveClient.fetchPlaylistVideos()).hasSizeGreaterThan(5);
    }
}
