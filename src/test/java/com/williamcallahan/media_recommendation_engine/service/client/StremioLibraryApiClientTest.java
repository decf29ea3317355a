package com.williamcallahan.media_recommendation_engine.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException;
import com.williamcallahan.media_recommendation_engine.model.LibraryItem;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.testutil.StubExchange;
import com.williamcallahan.media_recommendation_engine.util.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class StremioLibraryApiClientTest {

    private StubExchange exchange;
    private StremioLibraryApiClient client;

    @BeforeEach
    void setUp() {
        exchange = new StubExchange();
        RecommendationProperties properties = new RecommendationProperties();
        properties.getUpstream().getLibrary().setBaseUrl("https://library.test/api");
        client = new StremioLibraryApiClient(exchange.builder(), properties, RetryPolicy.noRetry(),
            new MetricsService(new SimpleMeterRegistry()));
    }

    @Test
    void fetchLibrary_keepsMoviesAndSeriesWithImdbIds() {
        exchange.respondJson("""
            {"result":[
              {"_id":"tt0133093","type":"movie","name":"The Matrix","loved":true,
               "state":{"lastWatched":"2024-02-01T20:00:00Z","timesWatched":2}},
              {"_id":"tt0903747","type":"series","name":"Breaking Bad","state":{"flaggedWatched":1}},
              {"_id":"kitsu:1","type":"series","name":"Not an imdb id"},
              {"_id":"tt0000001","type":"movie","name":"Removed","removed":true},
              {"_id":"tt0000002","type":"channel","name":"Channel"}
            ]}
            """);

        StepVerifier.create(client.fetchLibrary("auth"))
            .assertNext(library -> {
                assertThat(library).extracting(LibraryItem::externalId).containsExactly("tt0133093", "tt0903747");
                LibraryItem matrix = library.get(0);
                assertThat(matrix.loved()).isTrue();
                assertThat(matrix.watched()).isTrue();
                assertThat(matrix.lastWatched()).isEqualTo(Instant.parse("2024-02-01T20:00:00Z"));
                LibraryItem breakingBad = library.get(1);
                assertThat(breakingBad.mediaType()).isEqualTo(MediaType.SERIES);
                assertThat(breakingBad.loved()).isFalse();
                assertThat(breakingBad.watched()).isTrue();
                assertThat(breakingBad.lastWatched()).isNull();
            })
            .verifyComplete();

        assertThat(exchange.lastRequest().method()).isEqualTo(HttpMethod.POST);
        assertThat(exchange.lastRequest().url().getPath()).isEqualTo("/api/datastoreGet");
    }

    @Test
    void fetchLibrary_serviceError_isUnavailable() {
        exchange.respondJson("{\"error\":{\"message\":\"session does not exist\",\"code\":1}}");

        StepVerifier.create(client.fetchLibrary("expired"))
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("session does not exist"))
            .verify();
    }

    @Test
    void fetchLibrary_blankCredential_failsWithoutCall() {
        StepVerifier.create(client.fetchLibrary(" "))
            .expectError(IllegalArgumentException.class)
            .verify();

        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    void parseItem_unparseableTimestamp_isTreatedAsNeverWatched() throws Exception {
        JsonNode node = new ObjectMapper().readTree(
            "{\"_id\":\"tt1375666\",\"type\":\"movie\",\"name\":\"Inception\",\"state\":{\"lastWatched\":\"yesterday\"}}");

        assertThat(client.parseItem(node)).hasValueSatisfying(item -> {
            assertThat(item.lastWatched()).isNull();
            assertThat(item.watched()).isFalse();
            assertThat(item.title()).isEqualTo("Inception");
        });
    }
}
