package com.williamcallahan.media_recommendation_engine.service.client;

import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException;
import com.williamcallahan.media_recommendation_engine.model.DiscoveryCandidate;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.service.client.DiscoveryApiClient.DiscoveryFilter;
import com.williamcallahan.media_recommendation_engine.testutil.StubExchange;
import com.williamcallahan.media_recommendation_engine.util.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TmdbDiscoveryApiClientTest {

    private static final String KEY = "tmdb-test-key";

    private StubExchange exchange;
    private RecommendationProperties properties;

    @BeforeEach
    void setUp() {
        exchange = new StubExchange();
        properties = new RecommendationProperties();
        properties.getUpstream().getDiscovery().setBaseUrl("https://tmdb.test/3");
        properties.getUpstream().getDiscovery().setApiKey("server-key");
    }

    @Test
    void resolveId_imdbId_usesFindEndpoint() {
        exchange.respondJson("{\"movie_results\":[{\"id\":603,\"title\":\"The Matrix\"}],\"tv_results\":[]}");

        StepVerifier.create(client(RetryPolicy.noRetry()).resolveId(MediaType.MOVIE, "tt0133093", KEY))
            .expectNext("603")
            .verifyComplete();

        URI uri = exchange.lastRequest().url();
        assertThat(uri.getPath()).isEqualTo("/3/find/tt0133093");
        assertThat(uri.getQuery()).contains("external_source=imdb_id").contains("api_key=" + KEY);
    }

    @Test
    void resolveId_discoveryIdIsReturnedWithoutCall() {
        StepVerifier.create(client(RetryPolicy.noRetry()).resolveId(MediaType.MOVIE, "603", KEY))
            .expectNext("603")
            .verifyComplete();

        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    void resolveId_unknownSeries_isEmpty() {
        exchange.respondJson("{\"movie_results\":[],\"tv_results\":[]}");

        StepVerifier.create(client(RetryPolicy.noRetry()).resolveId(MediaType.SERIES, "tt9999999", KEY))
            .verifyComplete();
    }

    @Test
    void fetchKeywords_readsTheFieldForEachMediaType() {
        exchange.respondJson("{\"id\":603,\"keywords\":[{\"id\":310,\"name\":\"artificial intelligence\"},{\"id\":4565}]}")
            .respondJson("{\"id\":1396,\"results\":[{\"id\":10123}]}");
        TmdbDiscoveryApiClient client = client(RetryPolicy.noRetry());

        StepVerifier.create(client.fetchKeywords(MediaType.MOVIE, "603", KEY))
            .expectNext(List.of(310L, 4565L))
            .verifyComplete();
        StepVerifier.create(client.fetchKeywords(MediaType.SERIES, "1396", KEY))
            .expectNext(List.of(10123L))
            .verifyComplete();

        assertThat(exchange.requests().get(1).url().getPath()).isEqualTo("/3/tv/1396/keywords");
    }

    @Test
    void discoverByKeywords_sendsVoteBandAndParsesCandidates() {
        exchange.respondJson("""
            {"page":1,"results":[
              {"id":604,"title":"The Matrix Reloaded","vote_average":7.2,"vote_count":4000,
               "poster_path":"/reloaded.jpg","backdrop_path":null,"overview":"","release_date":"2003-05-15"},
              {"title":"missing id"}
            ]}
            """);

        StepVerifier.create(client(RetryPolicy.noRetry())
                .discoverByKeywords(MediaType.MOVIE, List.of(310L, 4565L), new DiscoveryFilter(50, 5000, 7.0), KEY))
            .assertNext(candidates -> {
                assertThat(candidates).singleElement().satisfies(candidate -> {
                    assertThat(candidate.externalId()).isEqualTo("604");
                    assertThat(candidate.voteCount()).isEqualTo(4000);
                    assertThat(candidate.rawRating()).isEqualTo(7.2);
                    assertThat(candidate.keywordSet()).containsExactlyInAnyOrder(310L, 4565L);
                    assertThat(candidate.posterPath()).isEqualTo("/reloaded.jpg");
                    assertThat(candidate.backdropPath()).isNull();
                    assertThat(candidate.overview()).isNull();
                    assertThat(candidate.releaseDate()).isEqualTo("2003-05-15");
                });
            })
            .verifyComplete();

        String query = exchange.lastRequest().url().getQuery();
        assertThat(query).contains("with_keywords=310|4565")
            .contains("vote_count.gte=50")
            .contains("vote_count.lte=5000")
            .contains("vote_average.gte=7.0");
    }

    @Test
    void discoverByKeywords_noKeywords_makesNoCall() {
        StepVerifier.create(client(RetryPolicy.noRetry())
                .discoverByKeywords(MediaType.MOVIE, List.of(), new DiscoveryFilter(50, 5000, 7.0), KEY))
            .expectNext(List.of())
            .verifyComplete();

        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    void fetchSimilar_seriesUseNameAndFirstAirDate() {
        exchange.respondJson("{\"results\":[{\"id\":1399,\"name\":\"Game of Thrones\",\"vote_average\":8.4,"
            + "\"vote_count\":21000,\"first_air_date\":\"2011-04-17\"}]}");

        StepVerifier.create(client(RetryPolicy.noRetry()).fetchSimilar(MediaType.SERIES, "1396", KEY))
            .assertNext(candidates -> {
                assertThat(candidates).extracting(DiscoveryCandidate::title).containsExactly("Game of Thrones");
                assertThat(candidates.get(0).releaseDate()).isEqualTo("2011-04-17");
                assertThat(candidates.get(0).keywordSet()).isEmpty();
            })
            .verifyComplete();

        assertThat(exchange.lastRequest().url().getPath()).isEqualTo("/3/tv/1396/recommendations");
    }

    @Test
    void fetchSimilar_notFound_yieldsEmptyList() {
        exchange.respond(HttpStatus.NOT_FOUND, "{\"status_code\":34}");

        StepVerifier.create(client(RetryPolicy.noRetry()).fetchSimilar(MediaType.MOVIE, "999999", KEY))
            .expectNext(List.of())
            .verifyComplete();
    }

    @Test
    void fetchExternalId_returnsImdbIdOrNothing() {
        exchange.respondJson("{\"id\":604,\"imdb_id\":\"tt0234215\"}")
            .respondJson("{\"id\":605,\"imdb_id\":null}");
        TmdbDiscoveryApiClient client = client(RetryPolicy.noRetry());

        StepVerifier.create(client.fetchExternalId(MediaType.MOVIE, "604", KEY))
            .expectNext("tt0234215")
            .verifyComplete();
        StepVerifier.create(client.fetchExternalId(MediaType.MOVIE, "605", KEY))
            .verifyComplete();
    }

    @Test
    void serverErrors_areRetriedThenReportedAsUnavailable() {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 0.0);

        StepVerifier.create(client(policy).fetchPopular(MediaType.MOVIE, KEY))
            .expectError(UpstreamUnavailableException.class)
            .verify(Duration.ofSeconds(5));

        assertThat(exchange.requests()).hasSize(3);
    }

    @Test
    void rateLimitResponse_isNotRetried() {
        exchange.respond(HttpStatus.TOO_MANY_REQUESTS, "{}");
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 0.0);

        StepVerifier.create(client(policy).fetchPopular(MediaType.MOVIE, KEY))
            .expectError(UpstreamUnavailableException.class)
            .verify(Duration.ofSeconds(5));

        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void missingUserKey_fallsBackToServerKey() {
        exchange.respondJson("{\"results\":[]}");
        TmdbDiscoveryApiClient client = client(RetryPolicy.noRetry());

        assertThat(client.isConfigured(null)).isTrue();
        client.fetchPopular(MediaType.MOVIE, null).block();

        assertThat(exchange.lastRequest().url().getQuery()).contains("api_key=server-key");
    }

    private TmdbDiscoveryApiClient client(RetryPolicy policy) {
        return new TmdbDiscoveryApiClient(exchange.builder(), properties, policy,
            new MetricsService(new SimpleMeterRegistry()));
    }
}
