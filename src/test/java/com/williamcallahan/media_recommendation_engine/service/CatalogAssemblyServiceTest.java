package com.williamcallahan.media_recommendation_engine.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.dto.CatalogItem;
import com.williamcallahan.media_recommendation_engine.dto.CatalogRow;
import com.williamcallahan.media_recommendation_engine.exception.InvalidUserConfigException;
import com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException;
import com.williamcallahan.media_recommendation_engine.mapper.CatalogItemMapper;
import com.williamcallahan.media_recommendation_engine.model.LibraryItem;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import com.williamcallahan.media_recommendation_engine.model.RatingLookup;
import com.williamcallahan.media_recommendation_engine.model.UserConfig;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.service.cache.InMemoryCacheStore;
import com.williamcallahan.media_recommendation_engine.service.cache.RecommendationCacheManager;
import com.williamcallahan.media_recommendation_engine.service.client.DiscoveryApiClient;
import com.williamcallahan.media_recommendation_engine.service.client.LibraryApiClient;
import com.williamcallahan.media_recommendation_engine.service.client.RatingApiClient;
import com.williamcallahan.media_recommendation_engine.testutil.RecommendationFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.williamcallahan.media_recommendation_engine.testutil.RecommendationFixtures.AUTH_KEY;
import static com.williamcallahan.media_recommendation_engine.testutil.RecommendationFixtures.DISCOVERY_KEY;
import static com.williamcallahan.media_recommendation_engine.testutil.RecommendationFixtures.RATING_KEY;
import static com.williamcallahan.media_recommendation_engine.testutil.RecommendationFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CatalogAssemblyServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private LibraryApiClient libraryApiClient;
    private DiscoveryApiClient discoveryApiClient;
    private RatingApiClient ratingApiClient;
    private RecommendationProperties properties;
    private ActiveUserRegistry activeUserRegistry;
    private CatalogAssemblyService assemblyService;

    @BeforeEach
    void setUp() {
        libraryApiClient = mock(LibraryApiClient.class);
        discoveryApiClient = mock(DiscoveryApiClient.class);
        ratingApiClient = mock(RatingApiClient.class);
        properties = new RecommendationProperties();
        properties.getUpstream().getDiscovery().setApiKey(DISCOVERY_KEY);
        properties.getUpstream().getRating().setApiKey(RATING_KEY);

        when(libraryApiClient.fetchLibrary(AUTH_KEY)).thenReturn(Mono.just(List.of(
            new LibraryItem("tt0133093", MediaType.MOVIE, "The Matrix", NOW.minusSeconds(7200), true, true),
            new LibraryItem("tt1375666", MediaType.MOVIE, "Inception", NOW.minusSeconds(3600), false, true))));

        when(discoveryApiClient.resolveId(MediaType.MOVIE, "tt0133093", DISCOVERY_KEY)).thenReturn(Mono.just("603"));
        when(discoveryApiClient.resolveId(MediaType.MOVIE, "tt1375666", DISCOVERY_KEY)).thenReturn(Mono.just("27205"));
        when(discoveryApiClient.fetchKeywords(MediaType.MOVIE, "603", DISCOVERY_KEY)).thenReturn(Mono.just(List.of(310L)));
        when(discoveryApiClient.fetchKeywords(MediaType.MOVIE, "27205", DISCOVERY_KEY)).thenReturn(Mono.just(List.of()));
        when(discoveryApiClient.discoverByKeywords(eq(MediaType.MOVIE), anyList(), any(), eq(DISCOVERY_KEY)))
            .thenReturn(Mono.just(List.of(
                candidate("604", "The Matrix Reloaded", 7.2, 4000),
                candidate("605", "The Matrix Revolutions", 6.8, 3500))));
        when(discoveryApiClient.fetchSimilar(MediaType.MOVIE, "27205", DISCOVERY_KEY))
            .thenReturn(Mono.just(List.of(
                candidate("157336", "Interstellar", 8.4, 30000),
                candidate("604", "The Matrix Reloaded", 7.2, 4000))));
        when(discoveryApiClient.fetchExternalId(any(), anyString(), anyString()))
            .thenAnswer(invocation -> Mono.just("tt" + invocation.getArgument(1, String.class)));

        when(ratingApiClient.isConfigured(anyString())).thenReturn(true);
        when(ratingApiClient.fetchRating(any(), anyString(), anyString()))
            .thenAnswer(invocation -> {
                String id = invocation.getArgument(1, String.class);
                return Mono.just(new RatingLookup(id, 8.0, "tt" + id));
            });

        assemblyService = newAssemblyService();
    }

    @Test
    void assemble_buildsOneRowPerSeedInSeedOrder() {
        UserConfig config = RecommendationFixtures.userConfig().toBuilder().includeSeries(false).build();

        List<CatalogRow> rows = assemblyService.assemble(config).block();

        assertThat(rows).extracting(CatalogRow::id).containsExactly("dynamic_movie_0", "dynamic_movie_1");
        assertThat(rows).extracting(CatalogRow::name)
            .containsExactly("Because you loved The Matrix", "Because you watched Inception");
        assertThat(rows.get(0).items()).extracting(CatalogItem::id).containsExactly("tt604", "tt605");
        assertThat(rows.get(1).items()).extracting(CatalogItem::id).containsExactly("tt604", "tt157336");
        CatalogItem reloaded = rows.get(0).items().get(0);
        assertThat(reloaded.type()).isEqualTo("movie");
        assertThat(reloaded.imdbRating()).isEqualTo("8.0");
        assertThat(reloaded.poster()).isEqualTo("https://image.tmdb.org/t/p/w500/604.jpg");
        assertThat(reloaded.releaseInfo()).isEqualTo("2019");
        assertThat(activeUserRegistry.size()).isEqualTo(1);
    }

    @Test
    void assemble_respectsRequestedRowCount() {
        UserConfig config = RecommendationFixtures.userConfig().toBuilder().numRows(1).includeSeries(false).build();

        StepVerifier.create(assemblyService.assemble(config))
            .assertNext(rows -> assertThat(rows).extracting(CatalogRow::name)
                .containsExactly("Because you loved The Matrix"))
            .verifyComplete();
    }

    @Test
    void assemble_omitsRowsWhoseSeedProducedNothing() {
        when(discoveryApiClient.fetchSimilar(MediaType.MOVIE, "27205", DISCOVERY_KEY)).thenReturn(Mono.just(List.of()));
        UserConfig config = RecommendationFixtures.userConfig().toBuilder().includeSeries(false).build();

        StepVerifier.create(assemblyService.assemble(config))
            .assertNext(rows -> assertThat(rows).extracting(CatalogRow::id).containsExactly("dynamic_movie_0"))
            .verifyComplete();
    }

    @Test
    void assemble_ratingServiceDown_persistsCatalogWithShortTtl() {
        when(ratingApiClient.fetchRating(any(), anyString(), anyString()))
            .thenReturn(Mono.error(new UpstreamUnavailableException("MDBList", "rating", "503 after 3 attempts")));
        UserConfig config = RecommendationFixtures.userConfig();

        List<CatalogRow> rows = assemblyService.assemble(config, MediaType.MOVIE).block();

        assertThat(rows).isNotEmpty();
        assertThat(rows.get(0).items()).extracting(CatalogItem::imdbRating).containsExactly("7.2", "6.8");
        StepVerifier.create(assemblyService.catalogFreshness(config, MediaType.MOVIE))
            .expectNext(Duration.ofMinutes(15))
            .verifyComplete();
    }

    @Test
    void assemble_healthyRequest_persistsCatalogWithRegularTtl() {
        UserConfig config = RecommendationFixtures.userConfig();

        assemblyService.assemble(config, MediaType.MOVIE).block();

        StepVerifier.create(assemblyService.catalogFreshness(config, MediaType.MOVIE))
            .expectNext(Duration.ofHours(1))
            .verifyComplete();
    }

    @Test
    void assemble_seedStillRunningAtDeadline_isSkippedAndCatalogKeptBriefly() {
        properties.getSeeds().setRequestDeadline(Duration.ofMillis(200));
        assemblyService = newAssemblyService();
        when(discoveryApiClient.fetchSimilar(MediaType.MOVIE, "27205", DISCOVERY_KEY)).thenReturn(Mono.never());
        UserConfig config = RecommendationFixtures.userConfig();

        StepVerifier.create(assemblyService.assemble(config, MediaType.MOVIE))
            .assertNext(rows -> assertThat(rows).extracting(CatalogRow::name)
                .containsExactly("Because you loved The Matrix"))
            .verifyComplete();
        StepVerifier.create(assemblyService.catalogFreshness(config, MediaType.MOVIE))
            .expectNext(Duration.ofMinutes(15))
            .verifyComplete();
    }

    @Test
    void assemble_degradedSeedResultFromEarlierRequest_doesNotDegradeNextUser() {
        properties.getDiscovery().setMaxConcurrency(1);
        assemblyService = newAssemblyService();
        when(ratingApiClient.fetchRating(any(), anyString(), anyString()))
            .thenReturn(Mono.error(new UpstreamUnavailableException("MDBList", "rating", "503 after 3 attempts")));
        assemblyService.assemble(RecommendationFixtures.userConfig(), MediaType.MOVIE).block();

        when(ratingApiClient.fetchRating(any(), anyString(), anyString()))
            .thenAnswer(invocation -> {
                String id = invocation.getArgument(1, String.class);
                return Mono.just(new RatingLookup(id, 8.0, "tt" + id));
            });
        when(libraryApiClient.fetchLibrary("second-user-key")).thenReturn(Mono.just(List.of(
            new LibraryItem("tt0133093", MediaType.MOVIE, "The Matrix", NOW.minusSeconds(600), true, true),
            new LibraryItem("tt0000999", MediaType.MOVIE, "Primer", NOW.minusSeconds(1200), false, true))));
        when(discoveryApiClient.resolveId(MediaType.MOVIE, "tt0000999", DISCOVERY_KEY)).thenReturn(Mono.just("999"));
        when(discoveryApiClient.fetchKeywords(MediaType.MOVIE, "999", DISCOVERY_KEY)).thenReturn(Mono.just(List.of()));
        when(discoveryApiClient.fetchSimilar(MediaType.MOVIE, "999", DISCOVERY_KEY))
            .thenReturn(Mono.just(List.of(candidate("1001", "Upstream Color", 7.5, 800))));
        UserConfig secondUser = RecommendationFixtures.userConfig().toBuilder().libraryAuthKey("second-user-key").build();

        List<CatalogRow> rows = assemblyService.assemble(secondUser, MediaType.MOVIE).block();

        assertThat(rows).extracting(CatalogRow::name)
            .containsExactly("Because you loved The Matrix", "Because you watched Primer");
        assertThat(rows.get(1).items()).extracting(CatalogItem::imdbRating).containsExactly("8.0");
        verify(ratingApiClient).fetchRating(MediaType.MOVIE, "1001", RATING_KEY);
        // the reused degraded row still keeps this user's catalog short-lived
        StepVerifier.create(assemblyService.catalogFreshness(secondUser, MediaType.MOVIE))
            .expectNext(Duration.ofMinutes(15))
            .verifyComplete();
    }

    @Test
    void assemble_libraryDownWithoutSnapshot_keepsPopularFallbackBriefly() {
        when(libraryApiClient.fetchLibrary(AUTH_KEY))
            .thenReturn(Mono.error(new UpstreamUnavailableException("Stremio", "library", "HTTP 502")));
        when(discoveryApiClient.fetchPopular(MediaType.MOVIE, DISCOVERY_KEY))
            .thenReturn(Mono.just(List.of(candidate("680", "Pulp Fiction", 8.5, 20000))));
        UserConfig config = RecommendationFixtures.userConfig();

        StepVerifier.create(assemblyService.assemble(config, MediaType.MOVIE))
            .assertNext(rows -> assertThat(rows).extracting(CatalogRow::id).containsExactly("popular_movie"))
            .verifyComplete();
        StepVerifier.create(assemblyService.catalogFreshness(config, MediaType.MOVIE))
            .expectNext(Duration.ofMinutes(15))
            .verifyComplete();
    }

    @Test
    void assemble_discoveryFailureForOneSeed_dropsItsRowAndKeepsCatalogBriefly() {
        when(discoveryApiClient.fetchSimilar(MediaType.MOVIE, "27205", DISCOVERY_KEY))
            .thenReturn(Mono.error(new UpstreamUnavailableException("TMDB", "recommendations", "HTTP 503")));
        UserConfig config = RecommendationFixtures.userConfig();

        StepVerifier.create(assemblyService.assemble(config, MediaType.MOVIE))
            .assertNext(rows -> assertThat(rows).extracting(CatalogRow::name)
                .containsExactly("Because you loved The Matrix"))
            .verifyComplete();
        StepVerifier.create(assemblyService.catalogFreshness(config, MediaType.MOVIE))
            .expectNext(Duration.ofMinutes(15))
            .verifyComplete();
    }

    @Test
    void assemble_addingRatingKey_doesNotServeUnratedCatalog() {
        properties.getUpstream().getRating().setApiKey(null);
        assemblyService = newAssemblyService();
        UserConfig unrated = RecommendationFixtures.userConfig();

        List<CatalogRow> before = assemblyService.assemble(unrated, MediaType.MOVIE).block();
        List<CatalogRow> after = assemblyService
            .assemble(unrated.toBuilder().ratingApiKey("user-mdblist").build(), MediaType.MOVIE).block();

        assertThat(before.get(0).items().get(0).imdbRating()).isEqualTo("7.2");
        assertThat(after.get(0).items().get(0).imdbRating()).isEqualTo("8.0");
        verify(ratingApiClient, atLeastOnce()).fetchRating(MediaType.MOVIE, "604", "user-mdblist");
    }

    @Test
    void assemble_noSeeds_fallsBackToPopularRow() {
        when(libraryApiClient.fetchLibrary(AUTH_KEY)).thenReturn(Mono.just(List.of()));
        when(discoveryApiClient.fetchPopular(MediaType.SERIES, DISCOVERY_KEY))
            .thenReturn(Mono.just(List.of(candidate("1396", "Breaking Bad", 8.9, 14000))));
        UserConfig config = RecommendationFixtures.userConfig().toBuilder().includeMovies(false).build();

        StepVerifier.create(assemblyService.assemble(config))
            .assertNext(rows -> {
                assertThat(rows).hasSize(1);
                assertThat(rows.get(0).id()).isEqualTo("popular_series");
                assertThat(rows.get(0).name()).isEqualTo("Popular Series");
                assertThat(rows.get(0).items()).extracting(CatalogItem::id).containsExactly("tt1396");
            })
            .verifyComplete();
    }

    @Test
    void assemble_blankLibraryCredential_failsWithoutTouchingUpstreams() {
        UserConfig config = RecommendationFixtures.userConfig().toBuilder().libraryAuthKey(" ").build();

        StepVerifier.create(assemblyService.assemble(config))
            .expectError(InvalidUserConfigException.class)
            .verify();

        verifyNoInteractions(libraryApiClient, discoveryApiClient, ratingApiClient);
        assertThat(activeUserRegistry.size()).isZero();
    }

    @Test
    void assemble_invalidPreferences_areRejected() {
        UserConfig base = RecommendationFixtures.userConfig();

        StepVerifier.create(assemblyService.assemble(base.toBuilder().numRows(0).build()))
            .expectError(InvalidUserConfigException.class)
            .verify();
        StepVerifier.create(assemblyService.assemble(base.toBuilder().numRows(21).build()))
            .expectError(InvalidUserConfigException.class)
            .verify();
        StepVerifier.create(assemblyService.assemble(base.toBuilder().minRating(10.5).build()))
            .expectError(InvalidUserConfigException.class)
            .verify();
        StepVerifier.create(assemblyService.assemble(base.toBuilder().includeMovies(false).includeSeries(false).build()))
            .expectError(InvalidUserConfigException.class)
            .verify();
    }

    @Test
    void assemble_noDiscoveryKeyAnywhere_isConfigError() {
        properties.getUpstream().getDiscovery().setApiKey(null);
        assemblyService = newAssemblyService();

        StepVerifier.create(assemblyService.assemble(RecommendationFixtures.userConfig()))
            .expectErrorMatches(e -> e instanceof InvalidUserConfigException
                && e.getMessage().contains("discovery"))
            .verify();
    }

    @Test
    void createContext_prefersUserKeysOverServerDefaults() {
        UserConfig config = RecommendationFixtures.userConfig().toBuilder()
            .discoveryApiKey("user-tmdb")
            .build();

        RequestContext context = assemblyService.createContext(config);

        assertThat(context.getDiscoveryApiKey()).isEqualTo("user-tmdb");
        assertThat(context.getRatingApiKey()).isEqualTo(RATING_KEY);
        assertThat(context.getDeadline()).isEqualTo(NOW.plus(properties.getSeeds().getRequestDeadline()));
        assertThat(context.getFingerprint()).hasSize(32).doesNotContain(AUTH_KEY);
    }

    private CatalogAssemblyService newAssemblyService() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry());
        RecommendationCacheManager cacheManager = new RecommendationCacheManager(new InMemoryCacheStore(1_000),
            RecommendationFixtures.objectMapper(), properties, metricsService, clock);
        activeUserRegistry = new ActiveUserRegistry(Caffeine.newBuilder().build(), metricsService);
        return new CatalogAssemblyService(
            new SeedCollectorService(libraryApiClient, cacheManager),
            new DiscoveryService(discoveryApiClient, properties, metricsService),
            new RatingEnrichmentService(ratingApiClient, discoveryApiClient, cacheManager, properties, metricsService),
            new CandidateScoringService(properties),
            discoveryApiClient,
            cacheManager,
            new CatalogItemMapper(properties),
            activeUserRegistry,
            properties,
            metricsService,
            clock);
    }
}
