/**
 * Orchestrates the recommendation pipeline into catalog rows
 *
 * @author William Callahan
 *
 * Features:
 * - Validates the user configuration; invalid configurations fail fast without touching the cache
 * - Seeds, per-seed discovery and enrichment, scoring and presentation mapping per media type
 * - Every stage goes through the cache manager with its own artifact class
 * - Per-seed units run in parallel under a concurrency cap and the request's soft deadline
 * - One row per seed in seed order, empty rows omitted
 * - Popular row fallback when a media type yields no seed rows
 * - Registers successful users for background warming
 */
package com.williamcallahan.media_recommendation_engine.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.dto.CatalogItem;
import com.williamcallahan.media_recommendation_engine.dto.CatalogRow;
import com.williamcallahan.media_recommendation_engine.exception.InvalidUserConfigException;
import com.williamcallahan.media_recommendation_engine.mapper.CatalogItemMapper;
import com.williamcallahan.media_recommendation_engine.model.ArtifactClass;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import com.williamcallahan.media_recommendation_engine.model.ScoredCandidate;
import com.williamcallahan.media_recommendation_engine.model.SeedItem;
import com.williamcallahan.media_recommendation_engine.model.SeedRecommendations;
import com.williamcallahan.media_recommendation_engine.model.SeedResult;
import com.williamcallahan.media_recommendation_engine.model.UserConfig;
import com.williamcallahan.media_recommendation_engine.model.UserSeeds;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.service.cache.RecommendationCacheManager;
import com.williamcallahan.media_recommendation_engine.service.client.DiscoveryApiClient;
import com.williamcallahan.media_recommendation_engine.util.CacheKeyUtils;
import com.williamcallahan.media_recommendation_engine.util.ErrorHandlingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

@Service
public class CatalogAssemblyService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogAssemblyService.class);

    private static final TypeReference<List<CatalogRow>> CATALOG_TYPE = new TypeReference<>() {
    };

    static final String DYNAMIC_ROW_PREFIX = "dynamic_";
    static final String POPULAR_ROW_PREFIX = "popular_";

    private final SeedCollectorService seedCollectorService;
    private final DiscoveryService discoveryService;
    private final RatingEnrichmentService ratingEnrichmentService;
    private final CandidateScoringService candidateScoringService;
    private final DiscoveryApiClient discoveryApiClient;
    private final RecommendationCacheManager cacheManager;
    private final CatalogItemMapper catalogItemMapper;
    private final ActiveUserRegistry activeUserRegistry;
    private final RecommendationProperties properties;
    private final MetricsService metricsService;
    private final Clock clock;

    @Autowired
    public CatalogAssemblyService(SeedCollectorService seedCollectorService,
                                  DiscoveryService discoveryService,
                                  RatingEnrichmentService ratingEnrichmentService,
                                  CandidateScoringService candidateScoringService,
                                  DiscoveryApiClient discoveryApiClient,
                                  RecommendationCacheManager cacheManager,
                                  CatalogItemMapper catalogItemMapper,
                                  ActiveUserRegistry activeUserRegistry,
                                  RecommendationProperties properties,
                                  MetricsService metricsService) {
        this(seedCollectorService, discoveryService, ratingEnrichmentService, candidateScoringService,
            discoveryApiClient, cacheManager, catalogItemMapper, activeUserRegistry, properties, metricsService,
            Clock.systemUTC());
    }

    public CatalogAssemblyService(SeedCollectorService seedCollectorService,
                                  DiscoveryService discoveryService,
                                  RatingEnrichmentService ratingEnrichmentService,
                                  CandidateScoringService candidateScoringService,
                                  DiscoveryApiClient discoveryApiClient,
                                  RecommendationCacheManager cacheManager,
                                  CatalogItemMapper catalogItemMapper,
                                  ActiveUserRegistry activeUserRegistry,
                                  RecommendationProperties properties,
                                  MetricsService metricsService,
                                  Clock clock) {
        this.seedCollectorService = seedCollectorService;
        this.discoveryService = discoveryService;
        this.ratingEnrichmentService = ratingEnrichmentService;
        this.candidateScoringService = candidateScoringService;
        this.discoveryApiClient = discoveryApiClient;
        this.cacheManager = cacheManager;
        this.catalogItemMapper = catalogItemMapper;
        this.activeUserRegistry = activeUserRegistry;
        this.properties = properties;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Assembles the rows of every media type the user enabled, movies first
     *
     * @param config user configuration
     * @return rows of all enabled types; fails only with {@link InvalidUserConfigException}
     */
    public Mono<List<CatalogRow>> assemble(UserConfig config) {
        return Mono.fromCallable(() -> createContext(config))
            .flatMap(context -> Flux.fromIterable(config.enabledMediaTypes())
                .flatMapSequential(type -> catalogFor(type, context))
                .flatMapIterable(rows -> rows)
                .collectList()
                .doOnNext(rows -> onAssembled(context, rows)));
    }

    /**
     * Assembles the rows of one media type. A type the user disabled yields no rows.
     */
    public Mono<List<CatalogRow>> assemble(UserConfig config, MediaType mediaType) {
        return Mono.fromCallable(() -> createContext(config))
            .flatMap(context -> {
                if (!config.includes(mediaType)) {
                    return Mono.just(List.<CatalogRow>of());
                }
                return catalogFor(mediaType, context)
                    .doOnNext(rows -> onAssembled(context, rows));
            });
    }

    /**
     * Recomputes one media type's catalog for a previously active user, bypassing freshness
     */
    public Mono<List<CatalogRow>> refreshCatalog(UserConfig config, MediaType mediaType) {
        return Mono.fromCallable(() -> createContext(config))
            .flatMap(context -> cacheManager.refresh(catalogKey(context, mediaType), ArtifactClass.CATALOG_ROW,
                CATALOG_TYPE, () -> buildRows(mediaType, context), List.of(), context));
    }

    /**
     * Freshness left on a user's cached catalog; empty when nothing is cached
     */
    public Mono<Duration> catalogFreshness(UserConfig config, MediaType mediaType) {
        return Mono.fromCallable(() -> createContext(config))
            .flatMap(context -> cacheManager.remainingFreshness(catalogKey(context, mediaType), ArtifactClass.CATALOG_ROW));
    }

    /**
     * Validates the configuration and resolves the credentials for one request
     *
     * @throws InvalidUserConfigException when the configuration cannot produce a catalog
     */
    RequestContext createContext(UserConfig config) {
        if (config == null) {
            throw new InvalidUserConfigException("User configuration is required");
        }
        if (isBlank(config.getLibraryAuthKey())) {
            throw new InvalidUserConfigException("Library credential is missing");
        }
        if (config.getNumRows() < UserConfig.MIN_ROWS || config.getNumRows() > UserConfig.MAX_ROWS) {
            throw new InvalidUserConfigException("Row count must be between " + UserConfig.MIN_ROWS
                + " and " + UserConfig.MAX_ROWS + ", was " + config.getNumRows());
        }
        if (Double.isNaN(config.getMinRating()) || config.getMinRating() < 0.0 || config.getMinRating() > 10.0) {
            throw new InvalidUserConfigException("Minimum rating must be between 0 and 10, was " + config.getMinRating());
        }
        if (config.enabledMediaTypes().isEmpty()) {
            throw new InvalidUserConfigException("At least one of movies or series must be enabled");
        }
        String discoveryKey = firstNonBlank(config.getDiscoveryApiKey(),
            properties.getUpstream().getDiscovery().getApiKey());
        if (discoveryKey == null) {
            throw new InvalidUserConfigException("No discovery API key is available");
        }
        String ratingKey = firstNonBlank(config.getRatingApiKey(), properties.getUpstream().getRating().getApiKey());
        return new RequestContext(config, CacheKeyUtils.fingerprint(config.getLibraryAuthKey()),
            discoveryKey, ratingKey, clock.instant().plus(properties.getSeeds().getRequestDeadline()));
    }

    private Mono<List<CatalogRow>> catalogFor(MediaType mediaType, RequestContext context) {
        return cacheManager.getOrCompute(catalogKey(context, mediaType), ArtifactClass.CATALOG_ROW, CATALOG_TYPE,
            () -> buildRows(mediaType, context), List.of(), context);
    }

    private String catalogKey(RequestContext context, MediaType mediaType) {
        UserConfig config = context.getConfig();
        return cacheManager.key(ArtifactClass.CATALOG_ROW, context.getFingerprint(), mediaType,
            config.getNumRows(), config.getMinRating(), config.isUseLovedItems(), ratedSegment(context));
    }

    Mono<List<CatalogRow>> buildRows(MediaType mediaType, RequestContext context) {
        int maxSeeds = properties.getSeeds().getMaxSeeds();
        return withinDeadline(seedCollectorService.collectSeeds(context), context, () -> UserSeeds.EMPTY,
                "seed collection")
            .flatMap(seeds -> Flux.fromIterable(seeds.forType(mediaType, maxSeeds))
                .flatMapSequential(seed -> seedUnit(seed, context).map(unit -> new SeedResult(seed, unit)),
                    Math.max(1, properties.getDiscovery().getMaxConcurrency()))
                .collectList()
                .flatMap(results -> toRows(mediaType, results, seeds.seenIds(), context)))
            .doOnNext(rows -> logger.info("Built {} {} row(s) for user {}{}", rows.size(), mediaType.getCatalogType(),
                CacheKeyUtils.logSafe(context.getFingerprint()),
                context.isShortLived() ? " (short-lived: degraded or incomplete)" : ""));
    }

    /**
     * Discovery plus enrichment for one seed, cached and shared across users
     */
    private Mono<SeedRecommendations> seedUnit(SeedItem seed, RequestContext context) {
        String key = cacheManager.key(ArtifactClass.SEED_DISCOVERY, CacheKeyUtils.SHARED_FINGERPRINT,
            seed.mediaType(), seed.externalId(), ratedSegment(context));
        SeedRecommendations empty = SeedRecommendations.empty(seed.externalId(), seed.mediaType());
        Mono<SeedRecommendations> unit = cacheManager.getOrCompute(key, ArtifactClass.SEED_DISCOVERY,
            SeedRecommendations.class,
            () -> discoveryService.discoverOrFail(seed, context)
                .flatMap(candidates -> ratingEnrichmentService.enrich(seed.externalId(), seed.mediaType(),
                    candidates, context)),
            empty, context);
        return withinDeadline(unit, context, () -> empty, "seed " + seed.externalId())
            .doOnNext(result -> {
                if (result.degraded()) {
                    context.markDegradedResultReused();
                }
            });
    }

    /**
     * Rated and unrated results are cached apart so adding a rating key takes effect at once
     */
    private String ratedSegment(RequestContext context) {
        return ratingEnrichmentService.isRatingAvailable(context) ? "rated" : "unrated";
    }

    private Mono<List<CatalogRow>> toRows(MediaType mediaType, List<SeedResult> results, Set<String> seenIds,
                                          RequestContext context) {
        UserConfig config = context.getConfig();
        int itemsPerRow = properties.getSeeds().getItemsPerRow();
        Map<String, Double> frequency = candidateScoringService.frequencyIndex(results);

        List<CatalogRow> rows = new ArrayList<>();
        for (SeedResult result : results) {
            if (rows.size() >= config.getNumRows()) {
                break;
            }
            List<ScoredCandidate> ranked = candidateScoringService.rank(result.recommendations().candidates(),
                frequency, seenIds, config.getMinRating(), itemsPerRow);
            if (ranked.isEmpty()) {
                logger.debug("Omitting empty row for seed {}", result.seed().externalId());
                continue;
            }
            SeedItem seed = result.seed();
            String title = seed.title() != null && !seed.title().isBlank() ? seed.title() : seed.externalId();
            rows.add(new CatalogRow(
                DYNAMIC_ROW_PREFIX + mediaType.getCatalogType() + "_" + rows.size(),
                mediaType.getCatalogType(),
                "Because you " + seed.source().getVerb() + " " + title,
                toItems(ranked)));
        }

        if (rows.isEmpty() && properties.getSeeds().isPopularFallbackEnabled()) {
            return popularRow(mediaType, seenIds, context)
                .map(row -> row.items().isEmpty() ? List.<CatalogRow>of() : List.of(row));
        }
        return Mono.just(List.copyOf(rows));
    }

    private Mono<CatalogRow> popularRow(MediaType mediaType, Set<String> seenIds, RequestContext context) {
        String rowId = POPULAR_ROW_PREFIX + mediaType.getCatalogType();
        UserConfig config = context.getConfig();
        Mono<CatalogRow> row = discoveryApiClient.fetchPopular(mediaType, context.getDiscoveryApiKey())
            .defaultIfEmpty(List.of())
            .flatMap(candidates -> ratingEnrichmentService.enrich(rowId, mediaType, candidates, context))
            .map(unit -> {
                List<ScoredCandidate> ranked = candidateScoringService.rank(unit.candidates(), Map.of(), seenIds,
                    config.getMinRating(), properties.getSeeds().getItemsPerRow());
                logger.info("Using popular fallback row for {} with {} item(s)", mediaType.getCatalogType(), ranked.size());
                return new CatalogRow(rowId, mediaType.getCatalogType(), "Popular " + mediaType.getDisplayName(),
                    toItems(ranked));
            })
            .onErrorResume(e -> {
                ErrorHandlingUtils.logAbsorbed(logger, "popular row " + mediaType.getCatalogType(), metricsService, e);
                return Mono.just(new CatalogRow(rowId, mediaType.getCatalogType(),
                    "Popular " + mediaType.getDisplayName(), List.of()));
            });
        return withinDeadline(row, context,
            () -> new CatalogRow(rowId, mediaType.getCatalogType(), "Popular " + mediaType.getDisplayName(), List.of()),
            "popular row " + mediaType.getCatalogType());
    }

    private List<CatalogItem> toItems(List<ScoredCandidate> ranked) {
        return ranked.stream().map(catalogItemMapper::toItem).toList();
    }

    /**
     * Applies the request's soft deadline; a unit still running at the deadline contributes its empty value
     * and marks the request incomplete
     */
    private <T> Mono<T> withinDeadline(Mono<T> unit, RequestContext context, Supplier<T> emptyValue, String description) {
        return Mono.defer(() -> {
            Duration remaining = context.remaining(clock.instant());
            Mono<T> onDeadline = Mono.fromSupplier(() -> {
                context.markIncomplete();
                logger.warn("Soft deadline reached during {} for user {}; continuing without it",
                    description, CacheKeyUtils.logSafe(context.getFingerprint()));
                return emptyValue.get();
            });
            if (remaining.isZero()) {
                return onDeadline;
            }
            return unit.timeout(remaining, onDeadline);
        });
    }

    private void onAssembled(RequestContext context, List<CatalogRow> rows) {
        activeUserRegistry.register(context.getFingerprint(), context.getConfig());
        logger.debug("Assembled {} row(s) for user {}", rows.size(), CacheKeyUtils.logSafe(context.getFingerprint()));
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (!isBlank(preferred)) {
            return preferred;
        }
        return isBlank(fallback) ? null : fallback;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
