/**
 * Service attaching secondary ratings and canonical identifiers to discovery candidates
 *
 * @author William Callahan
 *
 * Features:
 * - Rating lookups cached per candidate and shared across users
 * - Bounded concurrency across a candidate batch, results kept in discovery order
 * - Per-request degraded mode once the rating service exhausts its retry budget:
 *   remaining candidates use primary-source data only
 * - Stale rating lookups are used before falling back to primary-only data
 * - Candidates without a canonical identifier are dropped and logged
 * - A failed identifier lookup skips the candidate without counting it as missing, and flags the result
 */
package com.williamcallahan.media_recommendation_engine.service;

import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.model.ArtifactClass;
import com.williamcallahan.media_recommendation_engine.model.DiscoveryCandidate;
import com.williamcallahan.media_recommendation_engine.model.EnrichedCandidate;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import com.williamcallahan.media_recommendation_engine.model.RatingLookup;
import com.williamcallahan.media_recommendation_engine.model.SeedRecommendations;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.service.cache.RecommendationCacheManager;
import com.williamcallahan.media_recommendation_engine.service.cache.RecommendationCacheManager.CachedValue;
import com.williamcallahan.media_recommendation_engine.service.client.DiscoveryApiClient;
import com.williamcallahan.media_recommendation_engine.service.client.RatingApiClient;
import com.williamcallahan.media_recommendation_engine.util.CacheKeyUtils;
import com.williamcallahan.media_recommendation_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
@Slf4j
public class RatingEnrichmentService {

    private static final String RATING_API = "MDBList";

    /** Returned by the cache manager only when the identifier lookup failed; known misses are cached as "" */
    static final String CANONICAL_ID_UNAVAILABLE = "!unavailable";

    private final RatingApiClient ratingApiClient;
    private final DiscoveryApiClient discoveryApiClient;
    private final RecommendationCacheManager cacheManager;
    private final RecommendationProperties properties;
    private final MetricsService metricsService;

    public RatingEnrichmentService(RatingApiClient ratingApiClient,
                                   DiscoveryApiClient discoveryApiClient,
                                   RecommendationCacheManager cacheManager,
                                   RecommendationProperties properties,
                                   MetricsService metricsService) {
        this.ratingApiClient = ratingApiClient;
        this.discoveryApiClient = discoveryApiClient;
        this.cacheManager = cacheManager;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    /**
     * Whether the rating service can be used for this request at all
     */
    public boolean isRatingAvailable(RequestContext context) {
        return ratingApiClient.isConfigured(context.getRatingApiKey());
    }

    /**
     * Enriches one seed's candidates and applies the canonical-identifier gate.
     * Never fails; the result is flagged degraded when any candidate fell back to primary-only data
     * or was skipped because its identifier lookup failed.
     *
     * @param seedId id of the seed (or row) the candidates belong to
     * @param mediaType media type of the candidates
     * @param candidates candidates in discovery order
     * @param context request state, marked degraded on rating service exhaustion
     */
    public Mono<SeedRecommendations> enrich(String seedId, MediaType mediaType,
                                            List<DiscoveryCandidate> candidates, RequestContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Mono.just(SeedRecommendations.empty(seedId, mediaType));
        }
        AtomicBoolean usedPrimaryOnly = new AtomicBoolean(false);
        AtomicBoolean lookupFailed = new AtomicBoolean(false);
        boolean ratingAvailable = isRatingAvailable(context);
        if (!ratingAvailable) {
            ExternalApiLogger.logSkipped(log, RATING_API, "not configured, using primary ratings");
        }
        return Flux.fromIterable(candidates)
            .flatMapSequential(candidate -> enrichOne(candidate, ratingAvailable, context, usedPrimaryOnly, lookupFailed),
                Math.max(1, properties.getEnrichment().getMaxConcurrency()))
            .filter(enriched -> passesCanonicalGate(enriched, seedId))
            .collectList()
            .map(enriched -> new SeedRecommendations(seedId, mediaType, enriched,
                usedPrimaryOnly.get() || lookupFailed.get()))
            .onErrorResume(e -> {
                log.warn("Enrichment failed for seed {}: {}", seedId, e.getMessage());
                return Mono.just(SeedRecommendations.empty(seedId, mediaType));
            });
    }

    private Mono<EnrichedCandidate> enrichOne(DiscoveryCandidate candidate, boolean ratingAvailable,
                                              RequestContext context, AtomicBoolean usedPrimaryOnly,
                                              AtomicBoolean lookupFailed) {
        Mono<Optional<RatingLookup>> secondary = ratingAvailable
            ? lookupSecondary(candidate, context, usedPrimaryOnly)
            : Mono.just(Optional.empty());
        return secondary.flatMap(lookup -> {
            Double rating = lookup.map(RatingLookup::rating).orElse(null);
            Optional<String> canonicalId = lookup.filter(RatingLookup::hasCanonicalId).map(RatingLookup::canonicalId);
            if (canonicalId.isPresent()) {
                return Mono.just(new EnrichedCandidate(candidate, rating, canonicalId.get()));
            }
            return primaryCanonicalId(candidate, context)
                .flatMap(id -> {
                    if (CANONICAL_ID_UNAVAILABLE.equals(id)) {
                        lookupFailed.set(true);
                        log.debug("Skipping candidate {}: identifier lookup unavailable", candidate.externalId());
                        return Mono.<EnrichedCandidate>empty();
                    }
                    return Mono.just(new EnrichedCandidate(candidate, rating, id.isBlank() ? null : id));
                });
        });
    }

    private Mono<Optional<RatingLookup>> lookupSecondary(DiscoveryCandidate candidate, RequestContext context,
                                                         AtomicBoolean usedPrimaryOnly) {
        String key = cacheManager.key(ArtifactClass.RATING_LOOKUP, CacheKeyUtils.SHARED_FINGERPRINT,
            candidate.mediaType(), candidate.externalId());
        return cacheManager.read(key, ArtifactClass.RATING_LOOKUP, RatingLookup.class)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(cached -> {
                if (cached.isPresent() && cached.get().fresh()) {
                    return Mono.just(Optional.of(cached.get().value()));
                }
                Optional<RatingLookup> stale = cached.map(CachedValue::value);
                if (context.isRatingDegraded()) {
                    if (stale.isEmpty()) {
                        usedPrimaryOnly.set(true);
                    }
                    return Mono.just(stale);
                }
                return ratingApiClient.fetchRating(candidate.mediaType(), candidate.externalId(), context.getRatingApiKey())
                    .defaultIfEmpty(RatingLookup.empty(candidate.externalId()))
                    .flatMap(lookup -> cacheManager.put(key, ArtifactClass.RATING_LOOKUP, lookup, context)
                        .thenReturn(Optional.of(lookup)))
                    .onErrorResume(e -> {
                        if (context.markRatingDegraded()) {
                            metricsService.incrementEnrichmentDegraded();
                            ExternalApiLogger.logDegraded(log, RATING_API,
                                CacheKeyUtils.logSafe(context.getFingerprint()), e.getMessage());
                        }
                        if (stale.isEmpty()) {
                            usedPrimaryOnly.set(true);
                        }
                        return Mono.just(stale);
                    });
            });
    }

    /**
     * Canonical identifier from the discovery service, cached like a rating lookup.
     * Emits "" when the item has no identifier and {@link #CANONICAL_ID_UNAVAILABLE} when the lookup failed.
     */
    private Mono<String> primaryCanonicalId(DiscoveryCandidate candidate, RequestContext context) {
        String key = cacheManager.key(ArtifactClass.RATING_LOOKUP, CacheKeyUtils.SHARED_FINGERPRINT,
            "external-id", candidate.mediaType(), candidate.externalId());
        return cacheManager.getOrCompute(key, ArtifactClass.RATING_LOOKUP, String.class,
                () -> discoveryApiClient.fetchExternalId(candidate.mediaType(), candidate.externalId(),
                        context.getDiscoveryApiKey())
                    .defaultIfEmpty(""),
                CANONICAL_ID_UNAVAILABLE, context);
    }

    private boolean passesCanonicalGate(EnrichedCandidate enriched, String seedId) {
        if (enriched.isPromotable()) {
            return true;
        }
        metricsService.incrementDroppedMissingCanonicalId();
        log.info("Dropping candidate {} ('{}') from seed {}: no canonical identifier",
            enriched.externalId(), enriched.title(), seedId);
        return false;
    }
}
