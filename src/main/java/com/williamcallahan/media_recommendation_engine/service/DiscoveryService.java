/**
 * Service discovering candidate items similar to one seed
 *
 * @author William Callahan
 *
 * Features:
 * - Niche discovery through the seed's keywords within a vote-count band and minimum average
 * - Falls back to the generic similar-items list when the seed has no keywords
 * - Removes the seed itself and duplicate ids, keeps the per-seed candidate cap
 * - Strict variant for cache loaders, lenient variant that never fails
 */
package com.williamcallahan.media_recommendation_engine.service;

import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.model.DiscoveryCandidate;
import com.williamcallahan.media_recommendation_engine.model.SeedItem;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.service.client.DiscoveryApiClient;
import com.williamcallahan.media_recommendation_engine.service.client.DiscoveryApiClient.DiscoveryFilter;
import com.williamcallahan.media_recommendation_engine.util.ErrorHandlingUtils;
import com.williamcallahan.media_recommendation_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class DiscoveryService {

    private static final String API_NAME = "TMDB";

    private final DiscoveryApiClient discoveryApiClient;
    private final RecommendationProperties properties;
    private final MetricsService metricsService;

    public DiscoveryService(DiscoveryApiClient discoveryApiClient,
                            RecommendationProperties properties,
                            MetricsService metricsService) {
        this.discoveryApiClient = discoveryApiClient;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    /**
     * Discovers candidates for one seed. Never fails: any upstream problem yields an empty list.
     */
    public Mono<List<DiscoveryCandidate>> discover(SeedItem seed, RequestContext context) {
        return discoverOrFail(seed, context)
            .onErrorResume(e -> {
                ErrorHandlingUtils.logAbsorbed(log, "discovery for seed " + seed.externalId(), metricsService, e);
                return Mono.just(List.of());
            });
    }

    /**
     * Discovers candidates for one seed, failing when the discovery service is unavailable
     * so a caching caller can serve a stale result instead.
     *
     * @return candidates in discovery order, possibly empty for unknown seeds
     */
    public Mono<List<DiscoveryCandidate>> discoverOrFail(SeedItem seed, RequestContext context) {
        String apiKey = context.getDiscoveryApiKey();
        return discoveryApiClient.resolveId(seed.mediaType(), seed.externalId(), apiKey)
            .flatMap(id -> discoverForResolvedId(seed, id, apiKey)
                .map(candidates -> finalizeCandidates(candidates, id)))
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.debug("Seed {} is unknown to the discovery service", seed.externalId());
                return List.<DiscoveryCandidate>of();
            }))
            .doOnNext(candidates -> {
                metricsService.recordDiscoveryResults(candidates.size());
                log.debug("Discovery for seed {} produced {} candidate(s)", seed.externalId(), candidates.size());
            });
    }

    private Mono<List<DiscoveryCandidate>> discoverForResolvedId(SeedItem seed, String id, String apiKey) {
        RecommendationProperties.Discovery discovery = properties.getDiscovery();
        return discoveryApiClient.fetchKeywords(seed.mediaType(), id, apiKey)
            .defaultIfEmpty(List.of())
            .flatMap(keywords -> {
                if (keywords.isEmpty()) {
                    metricsService.incrementDiscoveryFallback();
                    ExternalApiLogger.logFallbackTriggered(log, API_NAME, seed.externalId(),
                        "no keywords, using similar items");
                    return discoveryApiClient.fetchSimilar(seed.mediaType(), id, apiKey)
                        .defaultIfEmpty(List.of());
                }
                List<Long> selected = keywords.stream()
                    .distinct()
                    .limit(discovery.getMaxKeywords())
                    .toList();
                DiscoveryFilter filter = new DiscoveryFilter(discovery.getMinVoteCount(),
                    discovery.getMaxVoteCount(), discovery.getMinVoteAverage());
                return discoveryApiClient.discoverByKeywords(seed.mediaType(), selected, filter, apiKey)
                    .defaultIfEmpty(List.of());
            });
    }

    private List<DiscoveryCandidate> finalizeCandidates(List<DiscoveryCandidate> candidates, String seedDiscoveryId) {
        Map<String, DiscoveryCandidate> unique = new LinkedHashMap<>();
        for (DiscoveryCandidate candidate : candidates) {
            if (candidate.externalId() == null || candidate.externalId().equals(seedDiscoveryId)) {
                continue;
            }
            unique.putIfAbsent(candidate.externalId(), candidate);
        }
        return unique.values().stream()
            .limit(properties.getSeeds().getMaxCandidatesPerSeed())
            .toList();
    }
}
