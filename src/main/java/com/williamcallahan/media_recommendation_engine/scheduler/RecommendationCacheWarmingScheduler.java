/**
 * Scheduler for proactively warming catalog caches of recently active users
 * - Keeps steady-state latency low without serving stale data on the hot path
 * - Refreshes only catalogs that are missing or close to expiry
 * - Bounded number of users per run to stay within upstream rate limits
 *
 * @author William Callahan
 */
package com.williamcallahan.media_recommendation_engine.scheduler;

import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import com.williamcallahan.media_recommendation_engine.model.UserConfig;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.service.ActiveUserRegistry;
import com.williamcallahan.media_recommendation_engine.service.CatalogAssemblyService;
import com.williamcallahan.media_recommendation_engine.util.CacheKeyUtils;
import com.williamcallahan.media_recommendation_engine.util.ErrorHandlingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@Component
public class RecommendationCacheWarmingScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationCacheWarmingScheduler.class);

    /** Users refreshed concurrently within one run */
    private static final int WARMING_CONCURRENCY = 2;

    private final ActiveUserRegistry activeUserRegistry;
    private final CatalogAssemblyService catalogAssemblyService;
    private final RecommendationProperties.Warming warming;
    private final MetricsService metricsService;

    public RecommendationCacheWarmingScheduler(ActiveUserRegistry activeUserRegistry,
                                               CatalogAssemblyService catalogAssemblyService,
                                               RecommendationProperties properties,
                                               MetricsService metricsService) {
        this.activeUserRegistry = activeUserRegistry;
        this.catalogAssemblyService = catalogAssemblyService;
        this.warming = properties.getWarming();
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${app.recommendations.warming.interval:PT30M}",
        initialDelayString = "${app.recommendations.warming.interval:PT30M}")
    public void warmActiveUserCatalogs() {
        if (!warming.isEnabled()) {
            logger.debug("Recommendation cache warming is disabled");
            return;
        }
        Integer refreshed = runOnce().block();
        logger.info("Recommendation cache warming completed, refreshed {} catalog(s)", refreshed);
    }

    /**
     * One warming pass over the active users
     *
     * @return number of catalogs recomputed
     */
    Mono<Integer> runOnce() {
        Map<String, UserConfig> users = activeUserRegistry.snapshot();
        metricsService.incrementWarmingRun();
        if (users.isEmpty()) {
            logger.debug("No active users to warm");
            return Mono.just(0);
        }
        logger.info("Starting recommendation cache warming for {} of {} active user(s)",
            Math.min(users.size(), warming.getMaxUsersPerRun()), users.size());

        return Flux.fromIterable(users.entrySet())
            .take(Math.max(0, warming.getMaxUsersPerRun()))
            .flatMap(entry -> warmUser(entry.getKey(), entry.getValue()), WARMING_CONCURRENCY)
            .reduce(0, Integer::sum);
    }

    private Mono<Integer> warmUser(String fingerprint, UserConfig config) {
        return Flux.fromIterable(config.enabledMediaTypes())
            .concatMap(type -> warmCatalog(fingerprint, config, type))
            .reduce(0, Integer::sum)
            .onErrorResume(e -> {
                ErrorHandlingUtils.logAbsorbed(logger, "cache warming for user " + CacheKeyUtils.logSafe(fingerprint),
                    metricsService, e);
                return Mono.just(0);
            });
    }

    private Mono<Integer> warmCatalog(String fingerprint, UserConfig config, MediaType type) {
        return catalogAssemblyService.catalogFreshness(config, type)
            .map(remaining -> remaining.compareTo(warming.getRefreshAhead()) <= 0)
            .defaultIfEmpty(true)
            .flatMap(due -> {
                if (!due) {
                    return Mono.just(0);
                }
                return catalogAssemblyService.refreshCatalog(config, type)
                    .map(rows -> {
                        metricsService.incrementWarmingRefreshed();
                        logger.debug("Warmed {} catalog for user {} ({} row(s))", type.getCatalogType(),
                            CacheKeyUtils.logSafe(fingerprint), rows.size());
                        return 1;
                    });
            });
    }
}
