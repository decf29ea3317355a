/**
 * Tiered cache-aside manager for every recommendation artifact
 *
 * @author William Callahan
 *
 * Features:
 * - Fixed TTL tier per artifact class, shortened when the rating service degraded
 * - Stale-while-revalidate: expired entries are retained and served when recomputation fails
 * - Two-level compute lock: an in-process in-flight registry plus a store-level lock
 * - Shared computations survive caller cancellation so a timed-out request still warms the cache
 * - Store failures are treated as misses and never fail the pipeline
 * - Failed computations are never cached; empty results only for classes that allow it
 * - A failed computation with nothing retained marks every waiting request incomplete
 */

package com.williamcallahan.media_recommendation_engine.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.model.ArtifactClass;
import com.williamcallahan.media_recommendation_engine.model.CacheEntry;
import com.williamcallahan.media_recommendation_engine.model.SeedRecommendations;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.service.RequestContext;
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
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

@Service
public class RecommendationCacheManager {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationCacheManager.class);

    /**
     * Result of a plain cache read
     *
     * @param value deserialized payload
     * @param fresh whether the entry is still within its TTL
     * @param remaining freshness left, zero for stale entries
     */
    public record CachedValue<T>(T value, boolean fresh, Duration remaining) {
    }

    /**
     * What a shared computation produced
     *
     * @param value payload handed to the owner and every joiner
     * @param failed whether the loader failed and no stale entry could stand in
     */
    private record Outcome(Object value, boolean failed) {
    }

    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final RecommendationProperties.Cache cacheProperties;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Map<String, CompletableFuture<Outcome>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public RecommendationCacheManager(CacheStore cacheStore,
                                      ObjectMapper objectMapper,
                                      RecommendationProperties properties,
                                      MetricsService metricsService) {
        this(cacheStore, objectMapper, properties, metricsService, Clock.systemUTC());
    }

    public RecommendationCacheManager(CacheStore cacheStore,
                                      ObjectMapper objectMapper,
                                      RecommendationProperties properties,
                                      MetricsService metricsService,
                                      Clock clock) {
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.cacheProperties = properties.getCache();
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Builds the deterministic key for an artifact
     */
    public String key(ArtifactClass artifactClass, String fingerprint, Object... params) {
        return CacheKeyUtils.key(cacheProperties.getKeyPrefix(), artifactClass, fingerprint, params);
    }

    public <T> Mono<T> getOrCompute(String key, ArtifactClass artifactClass, Class<T> type,
                                    Supplier<Mono<T>> loader, T emptyValue, RequestContext context) {
        return getOrCompute(key, artifactClass, objectMapper.constructType(type), loader, emptyValue, context);
    }

    public <T> Mono<T> getOrCompute(String key, ArtifactClass artifactClass, TypeReference<T> type,
                                    Supplier<Mono<T>> loader, T emptyValue, RequestContext context) {
        return getOrCompute(key, artifactClass, objectMapper.getTypeFactory().constructType(type), loader, emptyValue, context);
    }

    /**
     * Returns the cached artifact for {@code key}, computing it with {@code loader} on a miss.
     * Never fails: a loader failure yields the stale entry when one is retained, otherwise
     * {@code emptyValue} and the request is marked incomplete so its own artifacts get the short TTL.
     *
     * @param key artifact key from {@link #key}
     * @param artifactClass class deciding the TTL tier
     * @param type payload type
     * @param loader computation that may fail; its failures are absorbed here
     * @param emptyValue value returned when nothing else is available
     * @param context request state; its short-lived flags shorten the TTL of degradable classes
     */
    public <T> Mono<T> getOrCompute(String key, ArtifactClass artifactClass, JavaType type,
                                    Supplier<Mono<T>> loader, T emptyValue, RequestContext context) {
        return readEntry(key, artifactClass)
            .flatMap(existing -> {
                if (existing.isPresent() && existing.get().isFresh(clock.instant())) {
                    Optional<T> value = decode(existing.get(), type, key);
                    if (value.isPresent()) {
                        metricsService.incrementCacheHit(artifactClass);
                        return Mono.just(value.get());
                    }
                }
                metricsService.incrementCacheMiss(artifactClass);
                return computeShared(key, artifactClass, type, loader, emptyValue, context, existing, false);
            });
    }

    /**
     * Recomputes an artifact regardless of its freshness. Used by the background warmer.
     * Shares an already running computation for the same key.
     */
    public <T> Mono<T> refresh(String key, ArtifactClass artifactClass, TypeReference<T> typeReference,
                               Supplier<Mono<T>> loader, T emptyValue, RequestContext context) {
        JavaType type = objectMapper.getTypeFactory().constructType(typeReference);
        return readEntry(key, artifactClass)
            .flatMap(existing -> computeShared(key, artifactClass, type, loader, emptyValue, context, existing, true));
    }

    /**
     * Plain read without computation. Empty when absent, undecodable or the store failed.
     */
    public <T> Mono<CachedValue<T>> read(String key, ArtifactClass artifactClass, Class<T> type) {
        JavaType javaType = objectMapper.constructType(type);
        return readEntry(key, artifactClass)
            .flatMap(existing -> {
                if (existing.isEmpty()) {
                    return Mono.<CachedValue<T>>empty();
                }
                CacheEntry entry = existing.get();
                Optional<T> value = decode(entry, javaType, key);
                return Mono.justOrEmpty(value.map(v ->
                    new CachedValue<>(v, entry.isFresh(clock.instant()), entry.remainingFreshness(clock.instant()))));
            });
    }

    /**
     * Freshness left on an entry, empty when the entry is missing or the store failed
     */
    public Mono<Duration> remainingFreshness(String key, ArtifactClass artifactClass) {
        return readEntry(key, artifactClass)
            .flatMap(existing -> Mono.justOrEmpty(existing.map(e -> e.remainingFreshness(clock.instant()))));
    }

    /**
     * Writes an artifact. Store failures are logged and ignored.
     */
    public Mono<Void> put(String key, ArtifactClass artifactClass, Object value, RequestContext context) {
        if (!artifactClass.isCachesEmpty() && isEmptyArtifact(value)) {
            logger.debug("Not caching empty {} artifact {}", artifactClass, key);
            return Mono.empty();
        }
        Duration ttl = ttlFor(artifactClass, value, context);
        String serialized;
        try {
            CacheEntry entry = CacheEntry.of(artifactClass, objectMapper.valueToTree(value), clock.instant(), ttl);
            serialized = objectMapper.writeValueAsString(entry);
        } catch (Exception e) {
            logger.warn("Failed to serialize {} artifact {}: {}", artifactClass, key, e.getMessage());
            return Mono.empty();
        }
        return cacheStore.set(key, serialized, ttl.plus(cacheProperties.getStaleRetention()))
            .doOnSuccess(ignored -> logger.debug("Cached {} artifact {} for {}", artifactClass, key, ttl))
            .onErrorResume(e -> {
                ErrorHandlingUtils.logAbsorbed(logger, "cache write " + key, metricsService, e);
                return Mono.empty();
            });
    }

    public Mono<Void> invalidate(String key) {
        return cacheStore.delete(key)
            .onErrorResume(e -> {
                ErrorHandlingUtils.logAbsorbed(logger, "cache invalidate " + key, metricsService, e);
                return Mono.empty();
            });
    }

    /**
     * TTL an artifact would be written with under {@code context}
     */
    Duration ttlFor(ArtifactClass artifactClass, Object value, RequestContext context) {
        boolean degraded = (context != null && context.isShortLived())
            || (value instanceof SeedRecommendations seed && seed.degraded());
        if (degraded && artifactClass.isDegradable()) {
            return cacheProperties.getDegradedTtl();
        }
        return cacheProperties.ttlFor(artifactClass);
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private <T> Mono<T> computeShared(String key, ArtifactClass artifactClass, JavaType type,
                                      Supplier<Mono<T>> loader, T emptyValue, RequestContext context,
                                      Optional<CacheEntry> previous, boolean force) {
        CompletableFuture<Outcome> mine = new CompletableFuture<>();
        CompletableFuture<Outcome> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            logger.debug("Joining in-flight computation for {}", key);
            return awaitOutcome(running, emptyValue, context);
        }

        metricsService.incrementInFlight();
        Optional<T> staleValue = previous.flatMap(entry -> this.<T>decode(entry, type, key));
        AtomicBoolean failed = new AtomicBoolean(false);
        computeUnderStoreLock(key, artifactClass, type, loader, emptyValue, context, staleValue, force, failed)
            .doFinally(signal -> {
                inFlight.remove(key, mine);
                metricsService.decrementInFlight();
            })
            .subscribe(value -> mine.complete(new Outcome(value, failed.get())), mine::completeExceptionally,
                () -> mine.complete(new Outcome(null, failed.get())));

        return awaitOutcome(mine, emptyValue, context);
    }

    @SuppressWarnings("unchecked")
    private <T> Mono<T> awaitOutcome(CompletableFuture<Outcome> future, T emptyValue, RequestContext context) {
        return Mono.fromFuture(future, true)
            .flatMap(outcome -> {
                if (outcome.failed() && context != null) {
                    context.markIncomplete();
                }
                return Mono.justOrEmpty((T) outcome.value());
            })
            .defaultIfEmpty(emptyValue);
    }

    private <T> Mono<T> computeUnderStoreLock(String key, ArtifactClass artifactClass, JavaType type,
                                              Supplier<Mono<T>> loader, T emptyValue, RequestContext context,
                                              Optional<T> staleValue, boolean force, AtomicBoolean failed) {
        String lockKey = CacheKeyUtils.lockKey(key);
        String token = UUID.randomUUID().toString();
        return cacheStore.tryAcquireLock(lockKey, token, cacheProperties.getLockTimeout())
            .onErrorResume(e -> {
                ErrorHandlingUtils.logAbsorbed(logger, "cache lock " + key, metricsService, e);
                return Mono.just(Boolean.TRUE);
            })
            .defaultIfEmpty(Boolean.FALSE)
            .flatMap(acquired -> {
                if (acquired) {
                    return Mono.usingWhen(Mono.just(token),
                        t -> recheckThenLoad(key, artifactClass, type, loader, emptyValue, context, staleValue,
                            force, failed),
                        t -> releaseQuietly(lockKey, t));
                }
                logger.debug("Store lock for {} held elsewhere, waiting up to {}", key, cacheProperties.getLockWait());
                return this.<T>awaitOtherWriter(key, artifactClass, type)
                    .switchIfEmpty(Mono.defer(() -> load(key, artifactClass, loader, emptyValue, context, staleValue,
                        failed)));
            });
    }

    private <T> Mono<T> recheckThenLoad(String key, ArtifactClass artifactClass, JavaType type,
                                        Supplier<Mono<T>> loader, T emptyValue, RequestContext context,
                                        Optional<T> staleValue, boolean force, AtomicBoolean failed) {
        if (force) {
            return load(key, artifactClass, loader, emptyValue, context, staleValue, failed);
        }
        return readEntry(key, artifactClass)
            .flatMap(current -> {
                if (current.isPresent() && current.get().isFresh(clock.instant())) {
                    Optional<T> value = decode(current.get(), type, key);
                    if (value.isPresent()) {
                        logger.debug("Entry {} was written while acquiring the lock", key);
                        return Mono.just(value.get());
                    }
                }
                return load(key, artifactClass, loader, emptyValue, context, staleValue, failed);
            });
    }

    private <T> Mono<T> awaitOtherWriter(String key, ArtifactClass artifactClass, JavaType type) {
        return Flux.interval(cacheProperties.getLockPollInterval())
            .concatMap(tick -> readEntry(key, artifactClass))
            .filter(current -> current.isPresent() && current.get().isFresh(clock.instant()))
            .next()
            .flatMap(current -> Mono.justOrEmpty(this.<T>decode(current.get(), type, key)))
            .timeout(cacheProperties.getLockWait(), Mono.empty());
    }

    private <T> Mono<T> load(String key, ArtifactClass artifactClass, Supplier<Mono<T>> loader, T emptyValue,
                             RequestContext context, Optional<T> staleValue, AtomicBoolean failed) {
        return Mono.defer(loader)
            .defaultIfEmpty(emptyValue)
            .flatMap(value -> put(key, artifactClass, value, context).thenReturn(value))
            .onErrorResume(e -> {
                ErrorHandlingUtils.logAbsorbed(logger, "compute " + artifactClass + " " + key, metricsService, e);
                if (staleValue.isPresent()) {
                    metricsService.incrementStaleServed(artifactClass);
                    logger.info("Serving stale {} artifact {} after failed recomputation", artifactClass, key);
                    return Mono.just(staleValue.get());
                }
                failed.set(true);
                return Mono.just(emptyValue);
            });
    }

    private Mono<Void> releaseQuietly(String lockKey, String token) {
        return cacheStore.releaseLock(lockKey, token)
            .onErrorResume(e -> {
                ErrorHandlingUtils.logAbsorbed(logger, "cache unlock " + lockKey, metricsService, e);
                return Mono.empty();
            });
    }

    private Mono<Optional<CacheEntry>> readEntry(String key, ArtifactClass artifactClass) {
        return cacheStore.get(key)
            .map(raw -> parseEntry(raw, key))
            .defaultIfEmpty(Optional.empty())
            .onErrorResume(e -> {
                ErrorHandlingUtils.logAbsorbed(logger, "cache read " + artifactClass + " " + key, metricsService, e);
                return Mono.just(Optional.empty());
            });
    }

    private Optional<CacheEntry> parseEntry(String raw, String key) {
        try {
            return Optional.of(objectMapper.readValue(raw, CacheEntry.class));
        } catch (Exception e) {
            logger.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> decode(CacheEntry entry, JavaType type, String key) {
        if (entry.payload() == null || entry.payload().isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.convertValue(entry.payload(), type));
        } catch (IllegalArgumentException e) {
            logger.warn("Discarding cache payload {} that no longer matches {}: {}", key, type, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isEmptyArtifact(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof SeedRecommendations seed) {
            return seed.isEmpty();
        }
        return false;
    }
}
