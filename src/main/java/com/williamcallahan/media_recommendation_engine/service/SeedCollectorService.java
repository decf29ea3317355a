/**
 * Service turning a user's library into ranked seed items
 *
 * @author William Callahan
 *
 * Features:
 * - Library snapshots are cached per user with stale fallback
 * - Loved and watched entries are merged and deduplicated, loved entries winning
 * - Seed weight fixed by source, recency order preserved
 * - Optional loved-first ordering
 * - Never fails: an unavailable library yields no seeds and marks the request incomplete
 */
package com.williamcallahan.media_recommendation_engine.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.williamcallahan.media_recommendation_engine.model.ArtifactClass;
import com.williamcallahan.media_recommendation_engine.model.LibraryItem;
import com.williamcallahan.media_recommendation_engine.model.SeedItem;
import com.williamcallahan.media_recommendation_engine.model.SeedSource;
import com.williamcallahan.media_recommendation_engine.model.UserSeeds;
import com.williamcallahan.media_recommendation_engine.service.cache.RecommendationCacheManager;
import com.williamcallahan.media_recommendation_engine.service.client.LibraryApiClient;
import com.williamcallahan.media_recommendation_engine.util.CacheKeyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class SeedCollectorService {

    private static final Logger logger = LoggerFactory.getLogger(SeedCollectorService.class);

    private static final TypeReference<List<LibraryItem>> LIBRARY_TYPE = new TypeReference<>() {
    };

    /** Most recent first, never-watched last, id as the final tie-break */
    private static final Comparator<LibraryItem> RECENCY = Comparator
        .comparing(LibraryItem::lastWatched, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(LibraryItem::externalId);

    private final LibraryApiClient libraryApiClient;
    private final RecommendationCacheManager cacheManager;

    public SeedCollectorService(LibraryApiClient libraryApiClient, RecommendationCacheManager cacheManager) {
        this.libraryApiClient = libraryApiClient;
        this.cacheManager = cacheManager;
    }

    /**
     * Collects the user's seeds through the library snapshot cache
     *
     * @param context request state carrying the credential and preferences
     * @return the user's seeds; empty when the library is unavailable and nothing is cached
     */
    public Mono<UserSeeds> collectSeeds(RequestContext context) {
        String key = cacheManager.key(ArtifactClass.LIBRARY_SNAPSHOT, context.getFingerprint());
        String authKey = context.getConfig().getLibraryAuthKey();
        return cacheManager.getOrCompute(key, ArtifactClass.LIBRARY_SNAPSHOT, LIBRARY_TYPE,
                () -> libraryApiClient.fetchLibrary(authKey), List.of(), context)
            .map(library -> buildSeeds(library, context.getConfig().isUseLovedItems()))
            .doOnNext(seeds -> logger.debug("Collected {} seed(s) for user {}", seeds.seeds().size(),
                CacheKeyUtils.logSafe(context.getFingerprint())))
            .onErrorResume(e -> {
                logger.warn("Seed collection failed for user {}: {}",
                    CacheKeyUtils.logSafe(context.getFingerprint()), e.getMessage());
                context.markIncomplete();
                return Mono.just(UserSeeds.EMPTY);
            });
    }

    /**
     * Orders and deduplicates library items into seeds. Truncation per media type
     * happens in {@link UserSeeds#forType}.
     */
    UserSeeds buildSeeds(List<LibraryItem> library, boolean lovedFirst) {
        if (library == null || library.isEmpty()) {
            return UserSeeds.EMPTY;
        }
        Map<String, LibraryItem> loved = new LinkedHashMap<>();
        Map<String, LibraryItem> watched = new LinkedHashMap<>();
        for (LibraryItem item : library) {
            if (item.loved()) {
                loved.putIfAbsent(item.externalId(), item);
            }
        }
        for (LibraryItem item : library) {
            if (!loved.containsKey(item.externalId()) && (item.watched() || item.lastWatched() != null)) {
                watched.putIfAbsent(item.externalId(), item);
            }
        }

        List<LibraryItem> ordered = new ArrayList<>(loved.size() + watched.size());
        if (lovedFirst) {
            loved.values().stream().sorted(RECENCY).forEach(ordered::add);
            watched.values().stream().sorted(RECENCY).forEach(ordered::add);
        } else {
            ordered.addAll(loved.values());
            ordered.addAll(watched.values());
            ordered.sort(RECENCY);
        }

        List<SeedItem> seeds = new ArrayList<>(ordered.size());
        for (LibraryItem item : ordered) {
            SeedSource source = loved.containsKey(item.externalId()) ? SeedSource.LOVED : SeedSource.WATCHED;
            seeds.add(SeedItem.of(item.externalId(), item.mediaType(), item.title(), source, seeds.size()));
        }

        Set<String> seen = new LinkedHashSet<>(loved.keySet());
        seen.addAll(watched.keySet());
        return new UserSeeds(seeds, seen);
    }
}
