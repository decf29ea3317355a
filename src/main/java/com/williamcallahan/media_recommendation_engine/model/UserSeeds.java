package com.williamcallahan.media_recommendation_engine.model;

import java.util.List;
import java.util.Set;

/**
 * Seeds derived from a user's library plus the ids the user has already seen
 *
 * @param seeds ordered seeds of every media type, deduplicated by external id
 * @param seenIds library ids that must never be recommended back (watched, loved and seed items)
 */
public record UserSeeds(List<SeedItem> seeds, Set<String> seenIds) {

    public static final UserSeeds EMPTY = new UserSeeds(List.of(), Set.of());

    public UserSeeds {
        seeds = seeds == null ? List.of() : List.copyOf(seeds);
        seenIds = seenIds == null ? Set.of() : Set.copyOf(seenIds);
    }

    /**
     * Seeds of one media type in seed order, at most {@code maxSeeds}
     */
    public List<SeedItem> forType(MediaType mediaType, int maxSeeds) {
        return seeds.stream()
            .filter(seed -> seed.mediaType() == mediaType)
            .limit(Math.max(0, maxSeeds))
            .toList();
    }
}
