package com.williamcallahan.media_recommendation_engine.model;

import java.util.Set;

/**
 * An item the discovery service proposed for a seed
 *
 * @param externalId discovery service identifier
 * @param mediaType movie or series
 * @param title display title
 * @param rawRating discovery service average rating on a 0-10 scale
 * @param voteCount number of votes behind {@code rawRating}
 * @param keywordSet seed keyword ids the candidate was discovered through (empty for the similar-items fallback)
 * @param posterPath relative poster path, may be null
 * @param backdropPath relative backdrop path, may be null
 * @param overview description, may be null
 * @param releaseDate ISO date string, may be null
 */
public record DiscoveryCandidate(
    String externalId,
    MediaType mediaType,
    String title,
    double rawRating,
    int voteCount,
    Set<Long> keywordSet,
    String posterPath,
    String backdropPath,
    String overview,
    String releaseDate
) {
    public DiscoveryCandidate {
        keywordSet = keywordSet == null ? Set.of() : Set.copyOf(keywordSet);
    }
}
