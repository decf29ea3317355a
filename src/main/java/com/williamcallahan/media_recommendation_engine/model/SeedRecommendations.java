package com.williamcallahan.media_recommendation_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Per-seed discovery and enrichment result, the unit cached by the per-seed artifact class
 *
 * @param seedId external id of the seed (or a synthetic id for the popular row)
 * @param mediaType media type of the seed
 * @param candidates enriched candidates that passed the canonical-id gate
 * @param degraded whether this result lacks data because the rating service was degraded or an
 *                 identifier lookup failed while it was produced
 */
public record SeedRecommendations(
    String seedId,
    MediaType mediaType,
    List<EnrichedCandidate> candidates,
    boolean degraded
) {
    public SeedRecommendations {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static SeedRecommendations empty(String seedId, MediaType mediaType) {
        return new SeedRecommendations(seedId, mediaType, List.of(), false);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
