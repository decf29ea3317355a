package com.williamcallahan.media_recommendation_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A discovery candidate after rating enrichment
 *
 * @param candidate the original discovery candidate
 * @param secondaryRating rating from the secondary rating service, null when unavailable or degraded
 * @param canonicalId canonical identifier, null when it could not be resolved
 */
public record EnrichedCandidate(DiscoveryCandidate candidate, Double secondaryRating, String canonicalId) {

    @JsonIgnore
    public boolean isPromotable() {
        return canonicalId != null && !canonicalId.isBlank();
    }

    public String externalId() {
        return candidate.externalId();
    }

    public String title() {
        return candidate.title();
    }

    public int voteCount() {
        return candidate.voteCount();
    }
}
