package com.williamcallahan.media_recommendation_engine.model;

/**
 * Result of asking the rating service about one candidate
 *
 * @param externalId discovery service identifier that was looked up
 * @param rating secondary rating on a 0-10 scale, null when the service has none
 * @param canonicalId canonical identifier, null when the service could not resolve one
 */
public record RatingLookup(String externalId, Double rating, String canonicalId) {

    public static RatingLookup empty(String externalId) {
        return new RatingLookup(externalId, null, null);
    }

    public boolean hasCanonicalId() {
        return canonicalId != null && !canonicalId.isBlank();
    }
}
