package com.williamcallahan.media_recommendation_engine.model;

/**
 * A seed paired with the discovery and enrichment result produced for it
 */
public record SeedResult(SeedItem seed, SeedRecommendations recommendations) {
}
