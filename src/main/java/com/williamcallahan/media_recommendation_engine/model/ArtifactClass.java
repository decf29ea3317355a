package com.williamcallahan.media_recommendation_engine.model;

/**
 * Cached artifact classes. Each class has its own TTL tier (see
 * {@code RecommendationProperties.Cache#ttlFor}) and key segment.
 */
public enum ArtifactClass {
    /** User library snapshot, keyed per user */
    LIBRARY_SNAPSHOT("library", false, false),
    /** Discovery plus enrichment for one seed, shared across users */
    SEED_DISCOVERY("seed", true, true),
    /** Rating service lookup for one candidate, shared across users */
    RATING_LOOKUP("rating", false, true),
    /** Assembled catalog rows for one media type, keyed per user */
    CATALOG_ROW("catalog", true, false);

    private final String keySegment;
    private final boolean degradable;
    private final boolean cachesEmpty;

    ArtifactClass(String keySegment, boolean degradable, boolean cachesEmpty) {
        this.keySegment = keySegment;
        this.degradable = degradable;
        this.cachesEmpty = cachesEmpty;
    }

    public String getKeySegment() {
        return keySegment;
    }

    /**
     * Whether artifacts of this class get the shortened TTL when the rating service
     * degraded during the request that produced them
     */
    public boolean isDegradable() {
        return degradable;
    }

    /**
     * Whether an empty result is a legitimate value worth caching. Empty library
     * snapshots and empty catalogs usually mean a transient problem and are recomputed.
     */
    public boolean isCachesEmpty() {
        return cachesEmpty;
    }
}
