package com.williamcallahan.media_recommendation_engine.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * Envelope written to the cache store for every artifact
 *
 * @param artifactClass class of the cached artifact
 * @param payload JSON form of the artifact
 * @param insertedAt epoch millis of the write
 * @param ttlMillis freshness window; the entry stays retrievable as stale after it elapses
 */
public record CacheEntry(ArtifactClass artifactClass, JsonNode payload, long insertedAt, long ttlMillis) {

    public static CacheEntry of(ArtifactClass artifactClass, JsonNode payload, Instant now, Duration ttl) {
        return new CacheEntry(artifactClass, payload, now.toEpochMilli(), ttl.toMillis());
    }

    public Instant expiresAt() {
        return Instant.ofEpochMilli(insertedAt + ttlMillis);
    }

    public boolean isFresh(Instant now) {
        return now.isBefore(expiresAt());
    }

    public Duration remainingFreshness(Instant now) {
        Duration remaining = Duration.between(now, expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
