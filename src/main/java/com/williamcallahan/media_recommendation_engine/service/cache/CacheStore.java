package com.williamcallahan.media_recommendation_engine.service.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key-value store behind the recommendation cache.
 * Every operation may fail with {@link com.williamcallahan.media_recommendation_engine.exception.CacheStoreException};
 * callers treat such failures as a miss or a no-op.
 */
public interface CacheStore {

    /**
     * @return the stored value, or empty when the key is absent or expired
     */
    Mono<String> get(String key);

    /**
     * Stores a value that the store will evict after {@code retention}
     */
    Mono<Void> set(String key, String value, Duration retention);

    Mono<Void> delete(String key);

    /**
     * Atomically acquires a lock if nobody holds it
     *
     * @param lockKey key of the lock
     * @param token value identifying the holder; only the holder may release it
     * @param ttl lock expiry, after which another caller may take it
     * @return true when this caller now holds the lock
     */
    Mono<Boolean> tryAcquireLock(String lockKey, String token, Duration ttl);

    /**
     * Releases the lock if {@code token} still holds it
     */
    Mono<Void> releaseLock(String lockKey, String token);
}
