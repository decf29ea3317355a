package com.williamcallahan.media_recommendation_engine.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Single-process cache store backed by Caffeine, used when Redis is not configured.
 * Each entry expires after its own retention; locks live in the same map.
 */
public class InMemoryCacheStore implements CacheStore {

    record StoredValue(String value, long retentionNanos) {
    }

    private final Cache<String, StoredValue> entries;

    public InMemoryCacheStore(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    InMemoryCacheStore(long maximumSize, Ticker ticker) {
        this.entries = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .ticker(ticker)
            .expireAfter(new Expiry<String, StoredValue>() {
                @Override
                public long expireAfterCreate(String key, StoredValue value, long currentTime) {
                    return value.retentionNanos();
                }

                @Override
                public long expireAfterUpdate(String key, StoredValue value, long currentTime, long currentDuration) {
                    return value.retentionNanos();
                }

                @Override
                public long expireAfterRead(String key, StoredValue value, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            StoredValue stored = entries.getIfPresent(key);
            return stored == null ? null : stored.value();
        });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration retention) {
        return Mono.fromRunnable(() -> entries.put(key, new StoredValue(value, retention.toNanos())));
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> entries.invalidate(key));
    }

    @Override
    public Mono<Boolean> tryAcquireLock(String lockKey, String token, Duration ttl) {
        return Mono.fromSupplier(() -> entries.asMap().putIfAbsent(lockKey, new StoredValue(token, ttl.toNanos())) == null);
    }

    @Override
    public Mono<Void> releaseLock(String lockKey, String token) {
        return Mono.fromRunnable(() -> entries.asMap().computeIfPresent(lockKey,
            (key, current) -> token.equals(current.value()) ? null : current));
    }
}
