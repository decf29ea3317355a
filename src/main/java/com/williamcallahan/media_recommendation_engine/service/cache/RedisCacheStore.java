/**
 * Redis-backed cache store
 *
 * @author William Callahan
 *
 * Features:
 * - Uses the shared JedisPooled client for all operations
 * - Retries connection failures through the Redis retry template
 * - Locks are SET NX PX with a holder token, released by a token-checked Lua script
 * - Blocking Jedis calls run on the bounded elastic scheduler
 * - All failures surface as CacheStoreException
 */

package com.williamcallahan.media_recommendation_engine.service.cache;

import com.williamcallahan.media_recommendation_engine.exception.CacheStoreException;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

public class RedisCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheStore.class);

    private static final String RELEASE_SCRIPT =
        "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end";

    private final JedisPooled jedisPooled;
    private final RetryTemplate redisRetryTemplate;
    private final MetricsService metricsService;

    public RedisCacheStore(JedisPooled jedisPooled, RetryTemplate redisRetryTemplate, MetricsService metricsService) {
        this.jedisPooled = jedisPooled;
        this.redisRetryTemplate = redisRetryTemplate;
        this.metricsService = metricsService;
    }

    @Override
    public Mono<String> get(String key) {
        return execute("GET", () -> jedisPooled.get(key));
    }

    @Override
    public Mono<Void> set(String key, String value, Duration retention) {
        return execute("SET", () -> jedisPooled.set(key, value, SetParams.setParams().px(retention.toMillis())))
            .then();
    }

    @Override
    public Mono<Void> delete(String key) {
        return execute("DEL", () -> jedisPooled.del(key)).then();
    }

    @Override
    public Mono<Boolean> tryAcquireLock(String lockKey, String token, Duration ttl) {
        return execute("SET NX", () -> jedisPooled.set(lockKey, token, SetParams.setParams().nx().px(ttl.toMillis())))
            .map("OK"::equals)
            .defaultIfEmpty(false);
    }

    @Override
    public Mono<Void> releaseLock(String lockKey, String token) {
        return execute("EVAL release", () -> jedisPooled.eval(RELEASE_SCRIPT, List.of(lockKey), List.of(token)))
            .then();
    }

    private <T> Mono<T> execute(String operation, Callable<T> command) {
        return Mono.fromCallable(() -> redisRetryTemplate.execute(context -> command.call()))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(e -> !(e instanceof CacheStoreException), e -> {
                metricsService.incrementCacheStoreError();
                logger.debug("Redis {} failed: {}", operation, e.getMessage());
                return new CacheStoreException("Redis " + operation + " failed: " + e.getMessage(), e);
            });
    }
}
