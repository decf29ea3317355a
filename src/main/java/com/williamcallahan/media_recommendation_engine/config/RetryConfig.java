/**
 * Configuration for retry mechanisms to improve resilience
 *
 * @author William Callahan
 *
 * Features:
 * - Exposes one explicit {@link RetryPolicy} per upstream service for the reactive clients
 * - Blocking retry template for Redis connection failures only
 * - Randomized exponential backoff so concurrent callers do not retry in lockstep
 */

package com.williamcallahan.media_recommendation_engine.config;

import com.williamcallahan.media_recommendation_engine.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import redis.clients.jedis.exceptions.JedisConnectionException;

@Configuration
public class RetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(RetryConfig.class);

    /**
     * Retry template wrapped around every blocking Redis command
     */
    @Bean("redisRetryTemplate")
    public RetryTemplate redisRetryTemplate(@Value("${app.retry.redis.max-attempts:2}") int maxAttempts,
                                            @Value("${app.retry.redis.initial-backoff-ms:100}") long initialBackoffMillis,
                                            @Value("${app.retry.redis.backoff-multiplier:1.5}") double multiplier,
                                            @Value("${app.retry.redis.max-backoff-ms:1000}") long maxBackoffMillis) {
        return RetryTemplate.builder()
            .maxAttempts(Math.max(1, maxAttempts))
            .exponentialBackoff(initialBackoffMillis, multiplier, maxBackoffMillis, true)
            .retryOn(JedisConnectionException.class)
            .traversingCauses()
            .withListener(new RetryListener() {
                @Override
                public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                             Throwable throwable) {
                    logger.debug("Redis command attempt {} failed: {}", context.getRetryCount(), throwable.getMessage());
                }
            })
            .build();
    }

    @Bean("libraryRetryPolicy")
    public RetryPolicy libraryRetryPolicy(RecommendationProperties properties) {
        return properties.getUpstream().getLibrary().getRetry().toPolicy();
    }

    @Bean("discoveryRetryPolicy")
    public RetryPolicy discoveryRetryPolicy(RecommendationProperties properties) {
        return properties.getUpstream().getDiscovery().getRetry().toPolicy();
    }

    @Bean("ratingRetryPolicy")
    public RetryPolicy ratingRetryPolicy(RecommendationProperties properties) {
        return properties.getUpstream().getRating().getRetry().toPolicy();
    }
}
