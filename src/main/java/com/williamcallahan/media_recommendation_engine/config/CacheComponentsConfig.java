/**
 * Configuration class for cache-related components and beans
 * This configuration provides bean definitions for caching infrastructure
 * It handles:
 * - Choosing the artifact cache store: Redis when a Jedis client is configured, Caffeine otherwise
 * - The in-memory registry of recently active users
 *
 * @author William Callahan
 */
package com.williamcallahan.media_recommendation_engine.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.media_recommendation_engine.model.UserConfig;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import com.williamcallahan.media_recommendation_engine.service.cache.CacheStore;
import com.williamcallahan.media_recommendation_engine.service.cache.InMemoryCacheStore;
import com.williamcallahan.media_recommendation_engine.service.cache.RedisCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import redis.clients.jedis.JedisPooled;

@Configuration
public class CacheComponentsConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheComponentsConfig.class);

    @Bean
    public CacheStore recommendationCacheStore(ObjectProvider<JedisPooled> jedisPooled,
                                              @Qualifier("redisRetryTemplate") RetryTemplate redisRetryTemplate,
                                              MetricsService metricsService,
                                              @Value("${app.recommendations.cache.local-maximum-size:50000}") long localMaximumSize) {
        JedisPooled jedis = jedisPooled.getIfAvailable();
        if (jedis != null) {
            logger.info("Recommendation cache store: Redis");
            return new RedisCacheStore(jedis, redisRetryTemplate, metricsService);
        }
        logger.info("Recommendation cache store: in-memory (max {} entries); Redis is not configured", localMaximumSize);
        return new InMemoryCacheStore(localMaximumSize);
    }

    @Bean
    public Cache<String, UserConfig> activeUserCache(RecommendationProperties properties) {
        return Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(properties.getWarming().getActiveWindow())
            .build();
    }
}
