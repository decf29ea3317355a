/**
 * Redis configuration for the recommendation cache using Jedis directly
 *
 * @author William Callahan
 *
 * Features:
 * - Connection target from REDIS_SERVER or spring.redis.* settings
 * - TLS for rediss:// URLs
 * - Pool sized for concurrent cache lookups from the bounded elastic scheduler
 * - An unreachable Redis at startup is logged, not fatal
 */

package com.williamcallahan.media_recommendation_engine.config;

import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.Connection;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Duration;

@Configuration
@Conditional(RedisEnvironmentCondition.class)
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);

    @Bean
    public RedisConnectionSettings redisConnectionSettings(
            @Value("${REDIS_SERVER:#{null}}") String url,
            @Value("${spring.redis.host:localhost}") String host,
            @Value("${spring.redis.port:6379}") int port,
            @Value("${spring.redis.password:#{null}}") String password,
            @Value("${spring.redis.ssl:false}") boolean ssl) {
        return RedisConnectionSettings.resolve(url, host, port, password, ssl);
    }

    /**
     * Pooled client shared by the Redis cache store. Cache operations against an unreachable
     * server fail individually and are treated as misses.
     */
    @Bean(destroyMethod = "close")
    public JedisPooled jedisPooled(RedisConnectionSettings settings,
                                   @Value("${spring.redis.timeout:2000}") int timeoutMillis,
                                   @Value("${spring.redis.jedis.pool.max-active:16}") int maxActive,
                                   @Value("${spring.redis.jedis.pool.max-wait:2000}") long maxWaitMillis) {
        DefaultJedisClientConfig.Builder clientConfig = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeoutMillis)
            .socketTimeoutMillis(timeoutMillis)
            .ssl(settings.ssl());
        if (settings.hasPassword()) {
            clientConfig.password(settings.password());
        }

        GenericObjectPoolConfig<Connection> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxActive);
        poolConfig.setMaxIdle(Math.max(1, maxActive / 2));
        poolConfig.setMinIdle(Math.min(2, maxActive));
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(maxWaitMillis));
        poolConfig.setTimeBetweenEvictionRuns(Duration.ofSeconds(60));

        logger.info("Creating JedisPooled for {} (maxTotal={})", settings, maxActive);
        JedisPooled jedis = new JedisPooled(new HostAndPort(settings.host(), settings.port()),
            clientConfig.build(), poolConfig);
        try {
            logger.info("Redis ping on startup: {}", jedis.ping());
        } catch (JedisException e) {
            logger.warn("Redis not reachable on startup, cache reads will miss until it recovers: {}", e.getMessage());
        }
        return jedis;
    }
}
