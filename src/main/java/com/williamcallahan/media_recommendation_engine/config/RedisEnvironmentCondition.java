/**
 * Condition enabling the Redis-backed cache store when connection settings are present
 *
 * @author William Callahan
 *
 * Features:
 * - Matches on REDIS_SERVER, spring.redis.host or spring.redis.port
 * - Without any of them the in-memory cache store is used
 */
package com.williamcallahan.media_recommendation_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;

import java.util.List;

public class RedisEnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(RedisEnvironmentCondition.class);

    static final List<String> REDIS_PROPERTIES = List.of("REDIS_SERVER", "spring.redis.host", "spring.redis.port");

    @Override
    public boolean matches(@NonNull ConditionContext context, @NonNull AnnotatedTypeMetadata metadata) {
        Environment env = context.getEnvironment();
        String configuredBy = REDIS_PROPERTIES.stream()
            .filter(name -> StringUtils.hasText(env.getProperty(name)))
            .findFirst()
            .orElse(null);
        if (configuredBy == null) {
            logger.debug("No Redis settings found; recommendation cache stays in memory");
            return false;
        }
        logger.debug("Redis enabled by {}", configuredBy);
        return true;
    }
}
