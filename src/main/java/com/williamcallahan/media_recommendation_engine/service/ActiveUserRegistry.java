/**
 * Service tracking the users whose catalogs the background warmer keeps fresh
 *
 * @author William Callahan
 *
 * Features:
 * - Remembers the configuration of every user with a recent successful catalog request
 * - Users are forgotten after the active window without a new request
 * - Keyed by credential fingerprint; credentials never leave the process
 * - Publishes the active user count as a gauge
 */
package com.williamcallahan.media_recommendation_engine.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.williamcallahan.media_recommendation_engine.model.UserConfig;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
@Slf4j
public class ActiveUserRegistry {

    private final Cache<String, UserConfig> activeUsers;
    private final MetricsService metricsService;

    public ActiveUserRegistry(Cache<String, UserConfig> activeUserCache, MetricsService metricsService) {
        this.activeUsers = activeUserCache;
        this.metricsService = metricsService;
    }

    /**
     * Records a user as active, replacing any earlier configuration for the same fingerprint
     */
    public void register(String fingerprint, UserConfig config) {
        activeUsers.put(fingerprint, config);
        metricsService.setActiveUsers((int) activeUsers.estimatedSize());
    }

    /**
     * Copy of the currently active users keyed by fingerprint
     */
    public Map<String, UserConfig> snapshot() {
        activeUsers.cleanUp();
        metricsService.setActiveUsers((int) activeUsers.estimatedSize());
        return new LinkedHashMap<>(activeUsers.asMap());
    }

    public int size() {
        activeUsers.cleanUp();
        return (int) activeUsers.estimatedSize();
    }
}
