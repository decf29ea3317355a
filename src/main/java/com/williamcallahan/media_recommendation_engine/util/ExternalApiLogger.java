package com.williamcallahan.media_recommendation_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for upstream service calls made by the recommendation pipeline.
 *
 * These logs help debug the per-request flow:
 * - Library service (seed collection)
 * - Discovery service (niche discovery, similar-items fallback, popular row)
 * - Rating service (enrichment, degraded mode)
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an upstream call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String subject) {
        log.debug("{} [{}] ATTEMPT: {} for '{}'", PREFIX, apiName, operation, subject);
    }

    /**
     * Log an upstream call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String subject, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for '{}'", PREFIX, apiName, operation, resultCount, subject);
    }

    /**
     * Log an upstream call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String subject, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for '{}' - {}", PREFIX, apiName, operation, subject, reason);
    }

    /**
     * Log a fallback path taking over from the primary call
     */
    public static void logFallbackTriggered(Logger log, String apiName, String subject, String reason) {
        log.info("{} [{}] FALLBACK: {} for '{}'", PREFIX, apiName, reason, subject);
    }

    /**
     * Log an upstream marked degraded for the rest of a request
     */
    public static void logDegraded(Logger log, String apiName, String user, String reason) {
        log.warn("{} [{}] DEGRADED: continuing with primary data only for user {} - {}", PREFIX, apiName, user, reason);
    }

    /**
     * Log an upstream that is not configured and therefore skipped
     */
    public static void logSkipped(Logger log, String apiName, String reason) {
        log.debug("{} [{}] SKIPPED: {}", PREFIX, apiName, reason);
    }
}
