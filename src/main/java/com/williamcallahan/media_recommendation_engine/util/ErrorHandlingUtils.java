/**
 * Utility class for standardized error handling across the pipeline
 * Provides consistent categorization and logging for absorbed failures
 *
 * @author William Callahan
 */

package com.williamcallahan.media_recommendation_engine.util;

import com.williamcallahan.media_recommendation_engine.exception.CacheStoreException;
import com.williamcallahan.media_recommendation_engine.exception.InvalidUserConfigException;
import com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException;
import com.williamcallahan.media_recommendation_engine.monitoring.MetricsService;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import redis.clients.jedis.exceptions.JedisException;

import java.util.concurrent.TimeoutException;

public class ErrorHandlingUtils {

    /**
     * Standard error categorization for consistent handling
     */
    public enum ErrorCategory {
        TIMEOUT,
        UPSTREAM_UNAVAILABLE,
        RATE_LIMIT,
        CACHE_STORE,
        VALIDATION,
        GENERAL
    }

    private ErrorHandlingUtils() {
    }

    /**
     * Categorize an exception into standard error types
     */
    public static ErrorCategory categorizeError(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.GENERAL;
        }
        if (throwable instanceof TimeoutException) {
            return ErrorCategory.TIMEOUT;
        } else if (throwable instanceof RequestNotPermitted) {
            return ErrorCategory.RATE_LIMIT;
        } else if (throwable instanceof WebClientResponseException responseException
                   && responseException.getStatusCode().value() == 429) {
            return ErrorCategory.RATE_LIMIT;
        } else if (throwable instanceof CacheStoreException || throwable instanceof JedisException) {
            return ErrorCategory.CACHE_STORE;
        } else if (throwable instanceof InvalidUserConfigException || throwable instanceof IllegalArgumentException) {
            return ErrorCategory.VALIDATION;
        } else if (throwable.getCause() != null && throwable.getCause() != throwable) {
            ErrorCategory cause = categorizeError(throwable.getCause());
            if (cause != ErrorCategory.GENERAL || !(throwable instanceof UpstreamUnavailableException)) {
                return cause;
            }
        }
        if (throwable instanceof UpstreamUnavailableException) {
            return ErrorCategory.UPSTREAM_UNAVAILABLE;
        }
        return ErrorCategory.GENERAL;
    }

    /**
     * Logs an absorbed failure once, at a level matching its category, and records it
     *
     * @param logger the logger of the absorbing component
     * @param operationName name of the unit of work that failed
     * @param metricsService optional metrics service for tracking
     * @param throwable the absorbed failure
     */
    public static void logAbsorbed(Logger logger, String operationName, MetricsService metricsService, Throwable throwable) {
        ErrorCategory category = categorizeError(throwable);
        switch (category) {
            case TIMEOUT:
                logger.warn("Operation {} timed out: {}", operationName, throwable.getMessage());
                break;
            case RATE_LIMIT:
                logger.warn("Rate limit hit in {}: {}", operationName, throwable.getMessage());
                break;
            case UPSTREAM_UNAVAILABLE:
                logger.warn("Upstream unavailable in {}: {}", operationName, throwable.getMessage());
                break;
            case CACHE_STORE:
                logger.warn("Cache store error in {}: {}", operationName, throwable.getMessage());
                break;
            case VALIDATION:
                logger.warn("Validation error in {}: {}", operationName, throwable.getMessage());
                break;
            default:
                logger.error("Error in {}: {}", operationName, throwable.getMessage(), throwable);
        }
        if (metricsService != null) {
            metricsService.incrementAbsorbedError(category);
        }
    }
}
