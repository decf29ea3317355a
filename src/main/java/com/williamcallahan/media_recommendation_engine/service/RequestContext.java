package com.williamcallahan.media_recommendation_engine.service;

import com.williamcallahan.media_recommendation_engine.model.UserConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Request-scoped state threaded through every pipeline stage.
 * Holds the resolved credentials, the soft deadline and the degradation flags.
 * One instance per catalog request; never shared between requests.
 */
public final class RequestContext {

    private final UserConfig config;
    private final String fingerprint;
    private final String discoveryApiKey;
    private final String ratingApiKey;
    private final Instant deadline;
    private final AtomicBoolean ratingDegraded = new AtomicBoolean(false);
    private final AtomicBoolean incomplete = new AtomicBoolean(false);
    private final AtomicBoolean degradedResultReused = new AtomicBoolean(false);

    public RequestContext(UserConfig config, String fingerprint, String discoveryApiKey, String ratingApiKey, Instant deadline) {
        this.config = config;
        this.fingerprint = fingerprint;
        this.discoveryApiKey = discoveryApiKey;
        this.ratingApiKey = ratingApiKey;
        this.deadline = deadline;
    }

    public UserConfig getConfig() {
        return config;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getDiscoveryApiKey() {
        return discoveryApiKey;
    }

    public String getRatingApiKey() {
        return ratingApiKey;
    }

    public Instant getDeadline() {
        return deadline;
    }

    /**
     * Time left before the soft deadline, never negative
     */
    public Duration remaining(Instant now) {
        Duration remaining = Duration.between(now, deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isRatingDegraded() {
        return ratingDegraded.get();
    }

    /**
     * Marks the rating service degraded for the rest of this request
     *
     * @return true only for the call that flipped the flag
     */
    public boolean markRatingDegraded() {
        return ratingDegraded.compareAndSet(false, true);
    }

    public boolean isIncomplete() {
        return incomplete.get();
    }

    /**
     * Records that some unit of work hit the soft deadline, or failed with nothing cached,
     * and contributed an empty result
     */
    public void markIncomplete() {
        incomplete.set(true);
    }

    public boolean isDegradedResultReused() {
        return degradedResultReused.get();
    }

    /**
     * Records that this request used a degraded result another request produced.
     * Shortens what this request caches; unlike {@link #markRatingDegraded()} it leaves
     * the rating service in use for the rest of the request.
     */
    public void markDegradedResultReused() {
        degradedResultReused.set(true);
    }

    /**
     * Whether artifacts produced by this request should be kept only briefly
     */
    public boolean isShortLived() {
        return ratingDegraded.get() || incomplete.get() || degradedResultReused.get();
    }
}
