/**
 * Service for tracking recommendation pipeline metrics and structured events
 * Provides counters, summaries, gauges, and timers for monitoring
 *
 * @author William Callahan
 */

package com.williamcallahan.media_recommendation_engine.monitoring;

import com.williamcallahan.media_recommendation_engine.model.ArtifactClass;
import com.williamcallahan.media_recommendation_engine.util.ErrorHandlingUtils.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

@Service
public class MetricsService {

    public static final String DISCOVERY_RESULTS = "recommendations.discovery.results";
    public static final String DISCOVERY_FALLBACK = "recommendations.discovery.fallback";
    public static final String ENRICHMENT_DEGRADED = "recommendations.enrichment.degraded";
    public static final String DROPPED_MISSING_CANONICAL_ID = "recommendations.candidates.dropped";
    public static final String CACHE_HIT = "recommendations.cache.hit";
    public static final String CACHE_MISS = "recommendations.cache.miss";
    public static final String CACHE_STALE_SERVED = "recommendations.cache.stale_served";
    public static final String CACHE_STORE_ERRORS = "recommendations.cache.store_errors";
    public static final String WARMING_RUNS = "recommendations.warming.runs";
    public static final String WARMING_REFRESHED = "recommendations.warming.refreshed";
    public static final String ERRORS_ABSORBED = "recommendations.errors.absorbed";
    public static final String UPSTREAM_CALL = "recommendations.upstream.call.duration";

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter discoveryFallbacks;
    private final Counter enrichmentDegraded;
    private final Counter droppedMissingCanonicalId;
    private final Counter cacheStoreErrors;
    private final Counter warmingRuns;
    private final Counter warmingRefreshed;

    // Summaries
    private final DistributionSummary discoveryResults;

    // Gauges
    private final AtomicInteger activeUsers = new AtomicInteger(0);
    private final AtomicInteger inFlightComputations = new AtomicInteger(0);

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Initialize counters
        this.discoveryFallbacks = Counter.builder(DISCOVERY_FALLBACK)
            .description("Seeds with no keywords that fell back to the similar-items call")
            .register(meterRegistry);

        this.enrichmentDegraded = Counter.builder(ENRICHMENT_DEGRADED)
            .description("Requests whose rating service went degraded")
            .register(meterRegistry);

        this.droppedMissingCanonicalId = Counter.builder(DROPPED_MISSING_CANONICAL_ID)
            .description("Candidates dropped for lacking a canonical identifier")
            .tag("reason", "missing_canonical_id")
            .register(meterRegistry);

        this.cacheStoreErrors = Counter.builder(CACHE_STORE_ERRORS)
            .description("Cache store operations that failed and were treated as a miss")
            .register(meterRegistry);

        this.warmingRuns = Counter.builder(WARMING_RUNS)
            .description("Background cache warming runs")
            .register(meterRegistry);

        this.warmingRefreshed = Counter.builder(WARMING_REFRESHED)
            .description("Catalog artifacts refreshed by the warmer")
            .register(meterRegistry);

        // Initialize summaries
        this.discoveryResults = DistributionSummary.builder(DISCOVERY_RESULTS)
            .description("Candidates returned by discovery per seed")
            .register(meterRegistry);

        // Initialize gauges
        Gauge.builder("recommendations.users.active", activeUsers, AtomicInteger::get)
            .description("Users currently tracked for cache warming")
            .register(meterRegistry);

        Gauge.builder("recommendations.cache.in_flight", inFlightComputations, AtomicInteger::get)
            .description("Cache computations currently running in this process")
            .register(meterRegistry);
    }

    // Counter methods
    public void recordDiscoveryResults(int candidateCount) {
        discoveryResults.record(candidateCount);
    }

    public void incrementDiscoveryFallback() {
        discoveryFallbacks.increment();
    }

    public void incrementEnrichmentDegraded() {
        enrichmentDegraded.increment();
    }

    public void incrementDroppedMissingCanonicalId() {
        droppedMissingCanonicalId.increment();
    }

    public void incrementCacheHit(ArtifactClass artifactClass) {
        meterRegistry.counter(CACHE_HIT, "artifact", artifactClass.getKeySegment()).increment();
    }

    public void incrementCacheMiss(ArtifactClass artifactClass) {
        meterRegistry.counter(CACHE_MISS, "artifact", artifactClass.getKeySegment()).increment();
    }

    public void incrementStaleServed(ArtifactClass artifactClass) {
        meterRegistry.counter(CACHE_STALE_SERVED, "artifact", artifactClass.getKeySegment()).increment();
    }

    public void incrementCacheStoreError() {
        cacheStoreErrors.increment();
    }

    public void incrementWarmingRun() {
        warmingRuns.increment();
    }

    public void incrementWarmingRefreshed() {
        warmingRefreshed.increment();
    }

    public void incrementAbsorbedError(ErrorCategory category) {
        meterRegistry.counter(ERRORS_ABSORBED, "category", category.name().toLowerCase()).increment();
    }

    // Gauge methods
    public void setActiveUsers(int count) {
        activeUsers.set(count);
    }

    public void incrementInFlight() {
        inFlightComputations.incrementAndGet();
    }

    public void decrementInFlight() {
        inFlightComputations.decrementAndGet();
    }

    // Timer methods
    public Timer.Sample startUpstreamTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopUpstreamTimer(Timer.Sample sample, String upstream, String operation, String outcome) {
        sample.stop(Timer.builder(UPSTREAM_CALL)
            .description("Upstream call duration including retries")
            .tag("upstream", upstream)
            .tag("operation", operation)
            .tag("outcome", outcome)
            .register(meterRegistry));
    }
}
