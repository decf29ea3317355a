/**
 * Typed configuration for the recommendation pipeline
 * Centralizes all app.recommendations.* properties with their documented defaults
 *
 * @author William Callahan
 */

package com.williamcallahan.media_recommendation_engine.config;

import com.williamcallahan.media_recommendation_engine.model.ArtifactClass;
import com.williamcallahan.media_recommendation_engine.util.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.recommendations")
public class RecommendationProperties {

    @NestedConfigurationProperty
    private Seeds seeds = new Seeds();

    @NestedConfigurationProperty
    private Discovery discovery = new Discovery();

    @NestedConfigurationProperty
    private Enrichment enrichment = new Enrichment();

    @NestedConfigurationProperty
    private Scoring scoring = new Scoring();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Warming warming = new Warming();

    @NestedConfigurationProperty
    private Upstream upstream = new Upstream();

    // Getters and setters
    public Seeds getSeeds() { return seeds; }
    public void setSeeds(Seeds seeds) { this.seeds = seeds; }

    public Discovery getDiscovery() { return discovery; }
    public void setDiscovery(Discovery discovery) { this.discovery = discovery; }

    public Enrichment getEnrichment() { return enrichment; }
    public void setEnrichment(Enrichment enrichment) { this.enrichment = enrichment; }

    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Warming getWarming() { return warming; }
    public void setWarming(Warming warming) { this.warming = warming; }

    public Upstream getUpstream() { return upstream; }
    public void setUpstream(Upstream upstream) { this.upstream = upstream; }

    // Nested configuration classes
    public static class Seeds {
        private int maxSeeds = 10;
        private int maxCandidatesPerSeed = 20;
        private int itemsPerRow = 20;
        private Duration requestDeadline = Duration.ofSeconds(8);
        private boolean popularFallbackEnabled = true;

        public int getMaxSeeds() { return maxSeeds; }
        public void setMaxSeeds(int maxSeeds) { this.maxSeeds = maxSeeds; }

        public int getMaxCandidatesPerSeed() { return maxCandidatesPerSeed; }
        public void setMaxCandidatesPerSeed(int maxCandidatesPerSeed) { this.maxCandidatesPerSeed = maxCandidatesPerSeed; }

        public int getItemsPerRow() { return itemsPerRow; }
        public void setItemsPerRow(int itemsPerRow) { this.itemsPerRow = itemsPerRow; }

        public Duration getRequestDeadline() { return requestDeadline; }
        public void setRequestDeadline(Duration requestDeadline) { this.requestDeadline = requestDeadline; }

        public boolean isPopularFallbackEnabled() { return popularFallbackEnabled; }
        public void setPopularFallbackEnabled(boolean popularFallbackEnabled) { this.popularFallbackEnabled = popularFallbackEnabled; }
    }

    public static class Discovery {
        private int minVoteCount = 50;
        private int maxVoteCount = 5000;
        private double minVoteAverage = 7.0;
        private int maxKeywords = 5;
        private int maxConcurrency = 10;

        public int getMinVoteCount() { return minVoteCount; }
        public void setMinVoteCount(int minVoteCount) { this.minVoteCount = minVoteCount; }

        public int getMaxVoteCount() { return maxVoteCount; }
        public void setMaxVoteCount(int maxVoteCount) { this.maxVoteCount = maxVoteCount; }

        public double getMinVoteAverage() { return minVoteAverage; }
        public void setMinVoteAverage(double minVoteAverage) { this.minVoteAverage = minVoteAverage; }

        public int getMaxKeywords() { return maxKeywords; }
        public void setMaxKeywords(int maxKeywords) { this.maxKeywords = maxKeywords; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    }

    public static class Enrichment {
        private int maxConcurrency = 10;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    }

    public static class Scoring {
        private double frequencyWeight = 1.0;
        private double ratingWeight = 0.5;
        private double voteWeight = 0.25;
        private int voteSaturation = 5000;

        public double getFrequencyWeight() { return frequencyWeight; }
        public void setFrequencyWeight(double frequencyWeight) { this.frequencyWeight = frequencyWeight; }

        public double getRatingWeight() { return ratingWeight; }
        public void setRatingWeight(double ratingWeight) { this.ratingWeight = ratingWeight; }

        public double getVoteWeight() { return voteWeight; }
        public void setVoteWeight(double voteWeight) { this.voteWeight = voteWeight; }

        public int getVoteSaturation() { return voteSaturation; }
        public void setVoteSaturation(int voteSaturation) { this.voteSaturation = voteSaturation; }
    }

    public static class Cache {
        private Duration libraryTtl = Duration.ofHours(6);
        private Duration discoveryTtl = Duration.ofHours(24);
        private Duration ratingTtl = Duration.ofDays(7);
        private Duration catalogTtl = Duration.ofHours(1);
        private Duration degradedTtl = Duration.ofMinutes(15);
        private Duration staleRetention = Duration.ofDays(3);
        private Duration lockTimeout = Duration.ofSeconds(30);
        private Duration lockWait = Duration.ofSeconds(2);
        private Duration lockPollInterval = Duration.ofMillis(100);
        private String keyPrefix = "mre";

        /**
         * Freshness window for an artifact class
         */
        public Duration ttlFor(ArtifactClass artifactClass) {
            switch (artifactClass) {
                case LIBRARY_SNAPSHOT:
                    return libraryTtl;
                case SEED_DISCOVERY:
                    return discoveryTtl;
                case RATING_LOOKUP:
                    return ratingTtl;
                case CATALOG_ROW:
                default:
                    return catalogTtl;
            }
        }

        public Duration getLibraryTtl() { return libraryTtl; }
        public void setLibraryTtl(Duration libraryTtl) { this.libraryTtl = libraryTtl; }

        public Duration getDiscoveryTtl() { return discoveryTtl; }
        public void setDiscoveryTtl(Duration discoveryTtl) { this.discoveryTtl = discoveryTtl; }

        public Duration getRatingTtl() { return ratingTtl; }
        public void setRatingTtl(Duration ratingTtl) { this.ratingTtl = ratingTtl; }

        public Duration getCatalogTtl() { return catalogTtl; }
        public void setCatalogTtl(Duration catalogTtl) { this.catalogTtl = catalogTtl; }

        public Duration getDegradedTtl() { return degradedTtl; }
        public void setDegradedTtl(Duration degradedTtl) { this.degradedTtl = degradedTtl; }

        public Duration getStaleRetention() { return staleRetention; }
        public void setStaleRetention(Duration staleRetention) { this.staleRetention = staleRetention; }

        public Duration getLockTimeout() { return lockTimeout; }
        public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }

        public Duration getLockWait() { return lockWait; }
        public void setLockWait(Duration lockWait) { this.lockWait = lockWait; }

        public Duration getLockPollInterval() { return lockPollInterval; }
        public void setLockPollInterval(Duration lockPollInterval) { this.lockPollInterval = lockPollInterval; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
    }

    public static class Warming {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(30);
        private Duration refreshAhead = Duration.ofMinutes(15);
        private Duration activeWindow = Duration.ofHours(24);
        private int maxUsersPerRun = 50;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public Duration getRefreshAhead() { return refreshAhead; }
        public void setRefreshAhead(Duration refreshAhead) { this.refreshAhead = refreshAhead; }

        public Duration getActiveWindow() { return activeWindow; }
        public void setActiveWindow(Duration activeWindow) { this.activeWindow = activeWindow; }

        public int getMaxUsersPerRun() { return maxUsersPerRun; }
        public void setMaxUsersPerRun(int maxUsersPerRun) { this.maxUsersPerRun = maxUsersPerRun; }
    }

    public static class Upstream {
        @NestedConfigurationProperty
        private Service library = new Service("https://api.strem.io/api");

        @NestedConfigurationProperty
        private Service discovery = new Service("https://api.themoviedb.org/3");

        @NestedConfigurationProperty
        private Service rating = new Service("https://mdblist.com/api");

        private String imageBaseUrl = "https://image.tmdb.org/t/p";

        public Service getLibrary() { return library; }
        public void setLibrary(Service library) { this.library = library; }

        public Service getDiscovery() { return discovery; }
        public void setDiscovery(Service discovery) { this.discovery = discovery; }

        public Service getRating() { return rating; }
        public void setRating(Service rating) { this.rating = rating; }

        public String getImageBaseUrl() { return imageBaseUrl; }
        public void setImageBaseUrl(String imageBaseUrl) { this.imageBaseUrl = imageBaseUrl; }
    }

    public static class Service {
        private String baseUrl;
        private String apiKey;

        @NestedConfigurationProperty
        private Retry retry = new Retry();

        public Service() {
        }

        public Service(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public Retry getRetry() { return retry; }
        public void setRetry(Retry retry) { this.retry = retry; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(2);
        private double jitter = 0.5;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, jitter);
        }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }
    }
}
