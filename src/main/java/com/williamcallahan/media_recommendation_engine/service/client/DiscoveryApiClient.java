package com.williamcallahan.media_recommendation_engine.service.client;

import com.williamcallahan.media_recommendation_engine.model.DiscoveryCandidate;
import com.williamcallahan.media_recommendation_engine.model.MediaType;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Metadata catalog service used for keyword lookups and candidate discovery.
 * Unknown items yield empty results; transient failures surface as
 * {@link com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException}
 * after the retry budget.
 */
public interface DiscoveryApiClient {

    /**
     * Filter applied to keyword discovery
     */
    record DiscoveryFilter(int minVoteCount, int maxVoteCount, double minVoteAverage) {
    }

    boolean isConfigured(String apiKey);

    /**
     * Maps a library id to the discovery service's own id. Numeric ids pass through.
     */
    Mono<String> resolveId(MediaType mediaType, String externalId, String apiKey);

    Mono<List<Long>> fetchKeywords(MediaType mediaType, String id, String apiKey);

    Mono<List<DiscoveryCandidate>> discoverByKeywords(MediaType mediaType, List<Long> keywordIds,
                                                      DiscoveryFilter filter, String apiKey);

    /**
     * Generic similar-items list for one item
     */
    Mono<List<DiscoveryCandidate>> fetchSimilar(MediaType mediaType, String id, String apiKey);

    /**
     * Primary-source canonical identifier of an item, empty when the service has none
     */
    Mono<String> fetchExternalId(MediaType mediaType, String id, String apiKey);

    Mono<List<DiscoveryCandidate>> fetchPopular(MediaType mediaType, String apiKey);
}
