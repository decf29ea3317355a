package com.williamcallahan.media_recommendation_engine.service.client;

import com.williamcallahan.media_recommendation_engine.model.MediaType;
import com.williamcallahan.media_recommendation_engine.model.RatingLookup;
import reactor.core.publisher.Mono;

/**
 * Secondary rating service supplying ratings and canonical identifiers
 */
public interface RatingApiClient {

    /**
     * Whether the service can be used with {@code apiKey} (or a server default)
     */
    boolean isConfigured(String apiKey);

    /**
     * Looks up one discovery candidate. Unknown items yield {@link RatingLookup#empty}.
     */
    Mono<RatingLookup> fetchRating(MediaType mediaType, String externalId, String apiKey);
}
