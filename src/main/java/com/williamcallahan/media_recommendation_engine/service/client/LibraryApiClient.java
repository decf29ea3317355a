package com.williamcallahan.media_recommendation_engine.service.client;

import com.williamcallahan.media_recommendation_engine.model.LibraryItem;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Library service holding the user's watch history and loved items
 */
public interface LibraryApiClient {

    /**
     * Fetches every library item of the user
     *
     * @param authKey the user's library credential
     * @return the items, or an error of type
     *         {@link com.williamcallahan.media_recommendation_engine.exception.UpstreamUnavailableException}
     *         once the retry budget is spent
     */
    Mono<List<LibraryItem>> fetchLibrary(String authKey);
}
