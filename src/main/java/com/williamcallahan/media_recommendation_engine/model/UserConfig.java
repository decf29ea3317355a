/**
 * Per-request user configuration
 *
 * @author William Callahan
 *
 * Features:
 * - Immutable for the lifetime of a request
 * - Carries the library credential and optional per-user upstream API keys
 * - Row count, minimum rating, media type toggles and loved-vs-watched preference
 * - Credentials are excluded from toString so they never reach the logs
 */
package com.williamcallahan.media_recommendation_engine.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class UserConfig {

    public static final int MIN_ROWS = 1;
    public static final int MAX_ROWS = 20;

    @ToString.Exclude
    String libraryAuthKey;

    @ToString.Exclude
    String discoveryApiKey;

    @ToString.Exclude
    String ratingApiKey;

    @Builder.Default
    int numRows = 5;

    @Builder.Default
    double minRating = 6.0;

    @Builder.Default
    boolean includeMovies = true;

    @Builder.Default
    boolean includeSeries = true;

    @Builder.Default
    boolean useLovedItems = true;

    /**
     * Media types enabled for this user in presentation order (movies before series)
     */
    public List<MediaType> enabledMediaTypes() {
        List<MediaType> types = new ArrayList<>(2);
        if (includeMovies) {
            types.add(MediaType.MOVIE);
        }
        if (includeSeries) {
            types.add(MediaType.SERIES);
        }
        return types;
    }

    public boolean includes(MediaType mediaType) {
        return mediaType == MediaType.MOVIE ? includeMovies : includeSeries;
    }
}
