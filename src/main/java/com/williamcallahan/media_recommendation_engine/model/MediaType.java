package com.williamcallahan.media_recommendation_engine.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Media types the recommendation pipeline understands, with the path segment
 * each upstream service uses for them
 */
public enum MediaType {
    MOVIE("movie", "movie", "movie", "Movies"),
    SERIES("series", "tv", "show", "Series");

    private final String catalogType;
    private final String discoveryPath;
    private final String ratingType;
    private final String displayName;

    MediaType(String catalogType, String discoveryPath, String ratingType, String displayName) {
        this.catalogType = catalogType;
        this.discoveryPath = discoveryPath;
        this.ratingType = ratingType;
        this.displayName = displayName;
    }

    public String getCatalogType() {
        return catalogType;
    }

    public String getDiscoveryPath() {
        return discoveryPath;
    }

    public String getRatingType() {
        return ratingType;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Maps the type string used by the library and presentation layers ("movie", "series")
     * as well as the discovery service's "tv" alias
     */
    public static Optional<MediaType> fromCatalogType(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MediaType type : values()) {
            if (type.catalogType.equals(normalized) || type.discoveryPath.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
