package com.williamcallahan.media_recommendation_engine.mapper;

import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.dto.CatalogItem;
import com.williamcallahan.media_recommendation_engine.model.DiscoveryCandidate;
import com.williamcallahan.media_recommendation_engine.model.ScoredCandidate;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps scored candidates into presentation-ready catalog items.
 * Image paths from the discovery service are turned into absolute URLs.
 */
@Component
public class CatalogItemMapper {

    static final String POSTER_SIZE = "w500";
    static final String BACKGROUND_SIZE = "original";

    private final String imageBaseUrl;

    public CatalogItemMapper(RecommendationProperties properties) {
        String base = properties.getUpstream().getImageBaseUrl();
        this.imageBaseUrl = base != null && base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    public CatalogItem toItem(ScoredCandidate scored) {
        DiscoveryCandidate candidate = scored.enriched().candidate();
        return new CatalogItem(
            scored.canonicalId(),
            candidate.mediaType().getCatalogType(),
            candidate.title(),
            imageUrl(POSTER_SIZE, candidate.posterPath()),
            imageUrl(BACKGROUND_SIZE, candidate.backdropPath()),
            blankToNull(candidate.overview()),
            releaseYear(candidate.releaseDate()),
            String.format(Locale.ROOT, "%.1f", scored.normalizedRating())
        );
    }

    private String imageUrl(String size, String path) {
        if (path == null || path.isBlank() || imageBaseUrl == null) {
            return null;
        }
        return imageBaseUrl + "/" + size + (path.startsWith("/") ? path : "/" + path);
    }

    static String releaseYear(String releaseDate) {
        if (releaseDate == null || releaseDate.length() < 4) {
            return null;
        }
        String year = releaseDate.substring(0, 4);
        return year.chars().allMatch(Character::isDigit) ? year : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
