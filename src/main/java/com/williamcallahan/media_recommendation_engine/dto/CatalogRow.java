package com.williamcallahan.media_recommendation_engine.dto;

import java.util.List;

/**
 * One recommendation row as consumed by the presentation layer
 *
 * @param id stable row identifier ({@code dynamic_movie_0}, {@code popular_series}, ...)
 * @param type "movie" or "series"
 * @param name row heading
 * @param items ordered items, never containing the same id twice
 */
public record CatalogRow(String id, String type, String name, List<CatalogItem> items) {
    public CatalogRow {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
