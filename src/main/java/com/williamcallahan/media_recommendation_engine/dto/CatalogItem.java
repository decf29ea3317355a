package com.williamcallahan.media_recommendation_engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Presentation-ready recommendation item.
 * Contains only fields resolvable from discovery and rating data.
 *
 * @param id canonical identifier (IMDb-style {@code tt} id)
 * @param type "movie" or "series"
 * @param name display title
 * @param poster absolute poster URL, null when unknown
 * @param background absolute backdrop URL, null when unknown
 * @param description overview text
 * @param releaseInfo release year
 * @param imdbRating normalized rating on a 0-10 scale formatted with one decimal
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogItem(
    String id,
    String type,
    String name,
    String poster,
    String background,
    String description,
    String releaseInfo,

    @JsonProperty("imdbRating")
    String imdbRating
) {
}
