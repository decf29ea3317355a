package com.williamcallahan.media_recommendation_engine.model;

import java.time.Instant;

/**
 * One entry of the user's library as reported by the library service
 *
 * @param externalId library identifier (an IMDb-style {@code tt} id)
 * @param mediaType movie or series
 * @param title display title
 * @param lastWatched last time the user watched the item, null if never
 * @param loved whether the user marked the item as loved
 * @param watched whether the item counts as watched
 */
public record LibraryItem(
    String externalId,
    MediaType mediaType,
    String title,
    Instant lastWatched,
    boolean loved,
    boolean watched
) {
}
