package com.williamcallahan.media_recommendation_engine.model;

/**
 * A history item used as the basis for discovering similar content
 *
 * @param externalId library identifier of the seed
 * @param mediaType movie or series
 * @param title seed title, used for the row heading
 * @param source loved or watched
 * @param weight fixed by source
 * @param recencyRank zero-based position in the ordered seed list
 */
public record SeedItem(
    String externalId,
    MediaType mediaType,
    String title,
    SeedSource source,
    double weight,
    int recencyRank
) {

    public static SeedItem of(String externalId, MediaType mediaType, String title, SeedSource source, int recencyRank) {
        return new SeedItem(externalId, mediaType, title, source, source.getWeight(), recencyRank);
    }
}
