package com.williamcallahan.media_recommendation_engine.model;

/**
 * An enriched candidate with its frequency and composite score
 *
 * @param enriched the enriched candidate
 * @param frequency sum of the weights of the distinct seeds recommending the candidate
 * @param normalizedRating rating used for scoring and the minimum-rating filter, 0-10
 * @param compositeScore final ranking score
 */
public record ScoredCandidate(
    EnrichedCandidate enriched,
    double frequency,
    double normalizedRating,
    double compositeScore
) {

    public String canonicalId() {
        return enriched.canonicalId();
    }

    public String title() {
        return enriched.title();
    }

    public int voteCount() {
        return enriched.voteCount();
    }
}
