/**
 * Deduplicates and scores enriched candidates into ranked rows
 *
 * @author William Callahan
 *
 * Features:
 * - Frequency is the sum of the weights of the distinct seeds recommending a candidate
 * - One scored candidate per canonical identifier
 * - Composite score from frequency, normalized rating and vote confidence with configurable weights
 * - Minimum-rating filter keeps candidates rated exactly at the minimum
 * - Fully deterministic ordering: score, votes, title, canonical id
 */
package com.williamcallahan.media_recommendation_engine.service;

import com.williamcallahan.media_recommendation_engine.config.RecommendationProperties;
import com.williamcallahan.media_recommendation_engine.model.EnrichedCandidate;
import com.williamcallahan.media_recommendation_engine.model.ScoredCandidate;
import com.williamcallahan.media_recommendation_engine.model.SeedResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

@Service
public class CandidateScoringService {

    static final Comparator<ScoredCandidate> RANKING = Comparator
        .comparingDouble(ScoredCandidate::compositeScore).reversed()
        .thenComparing(Comparator.comparingInt(ScoredCandidate::voteCount).reversed())
        .thenComparing(ScoredCandidate::title, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(ScoredCandidate::canonicalId);

    /** Representative of a canonical id: most votes, then smallest discovery id */
    private static final Comparator<EnrichedCandidate> REPRESENTATIVE = Comparator
        .comparingInt(EnrichedCandidate::voteCount).reversed()
        .thenComparing(EnrichedCandidate::externalId);

    private final RecommendationProperties.Scoring scoring;

    public CandidateScoringService(RecommendationProperties properties) {
        this.scoring = properties.getScoring();
    }

    /**
     * Maps each canonical id to the summed weight of the distinct seeds whose results contain it
     */
    public Map<String, Double> frequencyIndex(Collection<SeedResult> results) {
        Map<String, Set<String>> seedsPerCandidate = new HashMap<>();
        Map<String, Double> seedWeights = new HashMap<>();
        for (SeedResult result : results) {
            String seedId = result.seed().externalId();
            seedWeights.putIfAbsent(seedId, result.seed().weight());
            for (EnrichedCandidate candidate : result.recommendations().candidates()) {
                if (candidate.isPromotable()) {
                    seedsPerCandidate.computeIfAbsent(candidate.canonicalId(), id -> new HashSet<>()).add(seedId);
                }
            }
        }
        Map<String, Double> frequency = new HashMap<>();
        seedsPerCandidate.forEach((canonicalId, seedIds) -> frequency.put(canonicalId,
            seedIds.stream().mapToDouble(seedWeights::get).sum()));
        return frequency;
    }

    /**
     * Ranks one row of candidates
     *
     * @param candidates enriched candidates, in any order
     * @param frequency frequency per canonical id; missing ids score a frequency of 0
     * @param excludedIds canonical ids the user has already seen
     * @param minRating inclusive minimum normalized rating
     * @param limit maximum row size
     * @return scored candidates, unique by canonical id, best first
     */
    public List<ScoredCandidate> rank(Collection<EnrichedCandidate> candidates, Map<String, Double> frequency,
                                      Set<String> excludedIds, double minRating, int limit) {
        Map<String, EnrichedCandidate> byCanonicalId = new TreeMap<>();
        for (EnrichedCandidate candidate : candidates) {
            if (!candidate.isPromotable() || excludedIds.contains(candidate.canonicalId())) {
                continue;
            }
            byCanonicalId.merge(candidate.canonicalId(), candidate,
                (current, other) -> REPRESENTATIVE.compare(current, other) <= 0 ? current : other);
        }

        List<ScoredCandidate> scored = new ArrayList<>(byCanonicalId.size());
        for (EnrichedCandidate candidate : byCanonicalId.values()) {
            double rating = normalizedRating(candidate);
            if (rating < minRating) {
                continue;
            }
            double candidateFrequency = frequency.getOrDefault(candidate.canonicalId(), 0.0);
            scored.add(new ScoredCandidate(candidate, candidateFrequency, rating,
                compositeScore(candidateFrequency, rating, candidate.voteCount())));
        }
        scored.sort(RANKING);
        return scored.size() > limit ? List.copyOf(scored.subList(0, Math.max(0, limit))) : List.copyOf(scored);
    }

    /**
     * Secondary rating when present, otherwise the discovery rating, clamped to 0-10
     */
    static double normalizedRating(EnrichedCandidate candidate) {
        double rating = candidate.secondaryRating() != null
            ? candidate.secondaryRating()
            : candidate.candidate().rawRating();
        if (Double.isNaN(rating)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(10.0, rating));
    }

    double compositeScore(double frequency, double normalizedRating, int voteCount) {
        return frequency * scoring.getFrequencyWeight()
            + normalizedRating * scoring.getRatingWeight()
            + voteConfidence(voteCount) * scoring.getVoteWeight();
    }

    /**
     * Vote count mapped onto 0-10 on a log scale, saturating at the configured vote count
     */
    double voteConfidence(int voteCount) {
        if (voteCount <= 0 || scoring.getVoteSaturation() <= 0) {
            return 0.0;
        }
        double confidence = Math.log10(1 + voteCount) / Math.log10(1 + scoring.getVoteSaturation());
        return 10.0 * Math.min(1.0, confidence);
    }
}
