package com.williamcallahan.media_recommendation_engine.model;

/**
 * Where a seed came from in the user's library. The weight is fixed per source
 * and feeds the frequency term of the composite score.
 */
public enum SeedSource {
    LOVED(2.0, "loved"),
    WATCHED(1.0, "watched");

    private final double weight;
    private final String verb;

    SeedSource(double weight, String verb) {
        this.weight = weight;
        this.verb = verb;
    }

    public double getWeight() {
        return weight;
    }

    /**
     * Past-tense verb used in row titles ("Because you loved ...")
     */
    public String getVerb() {
        return verb;
    }
}
