package com.olympicsdata.domain.reconcile;

/**
 * Identifier chosen for one incoming row, with the strategy that produced it.
 */
public record Resolution(String identifier, String strategy, MatchConfidence confidence) {

    public static final String MINTED = "minted";

    public static Resolution minted(String identifier) {
        return new Resolution(identifier, MINTED, MatchConfidence.NEW);
    }

    public boolean isMinted() {
        return confidence == MatchConfidence.NEW;
    }
}
