package com.olympicsdata.domain.model;

/**
 * Derived medal summary for one country in one edition. Recomputed from the
 * result table on every run, never edited.
 */
public record MedalTallyRow(
    String edition,
    String editionId,
    String country,
    String noc,
    int numberOfAthletes,
    int gold,
    int silver,
    int bronze,
    int medalWinningAthletes
) {

    public int total() {
        return gold + silver + bronze;
    }
}
