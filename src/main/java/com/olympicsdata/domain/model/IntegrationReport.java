package com.olympicsdata.domain.model;

import com.olympicsdata.domain.error.RejectedRow;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of one integration run.
 */
public record IntegrationReport(
    String editionId,
    Instant startedAt,
    Instant finishedAt,
    TableCounts tables,
    ChangeCounts changes,
    Map<String, Long> athleteMatchesByStrategy,
    Map<String, Long> countryMatchesByStrategy,
    long lowConfidenceMatches,
    long malformedDates,
    List<RejectedRow> rejections
) {

    /** Row counts of the final tables. */
    public record TableCounts(int athletes, int countries, int games, int results, int tallyRows) {}

    /** What the merge added, updated and excluded. */
    public record ChangeCounts(
        int countriesAdded,
        int athletesAdded,
        int athletesUpdated,
        int resultsAdded,
        int resultsUpdated,
        int resultsExcluded
    ) {}
}
