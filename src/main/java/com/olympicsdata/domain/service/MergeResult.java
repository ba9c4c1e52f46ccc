package com.olympicsdata.domain.service;

import com.olympicsdata.domain.error.RejectedRow;
import com.olympicsdata.domain.model.Dataset;

import java.util.List;

/**
 * Merged tables plus what the merge did to them.
 */
public record MergeResult(Dataset dataset, List<RejectedRow> rejections, MergeStats stats) {

    public record MergeStats(
        int countriesAdded,
        int athletesAdded,
        int athletesUpdated,
        int resultsAdded,
        int resultsUpdated,
        int resultsExcluded
    ) {}
}
