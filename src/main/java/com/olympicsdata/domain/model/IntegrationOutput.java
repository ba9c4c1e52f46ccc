package com.olympicsdata.domain.model;

import java.util.List;

/**
 * Final state of a run: merged tables, derived tally and report.
 */
public record IntegrationOutput(Dataset dataset, List<MedalTallyRow> medalTally, IntegrationReport report) {
}
