package com.olympicsdata.domain.model;

import java.util.List;
import java.util.Set;

/**
 * Everything the new edition contributes, in bundle terms (bundle-local athlete
 * codes, bundle NOC codes). Reconciliation maps it onto the base identifiers.
 */
public record IncomingBundle(
    GamesEdition edition,
    List<IncomingAthlete> athletes,
    List<IncomingCountry> countries,
    Set<SportEvent> events,
    Set<ParticipationKey> teamEntries,
    List<Medallist> medallists
) {
}
