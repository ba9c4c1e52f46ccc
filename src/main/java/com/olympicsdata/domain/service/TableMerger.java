package com.olympicsdata.domain.service;

import com.olympicsdata.domain.error.RejectedRow;
import com.olympicsdata.domain.error.RejectionReason;
import com.olympicsdata.domain.model.Athlete;
import com.olympicsdata.domain.model.Country;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.EventResult;
import com.olympicsdata.domain.model.GamesEdition;
import com.olympicsdata.domain.model.IncomingAthlete;
import com.olympicsdata.domain.model.IncomingBundle;
import com.olympicsdata.domain.model.IncomingCountry;
import com.olympicsdata.domain.model.Medal;
import com.olympicsdata.domain.model.Medallist;
import com.olympicsdata.domain.model.ParticipationKey;
import com.olympicsdata.domain.model.SportEvent;
import com.olympicsdata.domain.reconcile.ReconciliationResult;
import com.olympicsdata.domain.reconcile.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a reconciled bundle to a copy of the base tables.
 *
 * <p>Merging is idempotent: every incoming row is keyed by its natural identity
 * (athlete, edition, sport, event for results), so a repeated row updates the
 * row already present instead of adding a second one.
 */
public class TableMerger {

    private static final Logger logger = LoggerFactory.getLogger(TableMerger.class);

    private static final Comparator<IncomingResult> RESULT_ORDER = Comparator
        .comparing((IncomingResult r) -> r.sport())
        .thenComparing(IncomingResult::event)
        .thenComparing(IncomingResult::athleteCode);

    public MergeResult merge(Dataset base, IncomingBundle bundle, ReconciliationResult reconciliation) {
        Dataset merged = base.copy();
        List<RejectedRow> rejections = new ArrayList<>();

        GamesEdition edition = mergeEdition(merged, bundle.edition());
        int countriesAdded = mergeCountries(merged, bundle, reconciliation);

        int athletesAdded = 0;
        int athletesUpdated = 0;
        Map<String, IncomingAthlete> athletesByCode = new LinkedHashMap<>();
        for (IncomingAthlete incoming : bundle.athletes()) {
            Optional<Resolution> resolution = reconciliation.athlete(incoming.code());
            if (resolution.isEmpty() || athletesByCode.containsKey(incoming.code())) {
                continue;
            }
            athletesByCode.put(incoming.code(), incoming);
            String athleteId = resolution.get().identifier();
            Optional<Athlete> existing = merged.getAthletes().find(athleteId);
            if (existing.isPresent()) {
                if (fillGaps(existing.get(), incoming)) {
                    athletesUpdated++;
                }
            } else {
                merged.getAthletes().insert(newAthlete(athleteId, incoming, merged, reconciliation));
                athletesAdded++;
            }
        }

        List<IncomingResult> incomingResults = collectResults(bundle, athletesByCode, reconciliation, rejections);
        int[] resultCounts = mergeResults(merged, edition, incomingResults, reconciliation);

        int excluded = enforceReferentialCompleteness(merged, rejections);

        MergeResult.MergeStats stats = new MergeResult.MergeStats(
            countriesAdded, athletesAdded, athletesUpdated, resultCounts[0], resultCounts[1], excluded);
        logger.info("Merged edition {}: {}", edition.getEditionId(), stats);
        return new MergeResult(merged, rejections, stats);
    }

    /**
     * Inserts the edition row, or updates the existing one with every value the
     * incoming row knows.
     */
    private GamesEdition mergeEdition(Dataset merged, GamesEdition incoming) {
        Optional<GamesEdition> existing = merged.getGames().find(incoming.getEditionId());
        if (existing.isEmpty()) {
            GamesEdition row = new GamesEdition(incoming);
            merged.getGames().insert(row);
            return row;
        }
        GamesEdition row = existing.get();
        row.setEdition(preferIncoming(incoming.getEdition(), row.getEdition()));
        row.setEditionUrl(preferIncoming(incoming.getEditionUrl(), row.getEditionUrl()));
        row.setYear(preferIncoming(incoming.getYear(), row.getYear()));
        row.setCity(preferIncoming(incoming.getCity(), row.getCity()));
        row.setCountryNoc(preferIncoming(incoming.getCountryNoc(), row.getCountryNoc()));
        if (incoming.getStartDate().isKnown()) {
            row.setStartDate(incoming.getStartDate());
        }
        if (incoming.getEndDate().isKnown()) {
            row.setEndDate(incoming.getEndDate());
        }
        if (incoming.getCompetitionDates().isKnown()) {
            row.setCompetitionDates(incoming.getCompetitionDates());
        }
        row.setHeldNote(incoming.getHeldNote());
        return row;
    }

    private int mergeCountries(Dataset merged, IncomingBundle bundle, ReconciliationResult reconciliation) {
        int added = 0;
        for (IncomingCountry incoming : bundle.countries()) {
            String code = incoming.code() == null ? "" : incoming.code().trim();
            Optional<Resolution> resolution = reconciliation.country(incoming);
            if (resolution.isEmpty() || !resolution.get().isMinted()
                || merged.getCountries().contains(resolution.get().identifier())) {
                continue;
            }
            String name = NormalizationUtils.displayText(incoming.name());
            Country country = new Country(resolution.get().identifier(), name.isEmpty() ? code : name);
            merged.getCountries().insert(country);
            added++;
        }
        return added;
    }

    private Athlete newAthlete(String athleteId, IncomingAthlete incoming, Dataset merged,
                               ReconciliationResult reconciliation) {
        String noc = representedNoc(incoming, reconciliation);
        Athlete athlete = new Athlete();
        athlete.setAthleteId(athleteId);
        athlete.setName(incoming.displayName());
        athlete.setSex(incoming.sex());
        athlete.setBorn(incoming.born());
        athlete.setHeight(measurement(incoming.height()));
        athlete.setWeight(measurement(incoming.weight()));
        athlete.setCountry(merged.getCountries().find(noc)
            .map(Country::getName)
            .orElse(NormalizationUtils.displayText(incoming.countryName())));
        athlete.setCountryNoc(noc);
        return athlete;
    }

    /**
     * Copies incoming values into empty fields of an existing athlete. Values
     * already present are never overwritten.
     *
     * @return true when anything changed
     */
    private boolean fillGaps(Athlete existing, IncomingAthlete incoming) {
        boolean changed = false;
        if (!existing.getBorn().isKnown() && incoming.born() != null && incoming.born().isKnown()) {
            existing.setBorn(incoming.born());
            changed = true;
        }
        if (isBlank(existing.getSex()) && !isBlank(incoming.sex())) {
            existing.setSex(incoming.sex());
            changed = true;
        }
        if (isBlank(existing.getHeight()) && !measurement(incoming.height()).isEmpty()) {
            existing.setHeight(measurement(incoming.height()));
            changed = true;
        }
        if (isBlank(existing.getWeight()) && !measurement(incoming.weight()).isEmpty()) {
            existing.setWeight(measurement(incoming.weight()));
            changed = true;
        }
        return changed;
    }

    /**
     * Event participations of the bundle: each athlete's disciplines crossed with
     * their events, kept when the pair is contested at the edition, then every
     * medallist entry the athlete lists did not already cover.
     */
    private List<IncomingResult> collectResults(IncomingBundle bundle, Map<String, IncomingAthlete> athletesByCode,
                                                ReconciliationResult reconciliation, List<RejectedRow> rejections) {
        Map<ParticipationKey, Medal> medals = new HashMap<>();
        for (Medallist medallist : bundle.medallists()) {
            medals.put(medallist.participation(), medallist.medal());
        }

        Set<ParticipationKey> seen = new HashSet<>();
        List<IncomingResult> results = new ArrayList<>();
        for (IncomingAthlete athlete : athletesByCode.values()) {
            for (String discipline : athlete.disciplines()) {
                for (String event : athlete.events()) {
                    if (!bundle.events().contains(new SportEvent(discipline, event))) {
                        continue;
                    }
                    ParticipationKey key = new ParticipationKey(athlete.code(), discipline, event);
                    if (seen.add(key)) {
                        results.add(new IncomingResult(athlete.code(), representedNoc(athlete, reconciliation),
                            discipline, event, medals.getOrDefault(key, Medal.NONE),
                            bundle.teamEntries().contains(key)));
                    }
                }
            }
        }

        for (Medallist medallist : bundle.medallists()) {
            ParticipationKey key = medallist.participation();
            if (seen.contains(key)) {
                continue;
            }
            if (!athletesByCode.containsKey(key.athleteCode()) || reconciliation.athlete(key.athleteCode()).isEmpty()) {
                rejections.add(new RejectedRow("medallists", key.athleteCode() + "|" + key.discipline() + "|" + key.event(),
                    RejectionReason.REFERENTIAL_GAP, "medallist references an unknown athlete code"));
                logger.warn("Medallist {} in {} / {} has no reconciled athlete", key.athleteCode(),
                    key.discipline(), key.event());
                continue;
            }
            seen.add(key);
            results.add(new IncomingResult(key.athleteCode(),
                representedNoc(athletesByCode.get(key.athleteCode()), reconciliation),
                key.discipline(), key.event(), medallist.medal(), bundle.teamEntries().contains(key)));
        }
        return results;
    }

    /**
     * Upserts result rows by identity key and hands out result ids, one per
     * (edition, sport, event), reusing ids already present in the table.
     *
     * @return {added, updated}
     */
    private int[] mergeResults(Dataset merged, GamesEdition edition, List<IncomingResult> incoming,
                               ReconciliationResult reconciliation) {
        Map<String, EventResult> byIdentity = new HashMap<>();
        Map<String, String> resultIds = new HashMap<>();
        long maxResultId = 0;
        for (EventResult row : merged.getResults()) {
            byIdentity.putIfAbsent(row.identityKey(), row);
            if (!isBlank(row.getResultId())) {
                resultIds.putIfAbsent(eventKey(row.getEditionId(), row.getSport(), row.getEvent()), row.getResultId());
                maxResultId = Math.max(maxResultId, parseLong(row.getResultId()));
            }
        }

        int added = 0;
        int updated = 0;
        List<IncomingResult> sorted = new ArrayList<>(incoming);
        sorted.sort(RESULT_ORDER);
        for (IncomingResult result : sorted) {
            String athleteId = reconciliation.athlete(result.athleteCode()).orElseThrow().identifier();
            Athlete athlete = merged.getAthletes().find(athleteId).orElseThrow();

            String eventKey = eventKey(edition.getEditionId(), result.sport(), result.event());
            String resultId = resultIds.get(eventKey);
            if (resultId == null) {
                resultId = String.valueOf(++maxResultId);
                resultIds.put(eventKey, resultId);
            }

            EventResult row = new EventResult();
            row.setEdition(edition.getEdition());
            row.setEditionId(edition.getEditionId());
            row.setCountryNoc(result.countryNoc());
            row.setSport(result.sport());
            row.setEvent(result.event());
            row.setResultId(resultId);
            row.setAthlete(athlete.getName());
            row.setAthleteId(athleteId);
            row.setMedal(result.medal());
            row.setPos(result.medal().getPosition());
            row.setTeamSport(result.teamSport());

            EventResult existing = byIdentity.get(row.identityKey());
            if (existing == null) {
                merged.getResults().add(row);
                byIdentity.put(row.identityKey(), row);
                added++;
            } else {
                existing.setMedal(row.getMedal());
                existing.setPos(row.getPos());
                existing.setTeamSport(row.isTeamSport());
                existing.setCountryNoc(row.getCountryNoc());
                if (isBlank(existing.getResultId())) {
                    existing.setResultId(resultId);
                }
                updated++;
            }
        }
        return new int[] {added, updated};
    }

    /**
     * Drops result rows whose athlete, country or edition does not exist.
     *
     * @return number of rows removed
     */
    private int enforceReferentialCompleteness(Dataset merged, List<RejectedRow> rejections) {
        int excluded = 0;
        Iterator<EventResult> it = merged.getResults().iterator();
        while (it.hasNext()) {
            EventResult row = it.next();
            String missing = null;
            if (!merged.getAthletes().contains(row.getAthleteId())) {
                missing = "athlete " + row.getAthleteId();
            } else if (!merged.getCountries().contains(row.getCountryNoc())) {
                missing = "country " + row.getCountryNoc();
            } else if (!merged.getGames().contains(row.getEditionId())) {
                missing = "edition " + row.getEditionId();
            }
            if (missing != null) {
                rejections.add(new RejectedRow(Dataset.RESULTS, row.identityKey(),
                    RejectionReason.REFERENTIAL_GAP, "unknown " + missing));
                it.remove();
                excluded++;
            }
        }
        if (excluded > 0) {
            logger.warn("Excluded {} result rows with unresolved references", excluded);
        }
        return excluded;
    }

    private static String representedNoc(IncomingAthlete athlete, ReconciliationResult reconciliation) {
        return reconciliation.countryCode(athlete.countryCode() == null ? "" : athlete.countryCode().trim());
    }

    private static String eventKey(String editionId, String sport, String event) {
        return editionId + "|" + sport + "|" + event;
    }

    /** Measurements of "0" mean unknown in the bundle. */
    private static String measurement(String value) {
        String trimmed = value == null ? "" : value.trim();
        return "0".equals(trimmed) ? "" : trimmed;
    }

    private static String preferIncoming(String incoming, String existing) {
        return isBlank(incoming) ? existing : incoming;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private record IncomingResult(String athleteCode, String countryNoc, String sport, String event, Medal medal,
                                  boolean teamSport) {
    }
}
