package com.olympicsdata.domain.service;

import com.olympicsdata.domain.model.Country;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.EventResult;
import com.olympicsdata.domain.model.GamesEdition;
import com.olympicsdata.domain.model.Medal;
import com.olympicsdata.domain.model.MedalTallyRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the medal tally from the merged result table.
 *
 * <p>Rows are ordered chronologically by edition, then by total medals
 * descending, then by NOC. Editions that share a date are kept apart by their
 * numeric edition id before totals are compared.
 */
public class MedalTallyAggregator {

    private static final Logger logger = LoggerFactory.getLogger(MedalTallyAggregator.class);

    private final boolean collapseTeamMedals;

    /**
     * @param collapseTeamMedals when true a team medal counts once per
     *                           (edition, sport, event, country, medal) instead of once per row
     */
    public MedalTallyAggregator(boolean collapseTeamMedals) {
        this.collapseTeamMedals = collapseTeamMedals;
    }

    public List<MedalTallyRow> aggregate(Dataset dataset) {
        Map<TallyKey, Accumulator> tally = new LinkedHashMap<>();
        Set<String> countedTeamMedals = new HashSet<>();

        for (EventResult row : dataset.getResults()) {
            Accumulator acc = tally.computeIfAbsent(new TallyKey(row.getEditionId(), row.getCountryNoc()),
                k -> new Accumulator(row.getEdition()));
            acc.athletes.add(row.getAthleteId());

            Medal medal = row.getMedal();
            if (!medal.isPodium()) {
                continue;
            }
            acc.medalAthletes.add(row.getAthleteId());
            if (collapseTeamMedals && row.isTeamSport()) {
                String teamKey = String.join("|", row.getEditionId(), row.getSport(), row.getEvent(),
                    row.getCountryNoc(), medal.name());
                if (!countedTeamMedals.add(teamKey)) {
                    continue;
                }
            }
            acc.medals.merge(medal, 1, Integer::sum);
        }

        List<RankedRow> ranked = new ArrayList<>(tally.size());
        tally.forEach((key, acc) -> {
            Optional<GamesEdition> games = dataset.getGames().find(key.editionId());
            String edition = games.map(GamesEdition::getEdition).orElse(acc.edition);
            String country = dataset.getCountries().find(key.noc()).map(Country::getName).orElse("");
            MedalTallyRow row = new MedalTallyRow(edition, key.editionId(), country, key.noc(),
                acc.athletes.size(),
                acc.medals.getOrDefault(Medal.GOLD, 0),
                acc.medals.getOrDefault(Medal.SILVER, 0),
                acc.medals.getOrDefault(Medal.BRONZE, 0),
                acc.medalAthletes.size());
            ranked.add(new RankedRow(row, games.flatMap(MedalTallyAggregator::chronologicalDate).orElse(null),
                editionNumber(key.editionId())));
        });

        ranked.sort(Comparator
            .comparing(RankedRow::date, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(RankedRow::editionNumber)
            .thenComparing(r -> r.row().editionId())
            .thenComparing(r -> r.row().total(), Comparator.reverseOrder())
            .thenComparing(r -> r.row().noc()));

        logger.info("Medal tally has {} rows", ranked.size());
        return ranked.stream().map(RankedRow::row).toList();
    }

    /**
     * Date an edition sorts by: its reference date, else 1 January of its year.
     */
    private static Optional<LocalDate> chronologicalDate(GamesEdition games) {
        if (games.referenceDate().isKnown()) {
            return Optional.of(games.referenceDate().date());
        }
        var year = DateNormalizer.parseYear(games.getYear());
        return year.isPresent() ? Optional.of(LocalDate.of(year.getAsInt(), 1, 1)) : Optional.empty();
    }

    private static long editionNumber(String editionId) {
        try {
            return Long.parseLong(editionId);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private record TallyKey(String editionId, String noc) {
    }

    private record RankedRow(MedalTallyRow row, LocalDate date, long editionNumber) {
    }

    private static final class Accumulator {
        private final String edition;
        private final Set<String> athletes = new HashSet<>();
        private final Set<String> medalAthletes = new HashSet<>();
        private final Map<Medal, Integer> medals = new EnumMap<>(Medal.class);

        private Accumulator(String edition) {
            this.edition = edition;
        }
    }
}
