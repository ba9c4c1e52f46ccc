package com.olympicsdata.infrastructure.csv;

import com.olympicsdata.domain.model.IncomingAthlete;
import com.olympicsdata.domain.model.IncomingCountry;
import com.olympicsdata.domain.model.Medal;
import com.olympicsdata.domain.model.Medallist;
import com.olympicsdata.domain.model.ParticipationKey;
import com.olympicsdata.domain.model.SportEvent;
import com.olympicsdata.domain.service.DateNormalizer;
import com.olympicsdata.domain.service.NormalizationUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps rows of the incoming edition bundle (athletes, nocs, events, teams,
 * medallists) to domain records.
 */
public final class ParisBundleMapper {

    public static final String ATHLETES_FILE = "athletes.csv";
    public static final String NOCS_FILE = "nocs.csv";
    public static final String EVENTS_FILE = "events.csv";
    public static final String TEAMS_FILE = "teams.csv";
    public static final String MEDALLISTS_FILE = "medallists.csv";

    public static final List<String> ATHLETE_REQUIRED =
        List.of("code", "name", "birth_date", "country_code", "disciplines", "events");
    public static final List<String> NOC_REQUIRED = List.of("code");
    public static final List<String> EVENT_REQUIRED = List.of("sport", "event");
    public static final List<String> TEAM_REQUIRED = List.of("discipline", "events", "athletes_codes");
    public static final List<String> MEDALLIST_REQUIRED = List.of("code_athlete", "discipline", "event", "medal_type");

    private ParisBundleMapper() {
    }

    public static IncomingAthlete toAthlete(Map<String, String> row) {
        String countryCode = CsvTables.cell(row, "country_code");
        String nationality = CsvTables.cell(row, "nationality_code");
        return new IncomingAthlete(
            CsvTables.cell(row, "code"),
            displayName(CsvTables.cell(row, "name_tv"), CsvTables.cell(row, "name")),
            CsvTables.cell(row, "gender"),
            DateNormalizer.normalize(row.get("birth_date")),
            CsvTables.cell(row, "height"),
            CsvTables.cell(row, "weight"),
            countryCode,
            NormalizationUtils.displayText(CsvTables.cell(row, "country_long")),
            nationality.isEmpty() ? countryCode : nationality,
            NormalizationUtils.parseListField(row.get("disciplines")),
            NormalizationUtils.parseListField(row.get("events"))
        );
    }

    /**
     * "MARCHAND Leon" with no TV name becomes "Leon Marchand".
     */
    static String displayName(String tvName, String name) {
        if (!tvName.isEmpty()) {
            return NormalizationUtils.titleCase(NormalizationUtils.displayText(tvName));
        }
        return NormalizationUtils.titleCase(NormalizationUtils.reverseName(NormalizationUtils.displayText(name)));
    }

    public static IncomingCountry toCountry(Map<String, String> row) {
        String name = CsvTables.cell(row, "country_long");
        if (name.isEmpty()) {
            name = CsvTables.cell(row, "country");
        }
        return new IncomingCountry(CsvTables.cell(row, "code"), NormalizationUtils.displayText(name));
    }

    public static SportEvent toSportEvent(Map<String, String> row) {
        return new SportEvent(CsvTables.cell(row, "sport"), CsvTables.cell(row, "event"));
    }

    /** One entry per athlete code listed on the team row. */
    public static void addTeamEntries(Map<String, String> row, Set<ParticipationKey> entries) {
        String discipline = CsvTables.cell(row, "discipline");
        String event = CsvTables.cell(row, "events");
        for (String code : NormalizationUtils.parseListField(row.get("athletes_codes"))) {
            entries.add(new ParticipationKey(code, discipline, event));
        }
    }

    /** Empty for rows whose medal type is not a podium medal. */
    public static Optional<Medallist> toMedallist(Map<String, String> row) {
        Medal medal = Medal.fromText(row.get("medal_type"));
        if (!medal.isPodium()) {
            return Optional.empty();
        }
        return Optional.of(new Medallist(
            CsvTables.cell(row, "code_athlete"),
            CsvTables.cell(row, "discipline"),
            CsvTables.cell(row, "event"),
            medal
        ));
    }
}
