package com.olympicsdata.infrastructure.csv;

import com.olympicsdata.domain.model.Athlete;
import com.olympicsdata.domain.model.Country;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.EventResult;
import com.olympicsdata.domain.model.GamesEdition;
import com.olympicsdata.domain.model.IncomingAthlete;
import com.olympicsdata.domain.model.IncomingBundle;
import com.olympicsdata.domain.model.IncomingCountry;
import com.olympicsdata.domain.model.KeyedTable;
import com.olympicsdata.domain.model.Medallist;
import com.olympicsdata.domain.model.ParticipationKey;
import com.olympicsdata.domain.model.SportEvent;
import com.olympicsdata.domain.ports.DatasetSource;
import com.olympicsdata.infrastructure.config.IntegrationProperties;
import com.olympicsdata.infrastructure.csv.CsvTables.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads the base tables and the incoming edition bundle from CSV files.
 */
@Component
public class CsvDatasetSource implements DatasetSource {

    private static final Logger logger = LoggerFactory.getLogger(CsvDatasetSource.class);

    private final IntegrationProperties properties;

    public CsvDatasetSource(IntegrationProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getSourceName() {
        return "csv:" + properties.getInputDir() + "+" + properties.getIncomingDir();
    }

    @Override
    public Dataset loadBase() throws IOException {
        Path inputDir = Paths.get(properties.getInputDir());

        RawTable athleteRows = CsvTables.read(inputDir.resolve(properties.getAthleteFile()),
            BaseTableMapper.ATHLETE_REQUIRED);
        RawTable countryRows = CsvTables.read(inputDir.resolve(properties.getCountryFile()),
            BaseTableMapper.COUNTRY_REQUIRED);
        RawTable gamesRows = CsvTables.read(inputDir.resolve(properties.getGamesFile()),
            BaseTableMapper.GAMES_REQUIRED);
        RawTable resultRows = CsvTables.read(inputDir.resolve(properties.getResultFile()),
            BaseTableMapper.RESULT_REQUIRED);

        KeyedTable<Athlete> athletes = fill(Dataset.athleteTable(athleteRows.header()),
            athleteRows, BaseTableMapper::toAthlete);
        KeyedTable<Country> countries = fill(Dataset.countryTable(countryRows.header()),
            countryRows, BaseTableMapper::toCountry);
        KeyedTable<GamesEdition> games = fill(Dataset.gamesTable(gamesRows.header()),
            gamesRows, BaseTableMapper::toGamesEdition);

        List<EventResult> results = new ArrayList<>(resultRows.rows().size());
        for (Map<String, String> row : resultRows.rows()) {
            results.add(BaseTableMapper.toEventResult(row));
        }

        logger.info("Loaded base tables from {}: {} athletes, {} countries, {} games, {} results",
            inputDir, athletes.size(), countries.size(), games.size(), results.size());
        return new Dataset(athletes, countries, games, resultRows.header(), results);
    }

    /**
     * Rows whose key is already present are logged and skipped; the first row wins.
     */
    private static <R> KeyedTable<R> fill(KeyedTable<R> table, RawTable raw,
                                          Function<Map<String, String>, R> mapper) {
        int duplicates = 0;
        for (Map<String, String> row : raw.rows()) {
            if (!table.insertIfAbsent(mapper.apply(row))) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            logger.warn("Skipped {} rows of {} with a duplicate primary key", duplicates, raw.name());
        }
        return table;
    }

    @Override
    public IncomingBundle loadIncoming() throws IOException {
        Path dir = Paths.get(properties.getIncomingDir());

        List<IncomingAthlete> athletes = new ArrayList<>();
        for (Map<String, String> row : CsvTables.read(dir.resolve(ParisBundleMapper.ATHLETES_FILE),
                ParisBundleMapper.ATHLETE_REQUIRED).rows()) {
            athletes.add(ParisBundleMapper.toAthlete(row));
        }

        List<IncomingCountry> countries = new ArrayList<>();
        for (Map<String, String> row : CsvTables.read(dir.resolve(ParisBundleMapper.NOCS_FILE),
                ParisBundleMapper.NOC_REQUIRED).rows()) {
            countries.add(ParisBundleMapper.toCountry(row));
        }

        Set<SportEvent> events = new LinkedHashSet<>();
        for (Map<String, String> row : CsvTables.read(dir.resolve(ParisBundleMapper.EVENTS_FILE),
                ParisBundleMapper.EVENT_REQUIRED).rows()) {
            events.add(ParisBundleMapper.toSportEvent(row));
        }

        Set<ParticipationKey> teamEntries = new LinkedHashSet<>();
        for (Map<String, String> row : CsvTables.read(dir.resolve(ParisBundleMapper.TEAMS_FILE),
                ParisBundleMapper.TEAM_REQUIRED).rows()) {
            ParisBundleMapper.addTeamEntries(row, teamEntries);
        }

        List<Medallist> medallists = new ArrayList<>();
        for (Map<String, String> row : CsvTables.read(dir.resolve(ParisBundleMapper.MEDALLISTS_FILE),
                ParisBundleMapper.MEDALLIST_REQUIRED).rows()) {
            ParisBundleMapper.toMedallist(row).ifPresent(medallists::add);
        }

        GamesEdition edition = incomingEdition(properties.getIncomingEdition());

        logger.info("Loaded incoming bundle {} from {}: {} athletes, {} nocs, {} events, {} team entries, {} medallists",
            edition.getEditionId(), dir, athletes.size(), countries.size(), events.size(),
            teamEntries.size(), medallists.size());
        return new IncomingBundle(edition, athletes, countries, events, teamEntries, medallists);
    }

    static GamesEdition incomingEdition(IntegrationProperties.Edition e) {
        return BaseTableMapper.toGamesEdition(e.getEdition(), e.getEditionId(), e.getEditionUrl(), e.getYear(),
            e.getCity(), e.getCountryFlagUrl(), e.getCountryNoc(), e.getStartDate(), e.getEndDate(),
            e.getCompetitionDate());
    }
}
