package com.olympicsdata.infrastructure.csv;

import com.olympicsdata.domain.model.Country;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.IntegrationOutput;
import com.olympicsdata.domain.model.MedalTallyRow;
import com.olympicsdata.domain.ports.DatasetSink;
import com.olympicsdata.infrastructure.config.IntegrationProperties;
import com.olympicsdata.infrastructure.report.IntegrationReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Writes the merged tables, the medal tally and the report into the output
 * directory. Everything is written to temporary files first and only moved
 * into place once all of them are complete.
 */
@Component
public class CsvDatasetSink implements DatasetSink {

    private static final Logger logger = LoggerFactory.getLogger(CsvDatasetSink.class);

    public static final String ATHLETE_OUTPUT = "new_olympic_athlete_bio.csv";
    public static final String RESULT_OUTPUT = "new_olympic_athlete_event_results.csv";
    public static final String COUNTRY_OUTPUT = "new_olympics_country.csv";
    public static final String GAMES_OUTPUT = "new_olympics_games.csv";
    public static final String TALLY_OUTPUT = "new_medal_tally.csv";
    public static final String REPORT_OUTPUT = "integration_report.json";

    public static final List<String> TALLY_HEADER = List.of(
        "edition", "edition_id", "Country", "NOC", "number_of_athletes",
        "gold_medal_count", "silver_medal_count", "bronze_medal_count",
        "total_medals", "medal_winning_athletes");

    private final Path outputDir;
    private final IntegrationReportWriter reportWriter;

    @Autowired
    public CsvDatasetSink(IntegrationProperties properties, IntegrationReportWriter reportWriter) {
        this(Paths.get(properties.getOutputDir()), reportWriter);
    }

    CsvDatasetSink(Path outputDir, IntegrationReportWriter reportWriter) {
        this.outputDir = outputDir;
        this.reportWriter = reportWriter;
    }

    @Override
    public void write(IntegrationOutput output) throws IOException {
        Files.createDirectories(outputDir);
        Dataset dataset = output.dataset();

        // target file -> temporary file
        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            stageCsv(staged, ATHLETE_OUTPUT, dataset.getAthletes().getColumns(),
                map(dataset.getAthletes().rows(),
                    a -> BaseTableMapper.fromAthlete(a, dataset.getAthletes().getColumns())));
            stageCsv(staged, RESULT_OUTPUT, dataset.getResultColumns(),
                map(dataset.getResults(), r -> BaseTableMapper.fromEventResult(r, dataset.getResultColumns())));
            stageCsv(staged, COUNTRY_OUTPUT, dataset.getCountries().getColumns(),
                map(sortedCountries(dataset), c -> BaseTableMapper.fromCountry(c, dataset.getCountries().getColumns())));
            stageCsv(staged, GAMES_OUTPUT, dataset.getGames().getColumns(),
                map(dataset.getGames().rows(), g -> BaseTableMapper.fromGamesEdition(g, dataset.getGames().getColumns())));
            stageCsv(staged, TALLY_OUTPUT, TALLY_HEADER, map(output.medalTally(), CsvDatasetSink::tallyRow));

            Path reportTemp = stage(staged, REPORT_OUTPUT);
            try (Writer writer = Files.newBufferedWriter(reportTemp, StandardCharsets.UTF_8)) {
                reportWriter.write(output.report(), writer);
            }
        } catch (IOException | RuntimeException e) {
            discard(staged);
            throw e;
        }

        for (Map.Entry<Path, Path> entry : staged.entrySet()) {
            move(entry.getValue(), entry.getKey());
        }
        logger.info("Wrote {} output files to {}", staged.size(), outputDir.toAbsolutePath());
    }

    private void stageCsv(Map<Path, Path> staged, String fileName, List<String> header,
                          Iterable<List<String>> rows) throws IOException {
        Path temp = stage(staged, fileName);
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            CsvTables.write(writer, header, rows);
        }
    }

    private Path stage(Map<Path, Path> staged, String fileName) throws IOException {
        Path temp = Files.createTempFile(outputDir, "." + fileName, ".tmp");
        staged.put(outputDir.resolve(fileName), temp);
        return temp;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Map<Path, Path> staged) {
        for (Path temp : staged.values()) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                logger.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
            }
        }
    }

    private static List<Country> sortedCountries(Dataset dataset) {
        List<Country> countries = new ArrayList<>(dataset.getCountries().rows());
        countries.sort(Comparator.comparing(Country::getName, Comparator.nullsLast(String::compareTo))
            .thenComparing(Country::getNoc));
        return countries;
    }

    private static List<String> tallyRow(MedalTallyRow row) {
        List<String> values = Arrays.asList(
            row.edition(),
            row.editionId(),
            row.country(),
            row.noc(),
            String.valueOf(row.numberOfAthletes()),
            String.valueOf(row.gold()),
            String.valueOf(row.silver()),
            String.valueOf(row.bronze()),
            String.valueOf(row.total()),
            String.valueOf(row.medalWinningAthletes()));
        values.replaceAll(v -> v == null ? "" : v);
        return values;
    }

    private static <T> List<List<String>> map(Iterable<T> rows, Function<T, List<String>> mapper) {
        List<List<String>> out = new ArrayList<>();
        for (T row : rows) {
            out.add(mapper.apply(row));
        }
        return out;
    }
}
