package com.olympicsdata.infrastructure.csv;

import com.olympicsdata.domain.model.Athlete;
import com.olympicsdata.domain.model.Country;
import com.olympicsdata.domain.model.EventResult;
import com.olympicsdata.domain.model.GamesEdition;
import com.olympicsdata.domain.model.Medal;
import com.olympicsdata.domain.service.AgeCalculator;
import com.olympicsdata.domain.service.DateNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Maps rows of the base tables to the domain model and back. Columns the model
 * does not know are carried in {@code extraColumns} and written back unchanged.
 */
public final class BaseTableMapper {

    // olympic_athlete_bio.csv
    public static final String ATHLETE_ID = "athlete_id";
    public static final String NAME = "name";
    public static final String SEX = "sex";
    public static final String BORN = "born";
    public static final String HEIGHT = "height";
    public static final String WEIGHT = "weight";
    public static final String COUNTRY = "country";
    public static final String COUNTRY_NOC = "country_noc";

    // olympics_country.csv
    public static final String NOC = "noc";

    // olympics_games.csv
    public static final String EDITION = "edition";
    public static final String EDITION_ID = "edition_id";
    public static final String EDITION_URL = "edition_url";
    public static final String YEAR = "year";
    public static final String CITY = "city";
    public static final String COUNTRY_FLAG_URL = "country_flag_url";
    public static final String START_DATE = "start_date";
    public static final String END_DATE = "end_date";
    public static final String COMPETITION_DATE = "competition_date";
    public static final String IS_HELD = "isHeld";

    // olympic_athlete_event_results.csv
    public static final String SPORT = "sport";
    public static final String EVENT = "event";
    public static final String RESULT_ID = "result_id";
    public static final String ATHLETE = "athlete";
    public static final String POS = "pos";
    public static final String MEDAL = "medal";
    public static final String IS_TEAM_SPORT = "isTeamSport";
    public static final String AGE = AgeCalculator.AGE_COLUMN;

    public static final List<String> ATHLETE_REQUIRED = List.of(ATHLETE_ID, NAME, BORN, COUNTRY_NOC);
    public static final List<String> COUNTRY_REQUIRED = List.of(NOC, COUNTRY);
    public static final List<String> GAMES_REQUIRED = List.of(EDITION, EDITION_ID, YEAR);
    public static final List<String> RESULT_REQUIRED = List.of(EDITION_ID, COUNTRY_NOC, SPORT, EVENT, ATHLETE_ID, MEDAL);

    private static final Set<String> ATHLETE_COLUMNS =
        Set.of(ATHLETE_ID, NAME, SEX, BORN, HEIGHT, WEIGHT, COUNTRY, COUNTRY_NOC);
    private static final Set<String> COUNTRY_COLUMNS = Set.of(NOC, COUNTRY);
    private static final Set<String> GAMES_COLUMNS = Set.of(EDITION, EDITION_ID, EDITION_URL, YEAR, CITY,
        COUNTRY_FLAG_URL, COUNTRY_NOC, START_DATE, END_DATE, COMPETITION_DATE, IS_HELD);
    private static final Set<String> RESULT_COLUMNS = Set.of(EDITION, EDITION_ID, COUNTRY_NOC, SPORT, EVENT,
        RESULT_ID, ATHLETE, ATHLETE_ID, POS, MEDAL, IS_TEAM_SPORT, AGE);

    private BaseTableMapper() {
    }

    public static Athlete toAthlete(Map<String, String> row) {
        Athlete athlete = new Athlete();
        athlete.setAthleteId(CsvTables.cell(row, ATHLETE_ID));
        athlete.setName(CsvTables.cell(row, NAME));
        athlete.setSex(CsvTables.cell(row, SEX));
        athlete.setBorn(DateNormalizer.normalize(row.get(BORN)));
        athlete.setHeight(CsvTables.cell(row, HEIGHT));
        athlete.setWeight(CsvTables.cell(row, WEIGHT));
        athlete.setCountry(CsvTables.cell(row, COUNTRY));
        athlete.setCountryNoc(CsvTables.cell(row, COUNTRY_NOC));
        athlete.setExtraColumns(extras(row, ATHLETE_COLUMNS));
        return athlete;
    }

    public static List<String> fromAthlete(Athlete athlete, List<String> columns) {
        List<String> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add(switch (column) {
                case ATHLETE_ID -> athlete.getAthleteId();
                case NAME -> athlete.getName();
                case SEX -> athlete.getSex();
                case BORN -> athlete.getBorn().canonical();
                case HEIGHT -> athlete.getHeight();
                case WEIGHT -> athlete.getWeight();
                case COUNTRY -> athlete.getCountry();
                case COUNTRY_NOC -> athlete.getCountryNoc();
                default -> athlete.getExtraColumns().get(column);
            });
        }
        return nullsToEmpty(values);
    }

    public static Country toCountry(Map<String, String> row) {
        Country country = new Country(CsvTables.cell(row, NOC), CsvTables.cell(row, COUNTRY));
        country.setExtraColumns(extras(row, COUNTRY_COLUMNS));
        return country;
    }

    public static List<String> fromCountry(Country country, List<String> columns) {
        List<String> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add(switch (column) {
                case NOC -> country.getNoc();
                case COUNTRY -> country.getName();
                default -> country.getExtraColumns().get(column);
            });
        }
        return nullsToEmpty(values);
    }

    /**
     * Reads a games row. Dates of held editions are completed with the edition
     * year ("6 April" → 06-Apr-1896); editions that were not held have no dates.
     */
    public static GamesEdition toGamesEdition(Map<String, String> row) {
        GamesEdition games = new GamesEdition();
        games.setEdition(CsvTables.cell(row, EDITION));
        games.setEditionId(CsvTables.cell(row, EDITION_ID));
        games.setEditionUrl(CsvTables.cell(row, EDITION_URL));
        games.setYear(CsvTables.cell(row, YEAR));
        games.setCity(CsvTables.cell(row, CITY));
        games.setCountryFlagUrl(CsvTables.cell(row, COUNTRY_FLAG_URL));
        games.setCountryNoc(CsvTables.cell(row, COUNTRY_NOC));
        games.setHeldNote(CsvTables.cell(row, IS_HELD));
        if (games.isHeld()) {
            OptionalInt year = DateNormalizer.parseYear(games.getYear());
            Integer contextYear = year.isPresent() ? year.getAsInt() : null;
            games.setStartDate(DateNormalizer.normalize(row.get(START_DATE), contextYear));
            games.setEndDate(DateNormalizer.normalize(row.get(END_DATE), contextYear));
            games.setCompetitionDates(DateNormalizer.normalizeRange(row.get(COMPETITION_DATE), contextYear));
        }
        games.setExtraColumns(extras(row, GAMES_COLUMNS));
        return games;
    }

    public static List<String> fromGamesEdition(GamesEdition games, List<String> columns) {
        List<String> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add(switch (column) {
                case EDITION -> games.getEdition();
                case EDITION_ID -> games.getEditionId();
                case EDITION_URL -> games.getEditionUrl();
                case YEAR -> games.getYear();
                case CITY -> games.getCity();
                case COUNTRY_FLAG_URL -> games.getCountryFlagUrl();
                case COUNTRY_NOC -> games.getCountryNoc();
                case START_DATE -> games.getStartDate().canonical();
                case END_DATE -> games.getEndDate().canonical();
                case COMPETITION_DATE -> games.getCompetitionDates().canonical();
                case IS_HELD -> games.getHeldNote();
                default -> games.getExtraColumns().get(column);
            });
        }
        return nullsToEmpty(values);
    }

    public static EventResult toEventResult(Map<String, String> row) {
        EventResult result = new EventResult();
        result.setEdition(CsvTables.cell(row, EDITION));
        result.setEditionId(CsvTables.cell(row, EDITION_ID));
        result.setCountryNoc(CsvTables.cell(row, COUNTRY_NOC));
        result.setSport(CsvTables.cell(row, SPORT));
        result.setEvent(CsvTables.cell(row, EVENT));
        result.setResultId(CsvTables.cell(row, RESULT_ID));
        result.setAthlete(CsvTables.cell(row, ATHLETE));
        result.setAthleteId(CsvTables.cell(row, ATHLETE_ID));
        result.setPos(CsvTables.cell(row, POS));
        result.setMedal(Medal.fromText(row.get(MEDAL)));
        result.setTeamSport("true".equalsIgnoreCase(CsvTables.cell(row, IS_TEAM_SPORT)));
        result.setExtraColumns(extras(row, RESULT_COLUMNS));
        return result;
    }

    public static List<String> fromEventResult(EventResult result, List<String> columns) {
        List<String> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add(switch (column) {
                case EDITION -> result.getEdition();
                case EDITION_ID -> result.getEditionId();
                case COUNTRY_NOC -> result.getCountryNoc();
                case SPORT -> result.getSport();
                case EVENT -> result.getEvent();
                case RESULT_ID -> result.getResultId();
                case ATHLETE -> result.getAthlete();
                case ATHLETE_ID -> result.getAthleteId();
                case POS -> result.getPos();
                case MEDAL -> result.getMedal().getLabel();
                case IS_TEAM_SPORT -> result.isTeamSport() ? "True" : "False";
                case AGE -> result.getAge() == null ? "" : String.valueOf(result.getAge());
                default -> result.getExtraColumns().get(column);
            });
        }
        return nullsToEmpty(values);
    }

    /**
     * Converts a games row built from configuration values.
     */
    public static GamesEdition toGamesEdition(String edition, String editionId, String editionUrl, String year,
                                              String city, String countryFlagUrl, String countryNoc,
                                              String startDate, String endDate, String competitionDate) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(EDITION, edition);
        row.put(EDITION_ID, editionId);
        row.put(EDITION_URL, editionUrl);
        row.put(YEAR, year);
        row.put(CITY, city);
        row.put(COUNTRY_FLAG_URL, countryFlagUrl);
        row.put(COUNTRY_NOC, countryNoc);
        row.put(START_DATE, startDate);
        row.put(END_DATE, endDate);
        row.put(COMPETITION_DATE, competitionDate);
        row.put(IS_HELD, "");
        return toGamesEdition(row);
    }

    private static Map<String, String> extras(Map<String, String> row, Set<String> known) {
        Map<String, String> extras = new LinkedHashMap<>();
        row.forEach((column, value) -> {
            if (!known.contains(column)) {
                extras.put(column, value);
            }
        });
        return extras;
    }

    private static List<String> nullsToEmpty(List<String> values) {
        values.replaceAll(v -> v == null ? "" : v);
        return values;
    }
}
