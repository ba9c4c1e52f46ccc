package com.olympicsdata.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The four canonical tables. Column lists are the schema contracts read from
 * the base files and are written back in the same order.
 */
public class Dataset {

    public static final String ATHLETES = "athletes";
    public static final String COUNTRIES = "countries";
    public static final String GAMES = "games";
    public static final String RESULTS = "results";

    private final KeyedTable<Athlete> athletes;
    private final KeyedTable<Country> countries;
    private final KeyedTable<GamesEdition> games;
    private final List<String> resultColumns;
    private final List<EventResult> results;

    public Dataset(KeyedTable<Athlete> athletes,
                   KeyedTable<Country> countries,
                   KeyedTable<GamesEdition> games,
                   List<String> resultColumns,
                   List<EventResult> results) {
        this.athletes = athletes;
        this.countries = countries;
        this.games = games;
        this.resultColumns = List.copyOf(resultColumns);
        this.results = results;
    }

    public static KeyedTable<Athlete> athleteTable(List<String> columns) {
        return new KeyedTable<>(ATHLETES, columns, Athlete::getAthleteId);
    }

    public static KeyedTable<Country> countryTable(List<String> columns) {
        return new KeyedTable<>(COUNTRIES, columns, Country::getNoc);
    }

    public static KeyedTable<GamesEdition> gamesTable(List<String> columns) {
        return new KeyedTable<>(GAMES, columns, GamesEdition::getEditionId);
    }

    /** Deep copy; the merger works on a copy so the base snapshot stays intact. */
    public Dataset copy() {
        List<EventResult> resultsCopy = new ArrayList<>(results.size());
        results.forEach(r -> resultsCopy.add(new EventResult(r)));
        return new Dataset(
            athletes.copy(Athlete::new),
            countries.copy(Country::new),
            games.copy(GamesEdition::new),
            resultColumns,
            resultsCopy
        );
    }

    public KeyedTable<Athlete> getAthletes() {
        return athletes;
    }

    public KeyedTable<Country> getCountries() {
        return countries;
    }

    public KeyedTable<GamesEdition> getGames() {
        return games;
    }

    public List<String> getResultColumns() {
        return resultColumns;
    }

    public List<EventResult> getResults() {
        return results;
    }
}
