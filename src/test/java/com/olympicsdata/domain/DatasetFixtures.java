package com.olympicsdata.domain;

import com.olympicsdata.domain.model.Athlete;
import com.olympicsdata.domain.model.Country;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.DateRange;
import com.olympicsdata.domain.model.EventResult;
import com.olympicsdata.domain.model.GamesEdition;
import com.olympicsdata.domain.model.IncomingAthlete;
import com.olympicsdata.domain.model.IncomingBundle;
import com.olympicsdata.domain.model.IncomingCountry;
import com.olympicsdata.domain.model.KeyedTable;
import com.olympicsdata.domain.model.Medal;
import com.olympicsdata.domain.model.Medallist;
import com.olympicsdata.domain.model.NormalizedDate;
import com.olympicsdata.domain.model.ParticipationKey;
import com.olympicsdata.domain.model.SportEvent;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Small base dataset and incoming bundle shared by the integration tests.
 *
 * Base: France, United Kingdom and United States; the Tokyo edition; Teddy Riner
 * (dated, FRA), Jane Doe (undated, GBR) and Ann Smith (USA).
 * Bundle: Paris 2024 with Riner, Marchand, Doe and a Kosovo boxer.
 */
public final class DatasetFixtures {

    public static final List<String> ATHLETE_COLUMNS =
        List.of("athlete_id", "name", "sex", "born", "height", "weight", "country", "country_noc", "description");
    public static final List<String> COUNTRY_COLUMNS = List.of("noc", "country");
    public static final List<String> GAMES_COLUMNS = List.of("edition", "edition_id", "edition_url", "year", "city",
        "country_flag_url", "country_noc", "start_date", "end_date", "competition_date", "isHeld");
    public static final List<String> RESULT_COLUMNS = List.of("edition", "edition_id", "country_noc", "sport",
        "event", "result_id", "athlete", "athlete_id", "pos", "medal", "isTeamSport");

    private DatasetFixtures() {
    }

    public static Dataset base() {
        KeyedTable<Country> countries = Dataset.countryTable(COUNTRY_COLUMNS);
        countries.insert(new Country("FRA", "France"));
        countries.insert(new Country("GBR", "United Kingdom"));
        countries.insert(new Country("USA", "United States"));

        KeyedTable<GamesEdition> games = Dataset.gamesTable(GAMES_COLUMNS);
        games.insert(edition("61", "2020 Summer Olympics", "2020", "Tokyo", "JPN",
            LocalDate.of(2021, 7, 23), LocalDate.of(2021, 8, 8)));

        KeyedTable<Athlete> athletes = Dataset.athleteTable(ATHLETE_COLUMNS);
        athletes.insert(athlete("1", "Teddy Riner", date(1989, 4, 7), "France", "FRA"));
        athletes.insert(athlete("2", "Jane Doe", NormalizedDate.empty(), "United Kingdom", "GBR"));
        athletes.insert(athlete("3", "Ann Smith", date(1995, 3, 1), "United States", "USA"));

        List<EventResult> results = new ArrayList<>();
        results.add(result("61", "2020 Summer Olympics", "FRA", "Judo", "+100 kg, Men", "10", "1", "Teddy Riner",
            Medal.BRONZE));
        results.add(result("61", "2020 Summer Olympics", "USA", "Athletics", "100 metres, Women", "11", "3",
            "Ann Smith", Medal.NONE));
        return new Dataset(athletes, countries, games, RESULT_COLUMNS, results);
    }

    public static GamesEdition paris() {
        GamesEdition paris = edition("63", "2024 Summer Olympics", "2024", "Paris", "FRA",
            LocalDate.of(2024, 7, 26), LocalDate.of(2024, 8, 11));
        paris.setCompetitionDates(new DateRange(date(2024, 7, 24), date(2024, 8, 11)));
        return paris;
    }

    public static IncomingBundle parisBundle() {
        List<IncomingCountry> countries = List.of(
            new IncomingCountry("FRA", "France"),
            new IncomingCountry("GBR", "Great Britain"),
            new IncomingCountry("KOS", "Kosovo"));

        List<IncomingAthlete> athletes = new ArrayList<>();
        athletes.add(incoming("1532872", "Teddy Riner", date(1989, 4, 7), "FRA",
            List.of("Judo"), List.of("+100 kg Men", "Mixed Team")));
        athletes.add(incoming("1906722", "Leon Marchand", date(2002, 5, 17), "FRA",
            List.of("Swimming"), List.of("400m Individual Medley Men", "200m Butterfly Men")));
        athletes.add(incoming("1900001", "Jane Doe", date(2000, 1, 1), "GBR",
            List.of("Athletics"), List.of("100m Women")));
        athletes.add(incoming("1900002", "Dion Gashi", date(1999, 9, 9), "KOS",
            List.of("Boxing"), List.of("Men's 51kg")));

        Set<SportEvent> events = new LinkedHashSet<>(List.of(
            new SportEvent("Judo", "+100 kg Men"),
            new SportEvent("Judo", "Mixed Team"),
            new SportEvent("Swimming", "400m Individual Medley Men"),
            new SportEvent("Swimming", "200m Butterfly Men"),
            new SportEvent("Athletics", "100m Women"),
            new SportEvent("Boxing", "Men's 51kg")));

        Set<ParticipationKey> teams = Set.of(new ParticipationKey("1532872", "Judo", "Mixed Team"));

        List<Medallist> medallists = List.of(
            new Medallist("1532872", "Judo", "+100 kg Men", Medal.GOLD),
            new Medallist("1532872", "Judo", "Mixed Team", Medal.SILVER),
            new Medallist("1906722", "Swimming", "400m Individual Medley Men", Medal.GOLD));

        return new IncomingBundle(paris(), athletes, countries, events, teams, medallists);
    }

    /** Same bundle with other athletes and medallists. */
    public static IncomingBundle withAthletes(IncomingBundle bundle, List<IncomingAthlete> athletes,
                                              List<Medallist> medallists) {
        return new IncomingBundle(bundle.edition(), athletes, bundle.countries(), bundle.events(),
            bundle.teamEntries(), medallists);
    }

    public static IncomingAthlete incoming(String code, String name, NormalizedDate born, String noc,
                                           List<String> disciplines, List<String> events) {
        return new IncomingAthlete(code, name, "Male", born, "0", "0", noc, "", noc, disciplines, events);
    }

    public static NormalizedDate date(int year, int month, int day) {
        LocalDate date = LocalDate.of(year, month, day);
        return NormalizedDate.of(date, date.format(NormalizedDate.CANONICAL_FORMAT));
    }

    public static GamesEdition edition(String id, String name, String year, String city, String noc,
                                       LocalDate start, LocalDate end) {
        GamesEdition games = new GamesEdition();
        games.setEditionId(id);
        games.setEdition(name);
        games.setEditionUrl("/editions/" + id);
        games.setYear(year);
        games.setCity(city);
        games.setCountryNoc(noc);
        games.setStartDate(NormalizedDate.of(start, start.toString()));
        games.setEndDate(NormalizedDate.of(end, end.toString()));
        return games;
    }

    public static Athlete athlete(String id, String name, NormalizedDate born, String country, String noc) {
        Athlete athlete = new Athlete();
        athlete.setAthleteId(id);
        athlete.setName(name);
        athlete.setSex("");
        athlete.setBorn(born);
        athlete.setHeight("");
        athlete.setWeight("");
        athlete.setCountry(country);
        athlete.setCountryNoc(noc);
        athlete.getExtraColumns().put("description", "");
        return athlete;
    }

    public static EventResult result(String editionId, String edition, String noc, String sport, String event,
                                     String resultId, String athleteId, String athleteName, Medal medal) {
        EventResult result = new EventResult();
        result.setEditionId(editionId);
        result.setEdition(edition);
        result.setCountryNoc(noc);
        result.setSport(sport);
        result.setEvent(event);
        result.setResultId(resultId);
        result.setAthleteId(athleteId);
        result.setAthlete(athleteName);
        result.setMedal(medal);
        result.setPos(medal.getPosition());
        return result;
    }
}
