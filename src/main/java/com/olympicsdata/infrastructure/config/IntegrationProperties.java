package com.olympicsdata.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Input/output locations and integration options, bound from {@code olympics.*}.
 */
@ConfigurationProperties(prefix = "olympics")
public class IntegrationProperties {

    /** Directory holding the four base tables. */
    private String inputDir = "data";

    private String athleteFile = "olympic_athlete_bio.csv";

    private String resultFile = "olympic_athlete_event_results.csv";

    private String countryFile = "olympics_country.csv";

    private String gamesFile = "olympics_games.csv";

    /** Directory holding the incoming edition bundle (athletes, nocs, events, teams, medallists). */
    private String incomingDir = "data/paris";

    private String outputDir = "output";

    /** Runs one integration when the application starts. */
    private boolean runOnStartup = false;

    /** Groups of equivalent country display names. */
    private List<List<String>> countryAliases = new ArrayList<>();

    private Edition incomingEdition = new Edition();

    private Tally tally = new Tally();

    public String getInputDir() {
        return inputDir;
    }

    public void setInputDir(String inputDir) {
        this.inputDir = inputDir;
    }

    public String getAthleteFile() {
        return athleteFile;
    }

    public void setAthleteFile(String athleteFile) {
        this.athleteFile = athleteFile;
    }

    public String getResultFile() {
        return resultFile;
    }

    public void setResultFile(String resultFile) {
        this.resultFile = resultFile;
    }

    public String getCountryFile() {
        return countryFile;
    }

    public void setCountryFile(String countryFile) {
        this.countryFile = countryFile;
    }

    public String getGamesFile() {
        return gamesFile;
    }

    public void setGamesFile(String gamesFile) {
        this.gamesFile = gamesFile;
    }

    public String getIncomingDir() {
        return incomingDir;
    }

    public void setIncomingDir(String incomingDir) {
        this.incomingDir = incomingDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public List<List<String>> getCountryAliases() {
        return countryAliases;
    }

    public void setCountryAliases(List<List<String>> countryAliases) {
        this.countryAliases = countryAliases;
    }

    public Edition getIncomingEdition() {
        return incomingEdition;
    }

    public void setIncomingEdition(Edition incomingEdition) {
        this.incomingEdition = incomingEdition;
    }

    public Tally getTally() {
        return tally;
    }

    public void setTally(Tally tally) {
        this.tally = tally;
    }

    /**
     * Games row of the edition being integrated; the bundle itself carries no such row.
     */
    public static class Edition {

        private String edition = "2024 Summer Olympics";
        private String editionId = "63";
        private String editionUrl = "/editions/63";
        private String year = "2024";
        private String city = "Paris";
        private String countryFlagUrl = "";
        private String countryNoc = "FRA";
        private String startDate = "26-Jul-2024";
        private String endDate = "11-Aug-2024";
        private String competitionDate = "24-Jul-2024 to 11-Aug-2024";

        public String getEdition() {
            return edition;
        }

        public void setEdition(String edition) {
            this.edition = edition;
        }

        public String getEditionId() {
            return editionId;
        }

        public void setEditionId(String editionId) {
            this.editionId = editionId;
        }

        public String getEditionUrl() {
            return editionUrl;
        }

        public void setEditionUrl(String editionUrl) {
            this.editionUrl = editionUrl;
        }

        public String getYear() {
            return year;
        }

        public void setYear(String year) {
            this.year = year;
        }

        public String getCity() {
            return city;
        }

        public void setCity(String city) {
            this.city = city;
        }

        public String getCountryFlagUrl() {
            return countryFlagUrl;
        }

        public void setCountryFlagUrl(String countryFlagUrl) {
            this.countryFlagUrl = countryFlagUrl;
        }

        public String getCountryNoc() {
            return countryNoc;
        }

        public void setCountryNoc(String countryNoc) {
            this.countryNoc = countryNoc;
        }

        public String getStartDate() {
            return startDate;
        }

        public void setStartDate(String startDate) {
            this.startDate = startDate;
        }

        public String getEndDate() {
            return endDate;
        }

        public void setEndDate(String endDate) {
            this.endDate = endDate;
        }

        public String getCompetitionDate() {
            return competitionDate;
        }

        public void setCompetitionDate(String competitionDate) {
            this.competitionDate = competitionDate;
        }
    }

    public static class Tally {

        /** Count a team medal once per (edition, sport, event, country, medal). */
        private boolean collapseTeamMedals = false;

        public boolean isCollapseTeamMedals() {
            return collapseTeamMedals;
        }

        public void setCollapseTeamMedals(boolean collapseTeamMedals) {
            this.collapseTeamMedals = collapseTeamMedals;
        }
    }
}
