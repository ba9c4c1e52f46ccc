package com.olympicsdata.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row of the event result table: one athlete in one event of one edition.
 */
public class EventResult {

    private String edition;

    /** Foreign key into the games table. */
    private String editionId;

    /** Foreign key into the country table. */
    private String countryNoc;

    private String sport;

    private String event;

    /** Shared by every row of the same (edition, sport, event). */
    private String resultId;

    /** Athlete display name as recorded for this result. */
    private String athlete;

    /** Foreign key into the athlete table. */
    private String athleteId;

    private String pos;

    private Medal medal = Medal.NONE;

    private boolean teamSport;

    /** Age in whole years at the games start, null when unknown. */
    private Integer age;

    private Map<String, String> extraColumns = new LinkedHashMap<>();

    public EventResult() {
    }

    public EventResult(EventResult other) {
        this.edition = other.edition;
        this.editionId = other.editionId;
        this.countryNoc = other.countryNoc;
        this.sport = other.sport;
        this.event = other.event;
        this.resultId = other.resultId;
        this.athlete = other.athlete;
        this.athleteId = other.athleteId;
        this.pos = other.pos;
        this.medal = other.medal;
        this.teamSport = other.teamSport;
        this.age = other.age;
        this.extraColumns = new LinkedHashMap<>(other.extraColumns);
    }

    /** Identity of a result row: one athlete, one event, one edition. */
    public String identityKey() {
        return String.join("|", athleteId, editionId, sport, event);
    }

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

    public String getCountryNoc() {
        return countryNoc;
    }

    public void setCountryNoc(String countryNoc) {
        this.countryNoc = countryNoc;
    }

    public String getSport() {
        return sport;
    }

    public void setSport(String sport) {
        this.sport = sport;
    }

    public String getEvent() {
        return event;
    }

    public void setEvent(String event) {
        this.event = event;
    }

    public String getResultId() {
        return resultId;
    }

    public void setResultId(String resultId) {
        this.resultId = resultId;
    }

    public String getAthlete() {
        return athlete;
    }

    public void setAthlete(String athlete) {
        this.athlete = athlete;
    }

    public String getAthleteId() {
        return athleteId;
    }

    public void setAthleteId(String athleteId) {
        this.athleteId = athleteId;
    }

    public String getPos() {
        return pos;
    }

    public void setPos(String pos) {
        this.pos = pos;
    }

    public Medal getMedal() {
        return medal;
    }

    public void setMedal(Medal medal) {
        this.medal = medal == null ? Medal.NONE : medal;
    }

    public boolean isTeamSport() {
        return teamSport;
    }

    public void setTeamSport(boolean teamSport) {
        this.teamSport = teamSport;
    }

    public Integer getAge() {
        return age;
    }

    public void setAge(Integer age) {
        this.age = age;
    }

    public Map<String, String> getExtraColumns() {
        return extraColumns;
    }

    public void setExtraColumns(Map<String, String> extraColumns) {
        this.extraColumns = extraColumns;
    }
}
