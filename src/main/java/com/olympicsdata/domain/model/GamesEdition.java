package com.olympicsdata.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row of the games edition table.
 */
public class GamesEdition {

    /** Display name, e.g. "2024 Summer Olympics". */
    private String edition;

    /** Primary key. */
    private String editionId;

    private String editionUrl;

    private String year;

    private String city;

    private String countryFlagUrl;

    /** Host NOC. */
    private String countryNoc;

    private NormalizedDate startDate = NormalizedDate.empty();

    private NormalizedDate endDate = NormalizedDate.empty();

    private DateRange competitionDates = DateRange.unknown();

    /** Raw isHeld cell; non-empty when the games were not held (e.g. cancelled by war). */
    private String heldNote = "";

    private Map<String, String> extraColumns = new LinkedHashMap<>();

    public GamesEdition() {
    }

    public GamesEdition(GamesEdition other) {
        this.edition = other.edition;
        this.editionId = other.editionId;
        this.editionUrl = other.editionUrl;
        this.year = other.year;
        this.city = other.city;
        this.countryFlagUrl = other.countryFlagUrl;
        this.countryNoc = other.countryNoc;
        this.startDate = other.startDate;
        this.endDate = other.endDate;
        this.competitionDates = other.competitionDates;
        this.heldNote = other.heldNote;
        this.extraColumns = new LinkedHashMap<>(other.extraColumns);
    }

    public boolean isHeld() {
        return heldNote == null || heldNote.isBlank();
    }

    /**
     * Date ages are measured against: the official start date, or the first
     * competition day when the start date is unknown.
     */
    public NormalizedDate referenceDate() {
        return startDate.isKnown() ? startDate : competitionDates.start();
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

    public NormalizedDate getStartDate() {
        return startDate;
    }

    public void setStartDate(NormalizedDate startDate) {
        this.startDate = startDate == null ? NormalizedDate.empty() : startDate;
    }

    public NormalizedDate getEndDate() {
        return endDate;
    }

    public void setEndDate(NormalizedDate endDate) {
        this.endDate = endDate == null ? NormalizedDate.empty() : endDate;
    }

    public DateRange getCompetitionDates() {
        return competitionDates;
    }

    public void setCompetitionDates(DateRange competitionDates) {
        this.competitionDates = competitionDates == null ? DateRange.unknown() : competitionDates;
    }

    public String getHeldNote() {
        return heldNote;
    }

    public void setHeldNote(String heldNote) {
        this.heldNote = heldNote == null ? "" : heldNote;
    }

    public Map<String, String> getExtraColumns() {
        return extraColumns;
    }

    public void setExtraColumns(Map<String, String> extraColumns) {
        this.extraColumns = extraColumns;
    }
}
