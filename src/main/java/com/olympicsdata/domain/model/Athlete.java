package com.olympicsdata.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row of the athlete table.
 */
public class Athlete {

    /** Primary key, numeric text. */
    private String athleteId;

    /** Display name. */
    private String name;

    private String sex;

    /** Birth date; unknown when missing, partial or malformed. */
    private NormalizedDate born = NormalizedDate.empty();

    private String height;

    private String weight;

    /** Display name of the represented country. */
    private String country;

    /** Foreign key into the country table. */
    private String countryNoc;

    /** Columns of the source schema this model does not interpret, in source order. */
    private Map<String, String> extraColumns = new LinkedHashMap<>();

    public Athlete() {
    }

    public Athlete(Athlete other) {
        this.athleteId = other.athleteId;
        this.name = other.name;
        this.sex = other.sex;
        this.born = other.born;
        this.height = other.height;
        this.weight = other.weight;
        this.country = other.country;
        this.countryNoc = other.countryNoc;
        this.extraColumns = new LinkedHashMap<>(other.extraColumns);
    }

    public String getAthleteId() {
        return athleteId;
    }

    public void setAthleteId(String athleteId) {
        this.athleteId = athleteId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSex() {
        return sex;
    }

    public void setSex(String sex) {
        this.sex = sex;
    }

    public NormalizedDate getBorn() {
        return born;
    }

    public void setBorn(NormalizedDate born) {
        this.born = born == null ? NormalizedDate.empty() : born;
    }

    public String getHeight() {
        return height;
    }

    public void setHeight(String height) {
        this.height = height;
    }

    public String getWeight() {
        return weight;
    }

    public void setWeight(String weight) {
        this.weight = weight;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getCountryNoc() {
        return countryNoc;
    }

    public void setCountryNoc(String countryNoc) {
        this.countryNoc = countryNoc;
    }

    public Map<String, String> getExtraColumns() {
        return extraColumns;
    }

    public void setExtraColumns(Map<String, String> extraColumns) {
        this.extraColumns = extraColumns;
    }
}
