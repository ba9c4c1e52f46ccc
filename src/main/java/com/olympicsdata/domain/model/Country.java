package com.olympicsdata.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row of the country (NOC) table.
 */
public class Country {

    /** NOC code, primary key. */
    private String noc;

    /** Display name. */
    private String name;

    private Map<String, String> extraColumns = new LinkedHashMap<>();

    public Country() {
    }

    public Country(String noc, String name) {
        this.noc = noc;
        this.name = name;
    }

    public Country(Country other) {
        this.noc = other.noc;
        this.name = other.name;
        this.extraColumns = new LinkedHashMap<>(other.extraColumns);
    }

    public String getNoc() {
        return noc;
    }

    public void setNoc(String noc) {
        this.noc = noc;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Map<String, String> getExtraColumns() {
        return extraColumns;
    }

    public void setExtraColumns(Map<String, String> extraColumns) {
        this.extraColumns = extraColumns;
    }
}
