package com.olympicsdata.domain.reconcile;

import com.olympicsdata.domain.error.RejectedRow;
import com.olympicsdata.domain.model.IncomingCountry;
import com.olympicsdata.domain.service.NormalizationUtils;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Identifier assignments for one incoming bundle, keyed by the bundle's own
 * codes, plus the rows that could not be reconciled. A country the bundle lists
 * without a code is keyed by its normalized name instead.
 */
public class ReconciliationResult {

    private static final String NAME_KEY_PREFIX = "name:";

    private final Map<String, Resolution> countries;
    private final Map<String, Resolution> athletes;
    private final List<RejectedRow> rejections;

    public ReconciliationResult(Map<String, Resolution> countries,
                                Map<String, Resolution> athletes,
                                List<RejectedRow> rejections) {
        this.countries = Collections.unmodifiableMap(countries);
        this.athletes = Collections.unmodifiableMap(athletes);
        this.rejections = List.copyOf(rejections);
    }

    public Optional<Resolution> country(String incomingCode) {
        return Optional.ofNullable(countries.get(incomingCode));
    }

    public Optional<Resolution> country(IncomingCountry incoming) {
        return country(countryKey(incoming));
    }

    /**
     * Key an incoming country is stored under: its code, or its normalized name when it has none.
     */
    public static String countryKey(IncomingCountry incoming) {
        String code = incoming.code() == null ? "" : incoming.code().trim();
        return code.isEmpty() ? NAME_KEY_PREFIX + NormalizationUtils.normalizeText(incoming.name()) : code;
    }

    public Optional<Resolution> athlete(String incomingCode) {
        return Optional.ofNullable(athletes.get(incomingCode));
    }

    /**
     * Base country code for a bundle NOC code. Codes the bundle never listed pass through unchanged.
     */
    public String countryCode(String incomingCode) {
        Resolution resolution = countries.get(incomingCode);
        return resolution != null ? resolution.identifier() : incomingCode;
    }

    public Map<String, Resolution> getCountries() {
        return countries;
    }

    public Map<String, Resolution> getAthletes() {
        return athletes;
    }

    public List<RejectedRow> getRejections() {
        return rejections;
    }

    public long countAthletes(MatchConfidence confidence) {
        return athletes.values().stream().filter(r -> r.confidence() == confidence).count();
    }

    public long countCountries(MatchConfidence confidence) {
        return countries.values().stream().filter(r -> r.confidence() == confidence).count();
    }
}
