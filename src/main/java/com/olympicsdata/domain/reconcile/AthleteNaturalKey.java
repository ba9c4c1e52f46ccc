package com.olympicsdata.domain.reconcile;

import java.time.LocalDate;

/**
 * Natural key of an athlete. NOC codes are already mapped onto base country codes.
 *
 * @param name           normalized full name
 * @param born           birth date, null when unknown
 * @param nationalityNoc NOC of nationality
 * @param representedNoc NOC represented at the edition
 */
public record AthleteNaturalKey(String name, LocalDate born, String nationalityNoc, String representedNoc) {

    public boolean isEmpty() {
        return name == null || name.isEmpty();
    }
}
