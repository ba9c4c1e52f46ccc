package com.olympicsdata.domain.reconcile;

/**
 * Natural key of a country: normalized display name plus the code the source used.
 */
public record CountryNaturalKey(String name, String code) {

    public boolean isEmpty() {
        return (name == null || name.isEmpty()) && (code == null || code.isEmpty());
    }
}
