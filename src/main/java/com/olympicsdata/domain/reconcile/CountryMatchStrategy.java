package com.olympicsdata.domain.reconcile;

import java.util.Optional;

/**
 * Country matching tiers, declared in the order they are tried.
 */
public enum CountryMatchStrategy implements MatchStrategy<CountryNaturalKey> {

    DISPLAY_NAME("name", MatchConfidence.HIGH) {
        @Override
        public Optional<String> match(CountryNaturalKey key, NaturalKeyIndex index) {
            return index.countryByName(key.name());
        }
    },

    ALIAS("alias", MatchConfidence.HIGH) {
        @Override
        public Optional<String> match(CountryNaturalKey key, NaturalKeyIndex index) {
            return index.countryByAlias(key.name());
        }
    },

    CODE("code", MatchConfidence.HIGH) {
        @Override
        public Optional<String> match(CountryNaturalKey key, NaturalKeyIndex index) {
            return index.hasCountryCode(key.code()) ? Optional.of(key.code()) : Optional.empty();
        }
    };

    private final String strategyName;
    private final MatchConfidence confidence;

    CountryMatchStrategy(String strategyName, MatchConfidence confidence) {
        this.strategyName = strategyName;
        this.confidence = confidence;
    }

    @Override
    public String strategyName() {
        return strategyName;
    }

    @Override
    public MatchConfidence confidence() {
        return confidence;
    }
}
