package com.olympicsdata.domain.reconcile;

import java.util.Optional;
import java.util.SortedSet;

/**
 * Athlete matching tiers, declared in the order they are tried.
 */
public enum AthleteMatchStrategy implements MatchStrategy<AthleteNaturalKey> {

    BIRTH_DATE_AND_NATIONALITY("name+born+nationality", MatchConfidence.HIGH) {
        @Override
        public Optional<String> match(AthleteNaturalKey key, NaturalKeyIndex index) {
            if (key.born() == null) {
                return Optional.empty();
            }
            return index.athleteByExactKey(key.name(), key.born(), key.nationalityNoc());
        }
    },

    BIRTH_DATE_AND_REPRESENTED_NOC("name+born+represented-noc", MatchConfidence.HIGH) {
        @Override
        public Optional<String> match(AthleteNaturalKey key, NaturalKeyIndex index) {
            if (key.born() == null || key.representedNoc() == null
                || key.representedNoc().equals(key.nationalityNoc())) {
                return Optional.empty();
            }
            return index.athleteByExactKey(key.name(), key.born(), key.representedNoc());
        }
    },

    /**
     * Name and nationality only. Used when the incoming birth date is unknown, or
     * against existing athletes whose birth date is unknown. Namesakes are narrowed
     * to those already entered in the incoming edition; still ambiguous candidates
     * are not matched.
     */
    NAME_AND_NATIONALITY("name+nationality", MatchConfidence.LOW) {
        @Override
        public Optional<String> match(AthleteNaturalKey key, NaturalKeyIndex index) {
            return uniqueNameMatch(key, key.nationalityNoc(), index);
        }
    },

    NAME_AND_REPRESENTED_NOC("name+represented-noc", MatchConfidence.LOW) {
        @Override
        public Optional<String> match(AthleteNaturalKey key, NaturalKeyIndex index) {
            if (key.representedNoc() == null || key.representedNoc().equals(key.nationalityNoc())) {
                return Optional.empty();
            }
            return uniqueNameMatch(key, key.representedNoc(), index);
        }
    };

    private final String strategyName;
    private final MatchConfidence confidence;

    AthleteMatchStrategy(String strategyName, MatchConfidence confidence) {
        this.strategyName = strategyName;
        this.confidence = confidence;
    }

    private static Optional<String> uniqueNameMatch(AthleteNaturalKey key, String noc, NaturalKeyIndex index) {
        SortedSet<String> candidates = key.born() == null
            ? index.athletesByNameAndNoc(key.name(), noc)
            : index.undatedAthletesByNameAndNoc(key.name(), noc);
        if (candidates.size() > 1) {
            candidates = index.enteredInIncomingEdition(candidates);
        }
        return candidates.size() == 1 ? Optional.of(candidates.first()) : Optional.empty();
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
