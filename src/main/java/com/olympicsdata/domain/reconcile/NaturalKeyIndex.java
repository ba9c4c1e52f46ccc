package com.olympicsdata.domain.reconcile;

import com.olympicsdata.domain.error.DuplicateIdentifierCollisionException;
import com.olympicsdata.domain.model.Athlete;
import com.olympicsdata.domain.model.Country;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.EventResult;
import com.olympicsdata.domain.service.NormalizationUtils;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Natural key → identifier lookups for one merge run. Built from the base
 * snapshot, extended as identifiers are minted, and discarded with the run.
 * Only the reconciler mutates it.
 */
public final class NaturalKeyIndex {

    /** Numeric ids sort numerically, anything else after them lexically. */
    static final Comparator<String> IDENTIFIER_ORDER = Comparator
        .comparing((String id) -> !isNumeric(id))
        .thenComparing(id -> isNumeric(id) ? Long.parseLong(id) : 0L)
        .thenComparing(Comparator.naturalOrder());

    private static final String MINTED_COUNTRY_PREFIX = "X";

    private final CountryAliasTable aliases;

    private final Map<ExactKey, String> athletesByExactKey = new HashMap<>();
    private final Map<NameNocKey, SortedSet<String>> athletesByNameAndNoc = new HashMap<>();
    private final Map<NameNocKey, SortedSet<String>> undatedAthletesByNameAndNoc = new HashMap<>();
    private final Set<String> athleteIds = new HashSet<>();
    private final Map<String, Set<String>> editionsByAthlete = new HashMap<>();
    private String incomingEditionId;
    private long nextAthleteId = 1;

    private final Map<String, String> countriesByName = new HashMap<>();
    private final Map<String, String> countriesByAlias = new HashMap<>();
    private final Set<String> countryCodes = new HashSet<>();
    private int nextCountrySequence = 1;

    private NaturalKeyIndex(CountryAliasTable aliases) {
        this.aliases = aliases;
    }

    /**
     * Indexes the base tables. Rows are visited in identifier order so that,
     * when two base rows share a natural key, the lowest identifier wins.
     */
    public static NaturalKeyIndex of(Dataset base, CountryAliasTable aliases) {
        NaturalKeyIndex index = new NaturalKeyIndex(aliases);

        base.getCountries().rows().stream()
            .sorted(Comparator.comparing(Country::getNoc, IDENTIFIER_ORDER))
            .forEach(c -> index.registerCountry(c.getNoc(), NormalizationUtils.normalizeText(c.getName())));

        long maxId = 0;
        for (Athlete athlete : base.getAthletes().rows()) {
            if (isNumeric(athlete.getAthleteId())) {
                maxId = Math.max(maxId, Long.parseLong(athlete.getAthleteId()));
            }
        }
        index.nextAthleteId = maxId + 1;

        base.getAthletes().rows().stream()
            .sorted(Comparator.comparing(Athlete::getAthleteId, IDENTIFIER_ORDER))
            .forEach(a -> index.registerAthlete(a.getAthleteId(), new AthleteNaturalKey(
                NormalizationUtils.normalizeText(a.getName()),
                a.getBorn().isKnown() ? a.getBorn().date() : null,
                a.getCountryNoc(),
                a.getCountryNoc()
            )));

        for (EventResult result : base.getResults()) {
            index.editionsByAthlete.computeIfAbsent(result.getAthleteId(), k -> new HashSet<>())
                .add(result.getEditionId());
        }
        return index;
    }

    /**
     * Sets the edition the bundle being reconciled belongs to.
     */
    void enterEdition(String editionId) {
        this.incomingEditionId = editionId;
    }

    /**
     * The candidates that already hold a result in the incoming edition. These are
     * the identifiers an earlier merge of the same bundle gave out.
     */
    SortedSet<String> enteredInIncomingEdition(SortedSet<String> candidates) {
        SortedSet<String> entered = new TreeSet<>(IDENTIFIER_ORDER);
        if (incomingEditionId == null) {
            return entered;
        }
        for (String id : candidates) {
            if (editionsByAthlete.getOrDefault(id, Set.of()).contains(incomingEditionId)) {
                entered.add(id);
            }
        }
        return entered;
    }

    Optional<String> athleteByExactKey(String name, LocalDate born, String noc) {
        return Optional.ofNullable(athletesByExactKey.get(new ExactKey(name, born, noc)));
    }

    SortedSet<String> athletesByNameAndNoc(String name, String noc) {
        return athletesByNameAndNoc.getOrDefault(new NameNocKey(name, noc), Collections.emptySortedSet());
    }

    SortedSet<String> undatedAthletesByNameAndNoc(String name, String noc) {
        return undatedAthletesByNameAndNoc.getOrDefault(new NameNocKey(name, noc), Collections.emptySortedSet());
    }

    Optional<String> countryByName(String name) {
        return Optional.ofNullable(countriesByName.get(name));
    }

    Optional<String> countryByAlias(String name) {
        return Optional.ofNullable(countriesByAlias.get(name));
    }

    boolean hasCountryCode(String code) {
        return code != null && countryCodes.contains(code);
    }

    /**
     * Records the keys of an athlete. Keys already held by another identifier are kept.
     */
    void registerAthlete(String athleteId, AthleteNaturalKey key) {
        athleteIds.add(athleteId);
        if (key.isEmpty()) {
            return;
        }
        registerAthleteUnder(athleteId, key, key.nationalityNoc());
        if (key.representedNoc() != null && !key.representedNoc().equals(key.nationalityNoc())) {
            registerAthleteUnder(athleteId, key, key.representedNoc());
        }
    }

    private void registerAthleteUnder(String athleteId, AthleteNaturalKey key, String noc) {
        NameNocKey nameNoc = new NameNocKey(key.name(), noc);
        athletesByNameAndNoc.computeIfAbsent(nameNoc, k -> new TreeSet<>(IDENTIFIER_ORDER)).add(athleteId);
        if (key.born() == null) {
            undatedAthletesByNameAndNoc.computeIfAbsent(nameNoc, k -> new TreeSet<>(IDENTIFIER_ORDER)).add(athleteId);
        } else {
            athletesByExactKey.putIfAbsent(new ExactKey(key.name(), key.born(), noc), athleteId);
        }
    }

    /**
     * Records a country and the aliases of its name.
     */
    void registerCountry(String code, String normalizedName) {
        countryCodes.add(code);
        if (normalizedName == null || normalizedName.isEmpty()) {
            return;
        }
        countriesByName.putIfAbsent(normalizedName, code);
        for (String alias : aliases.aliasesOf(normalizedName)) {
            countriesByAlias.putIfAbsent(alias, code);
        }
    }

    /**
     * Next athlete identifier, one above the highest numeric identifier seen.
     *
     * @throws DuplicateIdentifierCollisionException if the identifier is somehow taken
     */
    String mintAthleteId() {
        String id = String.valueOf(nextAthleteId++);
        if (athleteIds.contains(id)) {
            throw new DuplicateIdentifierCollisionException(Dataset.ATHLETES, id);
        }
        return id;
    }

    /**
     * Country code for a country nothing matched: the source's own code when it is
     * free, otherwise the next free code of the X01, X02, ... namespace.
     */
    String mintCountryCode(String preferred) {
        if (preferred != null && !preferred.isEmpty()) {
            if (countryCodes.contains(preferred)) {
                throw new DuplicateIdentifierCollisionException(Dataset.COUNTRIES, preferred);
            }
            return preferred;
        }
        String code;
        do {
            code = String.format("%s%02d", MINTED_COUNTRY_PREFIX, nextCountrySequence++);
        } while (countryCodes.contains(code));
        return code;
    }

    static boolean isNumeric(String id) {
        if (id == null || id.isEmpty() || id.length() > 18) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private record ExactKey(String name, LocalDate born, String noc) {
    }

    private record NameNocKey(String name, String noc) {
    }
}
