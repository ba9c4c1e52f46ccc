package com.olympicsdata.domain.reconcile;

import com.olympicsdata.domain.error.RejectedRow;
import com.olympicsdata.domain.error.RejectionReason;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.IncomingAthlete;
import com.olympicsdata.domain.model.IncomingBundle;
import com.olympicsdata.domain.model.IncomingCountry;
import com.olympicsdata.domain.service.NormalizationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps incoming countries and athletes onto base identifiers, minting new ones
 * when no tier of the natural-key match succeeds.
 *
 * <p>Incoming rows are processed in natural-key order, so the identifiers a
 * bundle receives do not depend on the order of its files.
 */
public class IdentifierReconciler {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierReconciler.class);

    private static final Comparator<AthleteNaturalKey> ATHLETE_KEY_ORDER = Comparator
        .comparing(AthleteNaturalKey::name)
        .thenComparing(AthleteNaturalKey::born, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(AthleteNaturalKey::nationalityNoc, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(AthleteNaturalKey::representedNoc, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final CountryAliasTable aliases;
    private final List<MatchStrategy<CountryNaturalKey>> countryStrategies;
    private final List<MatchStrategy<AthleteNaturalKey>> athleteStrategies;

    public IdentifierReconciler(CountryAliasTable aliases) {
        this.aliases = aliases;
        this.countryStrategies = List.<MatchStrategy<CountryNaturalKey>>of(CountryMatchStrategy.values());
        this.athleteStrategies = List.<MatchStrategy<AthleteNaturalKey>>of(AthleteMatchStrategy.values());
    }

    /**
     * Builds the natural-key index for one run over the given base snapshot.
     */
    public NaturalKeyIndex indexBase(Dataset base) {
        return NaturalKeyIndex.of(base, aliases);
    }

    /**
     * Reconciles a whole bundle: countries first, since athlete keys use the
     * reconciled country codes.
     */
    public ReconciliationResult reconcile(IncomingBundle bundle, NaturalKeyIndex index) {
        index.enterEdition(bundle.edition().getEditionId());
        List<RejectedRow> rejections = new ArrayList<>();
        Map<String, Resolution> countries = new LinkedHashMap<>();
        Map<String, Resolution> athletes = new LinkedHashMap<>();

        List<IncomingCountry> sortedCountries = bundle.countries().stream()
            .sorted(Comparator.comparing((IncomingCountry c) -> NormalizationUtils.normalizeText(c.name()))
                .thenComparing(c -> nullToEmpty(c.code())))
            .toList();
        for (IncomingCountry country : sortedCountries) {
            Optional<Resolution> resolution = resolveCountry(country, index);
            if (resolution.isEmpty()) {
                rejections.add(new RejectedRow(Dataset.COUNTRIES, nullToEmpty(country.code()),
                    RejectionReason.MISSING_NATURAL_KEY, "country has neither a name nor a code"));
                continue;
            }
            countries.putIfAbsent(ReconciliationResult.countryKey(country), resolution.get());
        }

        ReconciliationResult countryView = new ReconciliationResult(countries, Map.of(), List.of());
        List<KeyedAthlete> keyedAthletes = bundle.athletes().stream()
            .map(a -> new KeyedAthlete(a, athleteKey(a, countryView)))
            .sorted(Comparator.comparing(KeyedAthlete::key, ATHLETE_KEY_ORDER)
                .thenComparing(k -> nullToEmpty(k.athlete().code())))
            .toList();
        for (KeyedAthlete keyed : keyedAthletes) {
            IncomingAthlete athlete = keyed.athlete();
            if (keyed.key().isEmpty() || nullToEmpty(athlete.code()).isEmpty()) {
                rejections.add(new RejectedRow(Dataset.ATHLETES, nullToEmpty(athlete.code()),
                    RejectionReason.MISSING_NATURAL_KEY, "athlete has no name or no code"));
                logger.warn("Rejected incoming athlete {}: missing natural key", athlete.code());
                continue;
            }
            if (athletes.containsKey(athlete.code())) {
                continue;
            }
            Resolution resolution = resolveAthlete(keyed.key(), index);
            if (resolution.confidence() == MatchConfidence.LOW) {
                logger.info("Low-confidence match for athlete {} ({}) -> {} via {}",
                    athlete.code(), athlete.displayName(), resolution.identifier(), resolution.strategy());
            }
            athletes.put(athlete.code(), resolution);
        }

        ReconciliationResult result = new ReconciliationResult(countries, athletes, rejections);
        logger.info("Reconciled {} countries ({} new) and {} athletes ({} new, {} low confidence), {} rejected",
            countries.size(), result.countCountries(MatchConfidence.NEW),
            athletes.size(), result.countAthletes(MatchConfidence.NEW), result.countAthletes(MatchConfidence.LOW),
            rejections.size());
        return result;
    }

    /**
     * Resolves one incoming country, minting a code when nothing matches.
     *
     * @return empty when the row has neither name nor code
     */
    public Optional<Resolution> resolveCountry(IncomingCountry country, NaturalKeyIndex index) {
        CountryNaturalKey key = new CountryNaturalKey(
            NormalizationUtils.normalizeText(country.name()), nullToEmpty(country.code()).trim());
        if (key.isEmpty()) {
            return Optional.empty();
        }
        Optional<Resolution> matched = firstMatch(countryStrategies, key, index);
        if (matched.isPresent()) {
            return matched;
        }
        String code = index.mintCountryCode(key.code());
        index.registerCountry(code, key.name());
        return Optional.of(Resolution.minted(code));
    }

    /**
     * Resolves one athlete key, minting an identifier when nothing matches.
     * The key is registered either way so a repeat of it resolves identically.
     */
    public Resolution resolveAthlete(AthleteNaturalKey key, NaturalKeyIndex index) {
        Optional<Resolution> matched = firstMatch(athleteStrategies, key, index);
        if (matched.isPresent()) {
            index.registerAthlete(matched.get().identifier(), key);
            return matched.get();
        }
        String id = index.mintAthleteId();
        index.registerAthlete(id, key);
        return Resolution.minted(id);
    }

    /**
     * Natural key of an incoming athlete with its NOC codes mapped through the
     * country resolutions. A missing nationality falls back to the represented NOC.
     */
    public static AthleteNaturalKey athleteKey(IncomingAthlete athlete, ReconciliationResult countries) {
        String represented = countries.countryCode(nullToEmpty(athlete.countryCode()).trim());
        String nationalityCode = nullToEmpty(athlete.nationalityCode()).trim();
        String nationality = nationalityCode.isEmpty() ? represented : countries.countryCode(nationalityCode);
        LocalDate born = athlete.born() != null && athlete.born().isKnown() ? athlete.born().date() : null;
        return new AthleteNaturalKey(NormalizationUtils.normalizeText(athlete.displayName()), born,
            nationality, represented);
    }

    private static <K> Optional<Resolution> firstMatch(List<MatchStrategy<K>> strategies, K key,
                                                       NaturalKeyIndex index) {
        for (MatchStrategy<K> strategy : strategies) {
            Optional<String> id = strategy.match(key, index);
            if (id.isPresent()) {
                return Optional.of(new Resolution(id.get(), strategy.strategyName(), strategy.confidence()));
            }
        }
        return Optional.empty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record KeyedAthlete(IncomingAthlete athlete, AthleteNaturalKey key) {
    }
}
