package com.olympicsdata.domain.reconcile;

import com.olympicsdata.domain.DatasetFixtures;
import com.olympicsdata.domain.error.RejectedRow;
import com.olympicsdata.domain.error.RejectionReason;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.IncomingAthlete;
import com.olympicsdata.domain.model.IncomingBundle;
import com.olympicsdata.domain.model.IncomingCountry;
import com.olympicsdata.domain.model.Medal;
import com.olympicsdata.domain.model.NormalizedDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.olympicsdata.domain.DatasetFixtures.date;
import static com.olympicsdata.domain.DatasetFixtures.incoming;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IdentifierReconciler.
 */
class IdentifierReconcilerTest {

    private IdentifierReconciler reconciler;
    private Dataset base;

    @BeforeEach
    void setUp() {
        reconciler = new IdentifierReconciler(
            new CountryAliasTable(List.of(List.of("United Kingdom", "Great Britain"))));
        base = DatasetFixtures.base();
    }

    @Test
    void testCountryResolvedByNameAliasAndMinting() {
        ReconciliationResult result = reconciler.reconcile(DatasetFixtures.parisBundle(), reconciler.indexBase(base));

        assertEquals(new Resolution("FRA", "name", MatchConfidence.HIGH), result.country("FRA").orElseThrow());
        assertEquals(new Resolution("GBR", "alias", MatchConfidence.HIGH), result.country("GBR").orElseThrow());
        assertEquals(Resolution.minted("KOS"), result.country("KOS").orElseThrow());
        assertEquals(1, result.countCountries(MatchConfidence.NEW));
    }

    @Test
    void testAliasDoesNotMintWhenCodesDiffer() {
        IncomingCountry uk = new IncomingCountry("GB", "Great Britain");

        Optional<Resolution> resolution = reconciler.resolveCountry(uk, reconciler.indexBase(base));

        assertTrue(resolution.isPresent());
        assertEquals("GBR", resolution.get().identifier());
        assertFalse(resolution.get().isMinted());
    }

    @Test
    void testCountryWithoutCodeGetsNamespacedCode() {
        NaturalKeyIndex index = reconciler.indexBase(base);

        Resolution first = reconciler.resolveCountry(new IncomingCountry("", "Refugee Olympic Team"), index).orElseThrow();
        Resolution second = reconciler.resolveCountry(new IncomingCountry(" ", "Individual Neutral Athletes"), index)
            .orElseThrow();
        Resolution again = reconciler.resolveCountry(new IncomingCountry("", "Refugee Olympic Team"), index)
            .orElseThrow();

        assertEquals("X01", first.identifier());
        assertEquals("X02", second.identifier());
        assertEquals("X01", again.identifier());
        assertFalse(again.isMinted());
    }

    @Test
    void testCountryWithoutNameOrCodeIsRejected() {
        assertTrue(reconciler.resolveCountry(new IncomingCountry("", ""), reconciler.indexBase(base)).isEmpty());
    }

    @Test
    void testAthleteMatchTiers() {
        ReconciliationResult result = reconciler.reconcile(DatasetFixtures.parisBundle(), reconciler.indexBase(base));

        Resolution riner = result.athlete("1532872").orElseThrow();
        assertEquals("1", riner.identifier());
        assertEquals("name+born+nationality", riner.strategy());
        assertEquals(MatchConfidence.HIGH, riner.confidence());

        // base Jane Doe has no birth date
        Resolution doe = result.athlete("1900001").orElseThrow();
        assertEquals("2", doe.identifier());
        assertEquals("name+nationality", doe.strategy());
        assertEquals(MatchConfidence.LOW, doe.confidence());
        assertEquals(1, result.countAthletes(MatchConfidence.LOW));
    }

    @Test
    void testNewAthletesGetIdsAboveMaximumInNaturalKeyOrder() {
        ReconciliationResult result = reconciler.reconcile(DatasetFixtures.parisBundle(), reconciler.indexBase(base));

        // Dion Gashi sorts before Leon Marchand
        assertEquals(Resolution.minted("4"), result.athlete("1900002").orElseThrow());
        assertEquals(Resolution.minted("5"), result.athlete("1906722").orElseThrow());
    }

    @Test
    void testAssignmentDoesNotDependOnInputOrder() {
        IncomingBundle bundle = DatasetFixtures.parisBundle();
        List<IncomingAthlete> reversed = new ArrayList<>(bundle.athletes());
        Collections.reverse(reversed);
        List<IncomingCountry> reversedCountries = new ArrayList<>(bundle.countries());
        Collections.reverse(reversedCountries);
        IncomingBundle shuffled = new IncomingBundle(bundle.edition(), reversed, reversedCountries,
            bundle.events(), bundle.teamEntries(), bundle.medallists());

        ReconciliationResult first = reconciler.reconcile(bundle, reconciler.indexBase(base));
        ReconciliationResult second = reconciler.reconcile(shuffled, reconciler.indexBase(base));

        assertEquals(first.getAthletes(), second.getAthletes());
        assertEquals(first.getCountries(), second.getCountries());
    }

    @Test
    void testSameNaturalKeyTwiceResolvesToSameIdentifier() {
        IncomingBundle bundle = DatasetFixtures.withAthletes(DatasetFixtures.parisBundle(), List.of(
            incoming("A", "Leon Marchand", date(2002, 5, 17), "FRA", List.of(), List.of()),
            incoming("B", "Leon Marchand", date(2002, 5, 17), "FRA", List.of(), List.of())), List.of());

        ReconciliationResult result = reconciler.reconcile(bundle, reconciler.indexBase(base));

        assertEquals("4", result.athlete("A").orElseThrow().identifier());
        assertEquals("4", result.athlete("B").orElseThrow().identifier());
        assertEquals(1, result.countAthletes(MatchConfidence.NEW));
    }

    @Test
    void testAmbiguousFallbackMintsNewIdentifier() {
        base.getAthletes().insert(DatasetFixtures.athlete("7", "John Smith", NormalizedDate.empty(),
            "United States", "USA"));
        base.getAthletes().insert(DatasetFixtures.athlete("8", "John Smith", NormalizedDate.empty(),
            "United States", "USA"));
        IncomingBundle bundle = DatasetFixtures.withAthletes(DatasetFixtures.parisBundle(), List.of(
            incoming("JS", "John Smith", date(1990, 1, 1), "USA", List.of(), List.of())), List.of());

        ReconciliationResult result = reconciler.reconcile(bundle, reconciler.indexBase(base));

        assertEquals(Resolution.minted("9"), result.athlete("JS").orElseThrow());
    }

    @Test
    void testNamesakeAlreadyEnteredInEditionIsMatched() {
        base.getAthletes().insert(DatasetFixtures.athlete("7", "John Smith", NormalizedDate.empty(),
            "United States", "USA"));
        base.getAthletes().insert(DatasetFixtures.athlete("8", "John Smith", NormalizedDate.empty(),
            "United States", "USA"));
        base.getResults().add(DatasetFixtures.result("63", "2024 Summer Olympics", "USA", "Athletics",
            "100m Men", "20", "8", "John Smith", Medal.NONE));
        IncomingBundle bundle = DatasetFixtures.withAthletes(DatasetFixtures.parisBundle(), List.of(
            incoming("JS", "John Smith", NormalizedDate.empty(), "USA", List.of(), List.of())), List.of());

        ReconciliationResult result = reconciler.reconcile(bundle, reconciler.indexBase(base));

        assertEquals(new Resolution("8", "name+nationality", MatchConfidence.LOW),
            result.athlete("JS").orElseThrow());
    }

    @Test
    void testCountryWithoutCodeIsKeyedByName() {
        IncomingCountry refugees = new IncomingCountry("", "Refugee Olympic Team");
        IncomingBundle bundle = new IncomingBundle(DatasetFixtures.paris(), List.of(), List.of(refugees),
            DatasetFixtures.parisBundle().events(), DatasetFixtures.parisBundle().teamEntries(), List.of());

        ReconciliationResult result = reconciler.reconcile(bundle, reconciler.indexBase(base));

        assertEquals(Resolution.minted("X01"), result.country(refugees).orElseThrow());
        assertTrue(result.country("").isEmpty());
    }

    @Test
    void testDifferentBirthDateIsNotTheSameAthlete() {
        IncomingBundle bundle = DatasetFixtures.withAthletes(DatasetFixtures.parisBundle(), List.of(
            incoming("TR", "Teddy Riner", date(2004, 4, 7), "FRA", List.of(), List.of())), List.of());

        ReconciliationResult result = reconciler.reconcile(bundle, reconciler.indexBase(base));

        assertTrue(result.athlete("TR").orElseThrow().isMinted());
    }

    @Test
    void testAthleteWithoutNameIsRejected() {
        IncomingBundle bundle = DatasetFixtures.withAthletes(DatasetFixtures.parisBundle(), List.of(
            incoming("NONAME", " ", date(2000, 1, 1), "FRA", List.of(), List.of())), List.of());

        ReconciliationResult result = reconciler.reconcile(bundle, reconciler.indexBase(base));

        assertTrue(result.athlete("NONAME").isEmpty());
        assertEquals(1, result.getRejections().size());
        RejectedRow rejection = result.getRejections().get(0);
        assertEquals(Dataset.ATHLETES, rejection.table());
        assertEquals("NONAME", rejection.reference());
        assertEquals(RejectionReason.MISSING_NATURAL_KEY, rejection.reason());
    }

    @Test
    void testAthleteKeyUsesReconciledCountryCodes() {
        ReconciliationResult countries = new ReconciliationResult(
            Map.of("GB", new Resolution("GBR", "alias", MatchConfidence.HIGH)), Map.of(), List.of());
        IncomingAthlete athlete = new IncomingAthlete("X", "Jane Doe", "Female", NormalizedDate.empty(), "", "",
            "GB", "Great Britain", "", List.of(), List.of());

        AthleteNaturalKey key = IdentifierReconciler.athleteKey(athlete, countries);

        assertEquals("JANE_DOE", key.name());
        assertNull(key.born());
        assertEquals("GBR", key.nationalityNoc());
        assertEquals("GBR", key.representedNoc());
    }
}
