package com.olympicsdata.domain.service;

import com.olympicsdata.domain.DatasetFixtures;
import com.olympicsdata.domain.error.RejectedRow;
import com.olympicsdata.domain.error.RejectionReason;
import com.olympicsdata.domain.model.Athlete;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.EventResult;
import com.olympicsdata.domain.model.IncomingBundle;
import com.olympicsdata.domain.model.IncomingCountry;
import com.olympicsdata.domain.model.Medal;
import com.olympicsdata.domain.model.Medallist;
import com.olympicsdata.domain.model.NormalizedDate;
import com.olympicsdata.domain.reconcile.CountryAliasTable;
import com.olympicsdata.domain.reconcile.IdentifierReconciler;
import com.olympicsdata.domain.reconcile.ReconciliationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TableMerger.
 */
class TableMergerTest {

    private IdentifierReconciler reconciler;
    private TableMerger merger;
    private Dataset base;
    private IncomingBundle bundle;

    @BeforeEach
    void setUp() {
        reconciler = new IdentifierReconciler(
            new CountryAliasTable(List.of(List.of("United Kingdom", "Great Britain"))));
        merger = new TableMerger();
        base = DatasetFixtures.base();
        bundle = DatasetFixtures.parisBundle();
    }

    private MergeResult merge(Dataset dataset, IncomingBundle incoming) {
        ReconciliationResult reconciliation = reconciler.reconcile(incoming, reconciler.indexBase(dataset));
        return merger.merge(dataset, incoming, reconciliation);
    }

    private static Map<String, EventResult> byIdentity(Dataset dataset) {
        return dataset.getResults().stream()
            .collect(Collectors.toMap(EventResult::identityKey, Function.identity()));
    }

    @Test
    void testMergeAppendsNewEditionRows() {
        MergeResult result = merge(base, bundle);
        Dataset merged = result.dataset();

        assertEquals(new MergeResult.MergeStats(1, 2, 2, 6, 0, 0), result.stats());
        assertTrue(result.rejections().isEmpty());
        assertEquals(4, merged.getCountries().size());
        assertEquals("Kosovo", merged.getCountries().find("KOS").orElseThrow().getName());
        assertEquals(5, merged.getAthletes().size());
        assertEquals(2, merged.getGames().size());
        assertTrue(merged.getGames().contains("63"));
        assertEquals(8, merged.getResults().size());
    }

    @Test
    void testBaseSnapshotIsNotModified() {
        merge(base, bundle);

        assertEquals(2, base.getResults().size());
        assertEquals(3, base.getAthletes().size());
        assertFalse(base.getAthletes().find("2").orElseThrow().getBorn().isKnown());
    }

    @Test
    void testNewAthleteRowUsesIncomingValues() {
        Athlete marchand = merge(base, bundle).dataset().getAthletes().find("5").orElseThrow();

        assertEquals("Leon Marchand", marchand.getName());
        assertEquals("17-May-2002", marchand.getBorn().canonical());
        assertEquals("FRA", marchand.getCountryNoc());
        assertEquals("France", marchand.getCountry());
        // "0" means unknown in the bundle
        assertEquals("", marchand.getHeight());
    }

    @Test
    void testExistingAthleteGapsAreFilledButValuesKept() {
        Dataset merged = merge(base, bundle).dataset();

        Athlete doe = merged.getAthletes().find("2").orElseThrow();
        assertEquals(LocalDate.of(2000, 1, 1), doe.getBorn().date());
        assertEquals("Male", doe.getSex());
        assertEquals("Jane Doe", doe.getName());

        Athlete riner = merged.getAthletes().find("1").orElseThrow();
        assertEquals(LocalDate.of(1989, 4, 7), riner.getBorn().date());
        assertEquals("GBR", doe.getCountryNoc());
        assertEquals("FRA", riner.getCountryNoc());
    }

    @Test
    void testResultIdsAreOnePerEventInSortedOrder() {
        Map<String, EventResult> rows = byIdentity(merge(base, bundle).dataset());

        assertEquals("12", rows.get("2|63|Athletics|100m Women").getResultId());
        assertEquals("13", rows.get("4|63|Boxing|Men's 51kg").getResultId());
        assertEquals("14", rows.get("1|63|Judo|+100 kg Men").getResultId());
        assertEquals("15", rows.get("1|63|Judo|Mixed Team").getResultId());
        assertEquals("16", rows.get("5|63|Swimming|200m Butterfly Men").getResultId());
        assertEquals("17", rows.get("5|63|Swimming|400m Individual Medley Men").getResultId());
    }

    @Test
    void testMedalsPositionsAndTeamFlags() {
        Map<String, EventResult> rows = byIdentity(merge(base, bundle).dataset());

        EventResult gold = rows.get("1|63|Judo|+100 kg Men");
        assertEquals(Medal.GOLD, gold.getMedal());
        assertEquals("1", gold.getPos());
        assertFalse(gold.isTeamSport());

        EventResult team = rows.get("1|63|Judo|Mixed Team");
        assertEquals(Medal.SILVER, team.getMedal());
        assertEquals("2", team.getPos());
        assertTrue(team.isTeamSport());

        EventResult none = rows.get("5|63|Swimming|200m Butterfly Men");
        assertEquals(Medal.NONE, none.getMedal());
        assertEquals("", none.getPos());
        assertEquals("2024 Summer Olympics", none.getEdition());
        assertEquals("Leon Marchand", none.getAthlete());
    }

    @Test
    void testMergeIsIdempotent() {
        Dataset once = merge(base, bundle).dataset();
        MergeResult twice = merge(once, bundle);

        assertEquals(new MergeResult.MergeStats(0, 0, 0, 0, 6, 0), twice.stats());
        assertEquals(once.getAthletes().keys(), twice.dataset().getAthletes().keys());
        assertEquals(once.getCountries().keys(), twice.dataset().getCountries().keys());
        assertEquals(once.getGames().keys(), twice.dataset().getGames().keys());

        Map<String, EventResult> first = byIdentity(once);
        Map<String, EventResult> second = byIdentity(twice.dataset());
        assertEquals(first.keySet(), second.keySet());
        first.forEach((key, row) -> {
            assertEquals(row.getResultId(), second.get(key).getResultId());
            assertEquals(row.getMedal(), second.get(key).getMedal());
        });
    }

    @Test
    void testUndatedAthleteWithNamesakesKeepsMintedIdOnRerun() {
        base.getAthletes().insert(DatasetFixtures.athlete("7", "John Smith", NormalizedDate.empty(),
            "United States", "USA"));
        base.getAthletes().insert(DatasetFixtures.athlete("8", "John Smith", NormalizedDate.empty(),
            "United States", "USA"));
        IncomingBundle smith = DatasetFixtures.withAthletes(bundle, List.of(
            DatasetFixtures.incoming("1900100", "John Smith", NormalizedDate.empty(), "USA",
                List.of("Athletics"), List.of("100m Women"))), List.of());

        Dataset once = merge(base, smith).dataset();
        MergeResult twice = merge(once, smith);

        assertEquals(List.of("1", "2", "3", "7", "8", "9"), once.getAthletes().rows().stream()
            .map(Athlete::getAthleteId).sorted().toList());
        assertEquals(once.getAthletes().keys(), twice.dataset().getAthletes().keys());
        assertEquals(once.getResults().size(), twice.dataset().getResults().size());
        assertEquals(0, twice.stats().athletesAdded());
        assertEquals(0, twice.stats().resultsAdded());
    }

    @Test
    void testCountryWithoutCodeIsAppendedUnderMintedCode() {
        IncomingBundle refugees = new IncomingBundle(bundle.edition(), bundle.athletes(),
            List.of(new IncomingCountry("FRA", "France"), new IncomingCountry("", "Refugee Olympic Team")),
            bundle.events(), bundle.teamEntries(), bundle.medallists());

        MergeResult once = merge(base, refugees);
        MergeResult twice = merge(once.dataset(), refugees);

        assertEquals(1, once.stats().countriesAdded());
        assertEquals("Refugee Olympic Team", once.dataset().getCountries().find("X01").orElseThrow().getName());
        assertEquals(0, twice.stats().countriesAdded());
        assertEquals(once.dataset().getCountries().keys(), twice.dataset().getCountries().keys());
    }

    @Test
    void testRepeatedEventRowUpdatesExistingRow() {
        base.getGames().insert(DatasetFixtures.paris());
        base.getResults().add(DatasetFixtures.result("63", "2024 Summer Olympics", "FRA", "Judo", "+100 kg Men",
            "50", "1", "Teddy Riner", Medal.NONE));

        MergeResult result = merge(base, bundle);
        List<EventResult> riner = result.dataset().getResults().stream()
            .filter(r -> r.identityKey().equals("1|63|Judo|+100 kg Men"))
            .toList();

        assertEquals(1, riner.size());
        assertEquals(Medal.GOLD, riner.get(0).getMedal());
        assertEquals("50", riner.get(0).getResultId());
        assertEquals(1, result.stats().resultsUpdated());
        assertEquals(5, result.stats().resultsAdded());
    }

    @Test
    void testMedallistOutsideEventListsIsAdded() {
        List<Medallist> medallists = new ArrayList<>(bundle.medallists());
        medallists.add(new Medallist("1906722", "Swimming", "200m Individual Medley Men", Medal.GOLD));
        IncomingBundle withExtra = DatasetFixtures.withAthletes(bundle, bundle.athletes(), medallists);

        Map<String, EventResult> rows = byIdentity(merge(base, withExtra).dataset());

        EventResult extra = rows.get("5|63|Swimming|200m Individual Medley Men");
        assertNotNull(extra);
        assertEquals(Medal.GOLD, extra.getMedal());
        assertEquals("FRA", extra.getCountryNoc());
    }

    @Test
    void testMedallistWithUnknownAthleteIsReported() {
        List<Medallist> medallists = new ArrayList<>(bundle.medallists());
        medallists.add(new Medallist("9999999", "Judo", "Mixed Team", Medal.SILVER));
        IncomingBundle withUnknown = DatasetFixtures.withAthletes(bundle, bundle.athletes(), medallists);

        MergeResult result = merge(base, withUnknown);

        assertEquals(1, result.rejections().size());
        RejectedRow rejection = result.rejections().get(0);
        assertEquals(RejectionReason.REFERENTIAL_GAP, rejection.reason());
        assertEquals("9999999|Judo|Mixed Team", rejection.reference());
        assertEquals(8, result.dataset().getResults().size());
    }

    @Test
    void testRowsWithMissingReferencesAreExcluded() {
        base.getResults().add(DatasetFixtures.result("61", "2020 Summer Olympics", "FRA", "Judo", "-60 kg, Men",
            "20", "999", "Nobody", Medal.NONE));
        base.getResults().add(DatasetFixtures.result("61", "2020 Summer Olympics", "ZZZ", "Judo", "-66 kg, Men",
            "21", "1", "Teddy Riner", Medal.NONE));
        base.getResults().add(DatasetFixtures.result("12", "1948 Summer Olympics", "FRA", "Judo", "Open",
            "22", "1", "Teddy Riner", Medal.NONE));

        MergeResult result = merge(base, bundle);
        Dataset merged = result.dataset();

        assertEquals(3, result.stats().resultsExcluded());
        assertEquals(3, result.rejections().size());
        assertTrue(result.rejections().stream().allMatch(r -> r.reason() == RejectionReason.REFERENTIAL_GAP));
        for (EventResult row : merged.getResults()) {
            assertTrue(merged.getAthletes().contains(row.getAthleteId()));
            assertTrue(merged.getCountries().contains(row.getCountryNoc()));
            assertTrue(merged.getGames().contains(row.getEditionId()));
        }
    }

    @Test
    void testAthleteIdsAreUnique() {
        Dataset merged = merge(base, bundle).dataset();

        Set<String> ids = merged.getAthletes().rows().stream()
            .map(Athlete::getAthleteId)
            .collect(Collectors.toSet());
        assertEquals(merged.getAthletes().size(), ids.size());
    }
}
