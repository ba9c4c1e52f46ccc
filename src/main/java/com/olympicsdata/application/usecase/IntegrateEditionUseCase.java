package com.olympicsdata.application.usecase;

import com.olympicsdata.domain.error.IntegrationException;
import com.olympicsdata.domain.error.MissingTableException;
import com.olympicsdata.domain.error.RejectedRow;
import com.olympicsdata.domain.model.Athlete;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.GamesEdition;
import com.olympicsdata.domain.model.IncomingAthlete;
import com.olympicsdata.domain.model.IncomingBundle;
import com.olympicsdata.domain.model.IntegrationOutput;
import com.olympicsdata.domain.model.IntegrationReport;
import com.olympicsdata.domain.model.MedalTallyRow;
import com.olympicsdata.domain.ports.DatasetSink;
import com.olympicsdata.domain.ports.DatasetSource;
import com.olympicsdata.domain.reconcile.IdentifierReconciler;
import com.olympicsdata.domain.reconcile.MatchConfidence;
import com.olympicsdata.domain.reconcile.NaturalKeyIndex;
import com.olympicsdata.domain.reconcile.ReconciliationResult;
import com.olympicsdata.domain.reconcile.Resolution;
import com.olympicsdata.domain.service.AgeCalculator;
import com.olympicsdata.domain.service.MedalTallyAggregator;
import com.olympicsdata.domain.service.MergeResult;
import com.olympicsdata.domain.service.TableMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Use case for integrating a new edition into the historical dataset:
 * reconcile, merge, derive ages and tally, then publish.
 */
@Service
public class IntegrateEditionUseCase {

    private static final Logger logger = LoggerFactory.getLogger(IntegrateEditionUseCase.class);

    private final DatasetSource source;
    private final DatasetSink sink;
    private final IdentifierReconciler reconciler;
    private final TableMerger merger;
    private final AgeCalculator ageCalculator;
    private final MedalTallyAggregator tallyAggregator;

    public IntegrateEditionUseCase(DatasetSource source,
                                   DatasetSink sink,
                                   IdentifierReconciler reconciler,
                                   TableMerger merger,
                                   AgeCalculator ageCalculator,
                                   MedalTallyAggregator tallyAggregator) {
        this.source = source;
        this.sink = sink;
        this.reconciler = reconciler;
        this.merger = merger;
        this.ageCalculator = ageCalculator;
        this.tallyAggregator = tallyAggregator;
    }

    /**
     * Loads the inputs, integrates them and writes all outputs.
     *
     * @return report of the run
     * @throws IntegrationException if the run fails; nothing is written in that case
     */
    public IntegrationReport execute() {
        logger.info("Starting integration from {}", source.getSourceName());

        Dataset base;
        IncomingBundle bundle;
        try {
            base = source.loadBase();
            bundle = source.loadIncoming();
        } catch (IOException e) {
            throw new MissingTableException("Failed to read input tables: " + e.getMessage(), e);
        }

        IntegrationOutput output = integrate(base, bundle);

        try {
            sink.write(output);
        } catch (IOException e) {
            throw new IntegrationException("Failed to write outputs: " + e.getMessage(), e);
        }
        logger.info("Integration of edition {} completed: {} results, {} tally rows, {} rejected rows",
            output.report().editionId(), output.report().tables().results(),
            output.report().tables().tallyRows(), output.report().rejections().size());
        return output.report();
    }

    /**
     * Runs the pipeline in memory. The base dataset is not modified.
     */
    public IntegrationOutput integrate(Dataset base, IncomingBundle bundle) {
        Instant startedAt = Instant.now();

        NaturalKeyIndex index = reconciler.indexBase(base);
        ReconciliationResult reconciliation = reconciler.reconcile(bundle, index);

        MergeResult merge = merger.merge(base, bundle, reconciliation);
        Dataset merged = ageCalculator.computeAges(merge.dataset());
        List<MedalTallyRow> tally = tallyAggregator.aggregate(merged);

        List<RejectedRow> rejections = new ArrayList<>(reconciliation.getRejections());
        rejections.addAll(merge.rejections());
        rejections.forEach(r -> logger.warn("Rejected {} row {}: {} ({})", r.table(), r.reference(), r.reason(), r.detail()));

        MergeResult.MergeStats stats = merge.stats();
        IntegrationReport report = new IntegrationReport(
            bundle.edition().getEditionId(),
            startedAt,
            Instant.now(),
            new IntegrationReport.TableCounts(
                merged.getAthletes().size(),
                merged.getCountries().size(),
                merged.getGames().size(),
                merged.getResults().size(),
                tally.size()),
            new IntegrationReport.ChangeCounts(
                stats.countriesAdded(),
                stats.athletesAdded(),
                stats.athletesUpdated(),
                stats.resultsAdded(),
                stats.resultsUpdated(),
                stats.resultsExcluded()),
            countByStrategy(reconciliation.getAthletes()),
            countByStrategy(reconciliation.getCountries()),
            reconciliation.countAthletes(MatchConfidence.LOW),
            countMalformedDates(base, bundle),
            List.copyOf(rejections)
        );
        return new IntegrationOutput(merged, tally, report);
    }

    private static Map<String, Long> countByStrategy(Map<String, Resolution> resolutions) {
        Map<String, Long> counts = new TreeMap<>();
        resolutions.values().forEach(r -> counts.merge(r.strategy(), 1L, Long::sum));
        return counts;
    }

    private static long countMalformedDates(Dataset base, IncomingBundle bundle) {
        long count = 0;
        for (Athlete athlete : base.getAthletes().rows()) {
            if (athlete.getBorn().isMalformed()) {
                count++;
            }
        }
        for (GamesEdition games : base.getGames().rows()) {
            if (games.getStartDate().isMalformed()) {
                count++;
            }
            if (games.getEndDate().isMalformed()) {
                count++;
            }
        }
        for (IncomingAthlete athlete : bundle.athletes()) {
            if (athlete.born() != null && athlete.born().isMalformed()) {
                count++;
            }
        }
        return count;
    }
}
