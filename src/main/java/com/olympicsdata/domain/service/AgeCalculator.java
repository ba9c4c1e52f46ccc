package com.olympicsdata.domain.service;

import com.olympicsdata.domain.model.Athlete;
import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.EventResult;
import com.olympicsdata.domain.model.GamesEdition;
import com.olympicsdata.domain.model.NormalizedDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Period;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives the age of each athlete at each edition.
 */
public class AgeCalculator {

    private static final Logger logger = LoggerFactory.getLogger(AgeCalculator.class);

    public static final String AGE_COLUMN = "age";

    /**
     * Age in whole years on the reference date, or null when either date is
     * unknown (partial dates included) or the birth date lies after the reference.
     */
    public Integer ageAt(NormalizedDate born, NormalizedDate reference) {
        if (born == null || reference == null || !born.isKnown() || !reference.isKnown()) {
            return null;
        }
        if (born.date().isAfter(reference.date())) {
            return null;
        }
        return Period.between(born.date(), reference.date()).getYears();
    }

    /**
     * Sets the age of every result row and returns the dataset with the age column
     * appended to the result schema when it was not there yet.
     */
    public Dataset computeAges(Dataset dataset) {
        int unknown = 0;
        for (EventResult row : dataset.getResults()) {
            Optional<Athlete> athlete = dataset.getAthletes().find(row.getAthleteId());
            Optional<GamesEdition> games = dataset.getGames().find(row.getEditionId());
            Integer age = athlete.isPresent() && games.isPresent()
                ? ageAt(athlete.get().getBorn(), games.get().referenceDate())
                : null;
            row.setAge(age);
            if (age == null) {
                unknown++;
            }
        }
        logger.info("Computed ages for {} result rows, {} unknown", dataset.getResults().size(), unknown);

        if (dataset.getResultColumns().contains(AGE_COLUMN)) {
            return dataset;
        }
        List<String> columns = new ArrayList<>(dataset.getResultColumns());
        columns.add(AGE_COLUMN);
        return new Dataset(dataset.getAthletes(), dataset.getCountries(), dataset.getGames(),
            columns, dataset.getResults());
    }
}
