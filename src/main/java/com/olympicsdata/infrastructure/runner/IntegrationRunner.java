package com.olympicsdata.infrastructure.runner;

import com.olympicsdata.application.usecase.IntegrateEditionUseCase;
import com.olympicsdata.domain.model.IntegrationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one integration at startup when {@code olympics.run-on-startup=true}.
 * A failure propagates and stops the application.
 */
@Component
@ConditionalOnProperty(prefix = "olympics", name = "run-on-startup", havingValue = "true")
public class IntegrationRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(IntegrationRunner.class);

    private final IntegrateEditionUseCase integrateEditionUseCase;

    public IntegrationRunner(IntegrateEditionUseCase integrateEditionUseCase) {
        this.integrateEditionUseCase = integrateEditionUseCase;
    }

    @Override
    public void run(String... args) {
        IntegrationReport report = integrateEditionUseCase.execute();
        logger.info("Startup integration of edition {} finished: {} athletes, {} results, {} tally rows",
            report.editionId(), report.tables().athletes(), report.tables().results(), report.tables().tallyRows());
    }
}
