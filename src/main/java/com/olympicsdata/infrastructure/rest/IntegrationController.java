package com.olympicsdata.infrastructure.rest;

import com.olympicsdata.application.usecase.IntegrateEditionUseCase;
import com.olympicsdata.domain.model.IntegrationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for integration runs.
 */
@RestController
@RequestMapping("/integration")
public class IntegrationController {

    private static final Logger logger = LoggerFactory.getLogger(IntegrationController.class);

    private final IntegrateEditionUseCase integrateEditionUseCase;

    public IntegrationController(IntegrateEditionUseCase integrateEditionUseCase) {
        this.integrateEditionUseCase = integrateEditionUseCase;
    }

    /**
     * Integrates the configured incoming edition and writes all outputs.
     *
     * POST /integration/run
     *
     * @return report of the run
     */
    @PostMapping("/run")
    public ResponseEntity<IntegrationReport> run() {
        logger.info("Received request to run the integration");

        try {
            IntegrationReport report = integrateEditionUseCase.execute();
            logger.info("Integration run completed. Rejected rows: {}", report.rejections().size());

            return ResponseEntity.ok(report);
        } catch (Exception e) {
            logger.error("Error running the integration", e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
