package com.olympicsdata.domain.ports;

import com.olympicsdata.domain.model.IntegrationOutput;

import java.io.IOException;

/**
 * Port for publishing the merged tables, the medal tally and the run report.
 */
public interface DatasetSink {

    /**
     * Writes every output or none of them.
     *
     * @param output result of a completed integration run
     * @throws IOException if writing fails; previously published outputs stay untouched
     */
    void write(IntegrationOutput output) throws IOException;
}
