package com.olympicsdata.domain.ports;

import com.olympicsdata.domain.model.Dataset;
import com.olympicsdata.domain.model.IncomingBundle;

import java.io.IOException;

/**
 * Port for reading the base tables and the bundle of the edition being integrated.
 */
public interface DatasetSource {

    /**
     * Gets a short description of where the data comes from, for logging.
     */
    String getSourceName();

    /**
     * Loads the four base tables with dates normalized.
     *
     * @throws IOException if a table cannot be read
     * @throws com.olympicsdata.domain.error.MissingTableException if a table or required column is absent
     */
    Dataset loadBase() throws IOException;

    /**
     * Loads the incoming edition bundle with dates and names normalized.
     *
     * @throws IOException if a bundle file cannot be read
     */
    IncomingBundle loadIncoming() throws IOException;
}
