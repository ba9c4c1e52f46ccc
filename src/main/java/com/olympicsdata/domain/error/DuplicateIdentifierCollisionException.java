package com.olympicsdata.domain.error;

/**
 * A primary key was inserted into a table that already holds it.
 * Signals a minting defect, never a data-quality problem.
 */
public class DuplicateIdentifierCollisionException extends IntegrationException {

    private final String table;
    private final String identifier;

    public DuplicateIdentifierCollisionException(String table, String identifier) {
        super("Identifier " + identifier + " already exists in table " + table);
        this.table = table;
        this.identifier = identifier;
    }

    public String getTable() {
        return table;
    }

    public String getIdentifier() {
        return identifier;
    }
}
