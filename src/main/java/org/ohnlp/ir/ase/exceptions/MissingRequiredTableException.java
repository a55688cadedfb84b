package org.ohnlp.ir.ase.exceptions;

/**
 * Raised before a pipeline is built when a table the engine cannot run without is absent from the input
 * connection, or lacks one of its required columns.
 */
public class MissingRequiredTableException extends RuntimeException {
    private final String table;

    public MissingRequiredTableException(String table, String message) {
        super(message);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
