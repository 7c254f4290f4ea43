package com.marketruns.common.exception;

/**
 * The table headers do not carry a column the build requires, or name one it cannot read.
 * Raised while the column schema is resolved, before any row is read.
 */
public class SchemaMismatchException extends ExperimentParsingException {

    public SchemaMismatchException(String context, String message) {
        super(context, message);
    }

    public SchemaMismatchException(String context, String message, Throwable cause) {
        super(context, message, cause);
    }
}
