package com.marketruns.common.exception;

/**
 * The data contradicts the structure of the experiment: a player in two groups of one
 * segment, a sale with no cumulative increase, a sold flag that goes back to zero.
 * Aborts the affected session only.
 */
public class StructuralIntegrityException extends ExperimentParsingException {

    public StructuralIntegrityException(String context, String message) {
        super(context, message);
    }

    public StructuralIntegrityException(String context, String message, Throwable cause) {
        super(context, message, cause);
    }
}
