package com.marketruns.common.exception;

/**
 * Root of every failure raised while rebuilding an experiment from its exports.
 *
 * <p>The message is prefixed with the context that failed (a file, a session, a
 * segment), so a log line alone identifies where the data went wrong.
 */
public class ExperimentParsingException extends RuntimeException {
    private final String context;
    private final String reason;

    public ExperimentParsingException(String context, String message) {
        super("[" + context + "] " + message);
        this.context = context;
        this.reason  = message;
    }

    public ExperimentParsingException(String context, String message, Throwable cause) {
        super("[" + context + "] " + message, cause);
        this.context = context;
        this.reason  = message;
    }

    public String getContext() {
        return context;
    }

    /** The message without its context prefix. */
    public String getReason() {
        return reason;
    }
}
