package com.marketruns.common.exception;

/** An input file does not exist or cannot be read. Fatal: no partial result is produced. */
public class MissingInputException extends ExperimentParsingException {

    public MissingInputException(String path, String message) {
        super("input=" + path, message);
    }

    public MissingInputException(String path, String message, Throwable cause) {
        super("input=" + path, message, cause);
    }
}
