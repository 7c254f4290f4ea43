package com.marketruns.common.builder;

import com.marketruns.common.exception.ExperimentParsingException;

/** A session whose build was aborted; the rest of the batch carried on. */
public record SessionFailure(String sessionCode, ExperimentParsingException error) {

    public String message() {
        return error.getMessage();
    }
}
