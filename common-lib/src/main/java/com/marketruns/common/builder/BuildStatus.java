package com.marketruns.common.builder;

/** Overall outcome of a build, so an empty result is never mistaken for success. */
public enum BuildStatus {

    /** Every session built and at least one carries data. */
    COMPLETE,

    /** Some sessions built, at least one failed an integrity check. */
    PARTIAL,

    /** Every session with data failed. */
    FAILED,

    /** Nothing to build: no labelled participants or no segment data. Not an error. */
    EMPTY
}
