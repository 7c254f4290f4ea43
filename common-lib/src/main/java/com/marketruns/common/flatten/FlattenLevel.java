package com.marketruns.common.flatten;

import java.util.Locale;

/** Granularity of a flattened table. */
public enum FlattenLevel {
    /** One row per (session, segment, round, period, participant). */
    PERIOD,
    /** One row per (session, segment, round, participant). */
    ROUND;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for anything other than {@code period} or {@code round}
     */
    public static FlattenLevel fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("flatten level is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown flatten level '" + value + "', expected period or round", e);
        }
    }
}
