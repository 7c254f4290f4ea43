package com.marketruns.common.model;

import java.time.Instant;

/**
 * One player's state in one period.
 *
 * <p>{@code soldCumulative} is the raw 0/1 holding flag as exported (it stays at 1 once
 * the player has sold in the round). {@code soldThisPeriod} marks only the period in which
 * the sale happened.
 *
 * <p>Nullable fields ({@code signal}, {@code price}, {@code sellTimestamp}, {@code payoff})
 * are {@code null} when the export left the cell empty. A payoff of {@code 0.0} is a real value.
 */
public record PlayerPeriodData(
    int     participantId,
    String  label,
    int     idInGroup,
    int     soldCumulative,
    boolean soldThisPeriod,
    Double  signal,
    Double  price,
    Double  sellTimestamp,   // unix epoch seconds, only on the period of the sell click
    int     state,
    Double  payoff
) {

    /** The sell click as an {@link Instant}, or {@code null} if there was none. */
    public Instant sellInstant() {
        return sellTimestamp != null ? toInstant(sellTimestamp) : null;
    }

    public boolean hasSold() {
        return soldCumulative > 0;
    }

    static Instant toInstant(double epochSeconds) {
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000L);
        return Instant.ofEpochSecond(seconds, nanos);
    }

    @Override
    public String toString() {
        String status = soldThisPeriod ? "SOLD" : "HOLD";
        String at = price != null ? "@" + price : "";
        return "Player " + label + " (" + status + at + ")";
    }
}
