package com.marketruns.common.builder;

import com.marketruns.common.exception.StructuralIntegrityException;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Detects the period in which a player's sale happened, from the cumulative sold flag.
 *
 * <p>Keeps, per (player, round), the highest {@code sold} value seen in earlier column
 * periods of that round. A period is the sale period when it carries a sell timestamp or
 * when its {@code sold} value exceeds that running maximum. Observations must be fed in
 * ascending column order.
 *
 * <p>One tracker covers one segment of one session build and is discarded afterwards.
 */
final class SoldTransitionTracker {

    private record PlayerRound(String label, int roundNumber) {}

    private final Map<PlayerRound, Integer> runningMax = new HashMap<>();
    private final Set<PlayerRound> transitioned = new HashSet<>();

    /**
     * @param context prefix for integrity errors
     * @return whether the sale happened in this period
     * @throws StructuralIntegrityException when the flag is not 0/1, drops back to 0, a sell
     *         timestamp comes with {@code sold=0}, or a second sale shows up in the round
     */
    boolean observe(String label, int roundNumber, int soldCumulative, boolean hasSellTimestamp, String context) {
        if (soldCumulative != 0 && soldCumulative != 1) {
            throw new StructuralIntegrityException(context, "sold must be 0 or 1, got " + soldCumulative);
        }
        PlayerRound key = new PlayerRound(label, roundNumber);
        int max = runningMax.getOrDefault(key, 0);

        if (soldCumulative < max) {
            throw new StructuralIntegrityException(context,
                "sold went back to 0 after a sale in round " + roundNumber + " for player " + label);
        }
        if (hasSellTimestamp && soldCumulative == 0) {
            throw new StructuralIntegrityException(context,
                "sell timestamp without a cumulative sold flag for player " + label);
        }

        boolean soldThisPeriod = hasSellTimestamp || soldCumulative > max;
        if (soldThisPeriod && !transitioned.add(key)) {
            throw new StructuralIntegrityException(context,
                "second sale in round " + roundNumber + " for player " + label);
        }
        runningMax.put(key, Math.max(max, soldCumulative));
        return soldThisPeriod;
    }
}
