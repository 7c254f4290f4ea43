package com.marketruns.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single trading period within a round: one {@link PlayerPeriodData} per active player,
 * keyed by label in the order the players were read.
 *
 * <p>Seller figures are derived on every call, never stored.
 */
public record Period(int periodInRound, Map<String, PlayerPeriodData> players) {

    public Period {
        players = Collections.unmodifiableMap(new LinkedHashMap<>(players));
    }

    /** Returns the player's observation, or {@code null} if the player was not active. */
    public PlayerPeriodData player(String label) {
        return players.get(label);
    }

    /** Labels of the players whose sale happened in this period. */
    public List<String> sellers() {
        return players.values().stream()
            .filter(PlayerPeriodData::soldThisPeriod)
            .map(PlayerPeriodData::label)
            .toList();
    }

    public int sellerCount() {
        return sellers().size();
    }

    /**
     * Mean price among this period's sellers that carry a price, or {@code null} when
     * nobody with a price sold.
     */
    public Double averageSalePrice() {
        double sum = 0.0;
        int n = 0;
        for (PlayerPeriodData p : players.values()) {
            if (p.soldThisPeriod() && p.price() != null) {
                sum += p.price();
                n++;
            }
        }
        return n > 0 ? sum / n : null;
    }

    @Override
    public String toString() {
        return "Period " + periodInRound + " (" + sellerCount() + " sellers)";
    }
}
