package com.marketruns.common.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One trading round of a segment.
 *
 * <p>{@code terminalPayoffs} holds, per label, the round payoff recorded at the round's
 * structurally last period for that player. Labels whose payoff cell was empty are absent
 * from the map; they are never mapped to zero.
 *
 * <p>{@code chatMessages} holds every message attributed to this round across all groups,
 * in timestamp order. Use {@link Group#chatForRound(Session, int)} for one group's room.
 */
public record Round(
    int                  roundNumber,
    Map<Integer, Period> periods,
    Map<String, Double>  terminalPayoffs,
    List<ChatMessage>    chatMessages
) {

    public Round {
        periods         = Collections.unmodifiableMap(new LinkedHashMap<>(periods));
        terminalPayoffs = Collections.unmodifiableMap(new LinkedHashMap<>(terminalPayoffs));
        chatMessages    = List.copyOf(chatMessages);
    }

    /** Returns the period, or {@code null} if the round has no such period. */
    public Period period(int periodInRound) {
        return periods.get(periodInRound);
    }

    /** The last period of the round, or {@code null} for a round without periods. */
    public Period lastPeriod() {
        Period last = null;
        for (Period p : periods.values()) {
            last = p;
        }
        return last;
    }

    public int periodCount() {
        return periods.size();
    }

    /** Final round payoff for the label, or {@code null} if none was recorded. */
    public Double terminalPayoff(String label) {
        return terminalPayoffs.get(label);
    }

    /** Number of distinct players who sold at some point in this round. */
    public int totalSellers() {
        Set<String> sellers = new LinkedHashSet<>();
        for (Period p : periods.values()) {
            sellers.addAll(p.sellers());
        }
        return sellers.size();
    }

    /** The player's observations in period order; empty if the player never appears. */
    public List<PlayerPeriodData> playerAcrossPeriods(String label) {
        List<PlayerPeriodData> out = new ArrayList<>();
        for (Period p : periods.values()) {
            PlayerPeriodData d = p.player(label);
            if (d != null) {
                out.add(d);
            }
        }
        return out;
    }

    /** The player's observation in the last period they appear in, or {@code null}. */
    public PlayerPeriodData lastObservation(String label) {
        List<PlayerPeriodData> seen = playerAcrossPeriods(label);
        return seen.isEmpty() ? null : seen.get(seen.size() - 1);
    }

    /** Period in which the player sold, or {@code null} if they held through the round. */
    public Integer sellerPeriod(String label) {
        for (Map.Entry<Integer, Period> e : periods.entrySet()) {
            PlayerPeriodData d = e.getValue().player(label);
            if (d != null && d.soldThisPeriod()) {
                return e.getKey();
            }
        }
        return null;
    }

    /** Label → period of sale, for every player who sold, in order of sale. */
    public Map<String, Integer> sellersWithPeriods() {
        Map<String, Integer> sellers = new LinkedHashMap<>();
        for (Map.Entry<Integer, Period> e : periods.entrySet()) {
            for (String label : e.getValue().sellers()) {
                sellers.putIfAbsent(label, e.getKey());
            }
        }
        return sellers;
    }

    /** Period → sellers, only for periods with at least one sale. */
    public Map<Integer, List<String>> sellersByPeriod() {
        Map<Integer, List<String>> byPeriod = new LinkedHashMap<>();
        for (Map.Entry<Integer, Period> e : periods.entrySet()) {
            List<String> sellers = e.getValue().sellers();
            if (!sellers.isEmpty()) {
                byPeriod.put(e.getKey(), sellers);
            }
        }
        return byPeriod;
    }

    public int chatMessageCount() {
        return chatMessages.size();
    }

    public List<ChatMessage> chatByPlayer(String label) {
        return chatMessages.stream()
            .filter(m -> m.senderLabel().equals(label))
            .toList();
    }

    @Override
    public String toString() {
        return "Round " + roundNumber + " (" + periodCount() + " periods, "
            + totalSellers() + " total sellers)";
    }
}
