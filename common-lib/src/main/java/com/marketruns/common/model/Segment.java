package com.marketruns.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A named treatment block: its rounds in order plus the groups discovered for it. */
public record Segment(String name, Map<Integer, Round> rounds, Map<Integer, Group> groups) {

    public Segment {
        rounds = Collections.unmodifiableMap(new LinkedHashMap<>(rounds));
        groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    }

    /** Returns the round, or {@code null} if the segment has no such round. */
    public Round round(int roundNumber) {
        return rounds.get(roundNumber);
    }

    /** Returns the group, or {@code null} if no group has that id. */
    public Group group(int groupId) {
        return groups.get(groupId);
    }

    /** The group the player belongs to in this segment, or {@code null} if ungrouped. */
    public Group groupByPlayer(String label) {
        for (Group g : groups.values()) {
            if (g.hasMember(label)) {
                return g;
            }
        }
        return null;
    }

    public int roundCount() {
        return rounds.size();
    }

    public int groupCount() {
        return groups.size();
    }

    /** Round number → the player's observations in that round (empty list where absent). */
    public Map<Integer, List<PlayerPeriodData>> playerAcrossRounds(String label) {
        Map<Integer, List<PlayerPeriodData>> out = new LinkedHashMap<>();
        for (Map.Entry<Integer, Round> e : rounds.entrySet()) {
            out.put(e.getKey(), e.getValue().playerAcrossPeriods(label));
        }
        return out;
    }

    public int chatMessageCount() {
        return rounds.values().stream().mapToInt(Round::chatMessageCount).sum();
    }

    @Override
    public String toString() {
        return "Segment '" + name + "' (" + roundCount() + " rounds, " + groupCount() + " groups)";
    }
}
