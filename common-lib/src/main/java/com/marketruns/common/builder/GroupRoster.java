package com.marketruns.common.builder;

import com.marketruns.common.exception.StructuralIntegrityException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Scratch membership table for one segment: group id → labels, accumulated over every
 * column period that carries a group id. Never leaves the builder; {@link #freeze()}
 * produces the sorted rosters the public {@code Group} records are made from.
 */
final class GroupRoster {

    private final String context;
    private final Map<Integer, Set<String>> members = new TreeMap<>();
    private final Map<String, Integer> groupOf = new HashMap<>();

    GroupRoster(String context) {
        this.context = context;
    }

    /**
     * @throws StructuralIntegrityException if the label was already seen in another group
     */
    void record(int groupId, String label) {
        Integer existing = groupOf.putIfAbsent(label, groupId);
        if (existing != null && existing != groupId) {
            throw new StructuralIntegrityException(context,
                "player " + label + " found in group " + existing + " and group " + groupId);
        }
        members.computeIfAbsent(groupId, k -> new TreeSet<>()).add(label);
    }

    boolean isEmpty() {
        return members.isEmpty();
    }

    /** Group id → sorted member labels, in ascending group id order. */
    Map<Integer, List<String>> freeze() {
        Map<Integer, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<Integer, Set<String>> e : members.entrySet()) {
            out.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return out;
    }
}
