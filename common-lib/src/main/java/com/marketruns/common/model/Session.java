package com.marketruns.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All data from one experimental session.
 *
 * @param sessionCode       the export's {@code session.code}
 * @param segments          segment name → segment, in sorted-name order
 * @param participantLabels {@code participant.id_in_session} → label
 * @param metadata          session-level settings read from the first participant row
 */
public record Session(
    String               sessionCode,
    Map<String, Segment> segments,
    Map<Integer, String> participantLabels,
    Map<String, String>  metadata
) {

    public static final String PARTICIPATION_FEE             = "participation_fee";
    public static final String REAL_WORLD_CURRENCY_PER_POINT = "real_world_currency_per_point";
    public static final String ROOM                          = "room";
    public static final String IS_DEMO                       = "is_demo";

    public Session {
        segments          = Collections.unmodifiableMap(new LinkedHashMap<>(segments));
        participantLabels = Collections.unmodifiableMap(new LinkedHashMap<>(participantLabels));
        metadata          = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Returns the segment, or {@code null} if the session has no such segment. */
    public Segment segment(String name) {
        return segments.get(name);
    }

    public List<String> segmentNames() {
        return List.copyOf(segments.keySet());
    }

    public int participantCount() {
        return participantLabels.size();
    }

    /** Label of the participant, or {@code null} for an unknown id. */
    public String label(int participantId) {
        return participantLabels.get(participantId);
    }

    /** Segment name → round number → the player's observations. */
    public Map<String, Map<Integer, List<PlayerPeriodData>>> playerAcrossSession(String label) {
        Map<String, Map<Integer, List<PlayerPeriodData>>> out = new LinkedHashMap<>();
        for (Map.Entry<String, Segment> e : segments.entrySet()) {
            out.put(e.getKey(), e.getValue().playerAcrossRounds(label));
        }
        return out;
    }

    @Override
    public String toString() {
        return "Session " + sessionCode + " (" + segments.size() + " segments, "
            + participantCount() + " participants)";
    }
}
