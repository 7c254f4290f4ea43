package com.marketruns.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A fixed roster of players who trade together for a whole segment.
 *
 * <p>A group stores only the name of its segment. Navigation back into the data takes the
 * owning {@link Session} as an argument and resolves the segment from it, so the model has
 * no reference cycles.
 *
 * @param segmentName  name of the segment this roster belongs to
 * @param groupId      {@code id_in_subsession} of the group
 * @param playerLabels member labels, sorted
 * @param chatChannels round number → chat channel number of this group's room
 */
public record Group(
    String                segmentName,
    int                   groupId,
    List<String>          playerLabels,
    Map<Integer, Integer> chatChannels
) {

    public Group {
        playerLabels = List.copyOf(playerLabels);
        chatChannels = Collections.unmodifiableMap(new TreeMap<>(chatChannels));
    }

    public int size() {
        return playerLabels.size();
    }

    public boolean hasMember(String label) {
        return playerLabels.contains(label);
    }

    /** Chat channel of this group's room in the round, or {@code null} if none was seen. */
    public Integer chatChannel(int roundNumber) {
        return chatChannels.get(roundNumber);
    }

    /** This group's members in one period; empty when the round or period does not exist. */
    public Map<String, PlayerPeriodData> playersInPeriod(Session session, int roundNumber, int periodInRound) {
        Round round = roundIn(session, roundNumber);
        if (round == null) {
            return Map.of();
        }
        Period period = round.period(periodInRound);
        if (period == null) {
            return Map.of();
        }
        Map<String, PlayerPeriodData> out = new LinkedHashMap<>();
        for (String label : playerLabels) {
            PlayerPeriodData d = period.player(label);
            if (d != null) {
                out.put(label, d);
            }
        }
        return out;
    }

    /** Each member's observations across the periods of one round. */
    public Map<String, List<PlayerPeriodData>> playersInRound(Session session, int roundNumber) {
        Round round = roundIn(session, roundNumber);
        if (round == null) {
            return Map.of();
        }
        Map<String, List<PlayerPeriodData>> out = new LinkedHashMap<>();
        for (String label : playerLabels) {
            out.put(label, round.playerAcrossPeriods(label));
        }
        return out;
    }

    /** Each member's observations across every round of the segment. */
    public Map<String, Map<Integer, List<PlayerPeriodData>>> playersAcrossSegment(Session session) {
        Segment segment = segmentIn(session);
        if (segment == null) {
            return Map.of();
        }
        Map<String, Map<Integer, List<PlayerPeriodData>>> out = new LinkedHashMap<>();
        for (String label : playerLabels) {
            out.put(label, segment.playerAcrossRounds(label));
        }
        return out;
    }

    /** Messages posted in this group's room during the round, in timestamp order. */
    public List<ChatMessage> chatForRound(Session session, int roundNumber) {
        Round round = roundIn(session, roundNumber);
        Integer channel = chatChannels.get(roundNumber);
        if (round == null || channel == null) {
            return List.of();
        }
        return round.chatMessages().stream()
            .filter(m -> m.channelNumber() == channel)
            .toList();
    }

    /** Round → this group's messages, only for rounds in which the group chatted. */
    public Map<Integer, List<ChatMessage>> chatAcrossSegment(Session session) {
        Segment segment = segmentIn(session);
        if (segment == null) {
            return Map.of();
        }
        Map<Integer, List<ChatMessage>> out = new LinkedHashMap<>();
        for (Integer roundNumber : segment.rounds().keySet()) {
            List<ChatMessage> messages = chatForRound(session, roundNumber);
            if (!messages.isEmpty()) {
                out.put(roundNumber, messages);
            }
        }
        return out;
    }

    private Segment segmentIn(Session session) {
        return session != null ? session.segment(segmentName) : null;
    }

    private Round roundIn(Session session, int roundNumber) {
        Segment segment = segmentIn(session);
        return segment != null ? segment.round(roundNumber) : null;
    }

    @Override
    public String toString() {
        return "Group " + groupId + " (" + size() + " players: " + String.join(", ", playerLabels) + ")";
    }
}
