package com.marketruns.common.model;

import com.marketruns.common.flatten.ExperimentFlattener;
import com.marketruns.common.flatten.FlatTable;
import com.marketruns.common.flatten.FlattenLevel;

import java.util.List;

/**
 * Top-level container of the rebuilt hierarchy: session → segment → round → period → player.
 *
 * <p>Every lookup returns {@code null} when any key on the path does not exist; none of
 * them throws. The graph is read-only once built.
 */
public record Experiment(String name, List<Session> sessions) {

    public Experiment {
        sessions = List.copyOf(sessions);
    }

    public Session session(String sessionCode) {
        for (Session s : sessions) {
            if (s.sessionCode().equals(sessionCode)) {
                return s;
            }
        }
        return null;
    }

    public Segment segment(String sessionCode, String segmentName) {
        Session session = session(sessionCode);
        return session != null ? session.segment(segmentName) : null;
    }

    public Round round(String sessionCode, String segmentName, int roundNumber) {
        Segment segment = segment(sessionCode, segmentName);
        return segment != null ? segment.round(roundNumber) : null;
    }

    public Period period(String sessionCode, String segmentName, int roundNumber, int periodInRound) {
        Round round = round(sessionCode, segmentName, roundNumber);
        return round != null ? round.period(periodInRound) : null;
    }

    public PlayerPeriodData player(String sessionCode, String segmentName,
                                   int roundNumber, int periodInRound, String label) {
        Period period = period(sessionCode, segmentName, roundNumber, periodInRound);
        return period != null ? period.player(label) : null;
    }

    public Group groupByPlayer(String sessionCode, String segmentName, String label) {
        Segment segment = segment(sessionCode, segmentName);
        return segment != null ? segment.groupByPlayer(label) : null;
    }

    public List<String> sessionCodes() {
        return sessions.stream().map(Session::sessionCode).toList();
    }

    public int sessionCount() {
        return sessions.size();
    }

    public int totalParticipants() {
        return sessions.stream().mapToInt(Session::participantCount).sum();
    }

    public boolean isEmpty() {
        return sessions.isEmpty();
    }

    /**
     * Flattens the hierarchy into one row per observation ({@link FlattenLevel#PERIOD}) or
     * per participant and round ({@link FlattenLevel#ROUND}). Pure: repeated calls return
     * equal tables.
     */
    public FlatTable flatten(FlattenLevel level) {
        return ExperimentFlattener.flatten(this, level);
    }

    @Override
    public String toString() {
        return "Experiment '" + name + "' (" + sessionCount() + " sessions, "
            + totalParticipants() + " total participants)";
    }
}
