package com.marketruns.common.builder;

import com.marketruns.common.exception.StructuralIntegrityException;
import com.marketruns.common.model.Group;
import com.marketruns.common.model.Period;
import com.marketruns.common.model.PlayerPeriodData;
import com.marketruns.common.model.Round;
import com.marketruns.common.model.Segment;
import com.marketruns.common.model.Session;
import com.marketruns.common.table.Cells;
import com.marketruns.common.table.DataTable;
import com.marketruns.common.table.WideSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rebuilds one session from its participant rows.
 *
 * <p>Per segment, participants are scanned in row order and each participant's column
 * periods in ascending order. Everything mutable (round drafts, sold tracker, group roster)
 * lives for one segment scan and is frozen into immutable model records at the end.
 */
final class SessionAssembler {

    private static final Logger log = LoggerFactory.getLogger(SessionAssembler.class);

    private static final Map<String, String> METADATA_COLUMNS = metadataColumns();

    private final WideSchema schema;
    private final DataTable table;
    private final ChatAligner chatAligner;

    /** @param chatAligner {@code null} when the build has no chat log */
    SessionAssembler(WideSchema schema, ChatAligner chatAligner) {
        this.schema      = schema;
        this.table       = schema.table();
        this.chatAligner = chatAligner;
    }

    // ── Scratch state ───────────────────────────────────────────────────────

    private static final class RoundDraft {
        final Map<Integer, Map<String, PlayerPeriodData>> periods = new TreeMap<>();
        final Map<String, Double> payoffs = new LinkedHashMap<>();
    }

    private record Participant(int row, String label, int participantId) {}

    // ── Session ─────────────────────────────────────────────────────────────

    /**
     * @param rows table row indices belonging to the session, in file order
     * @return the session, or {@code null} when it holds no labelled participant or no segment data
     * @throws StructuralIntegrityException on inconsistent session data
     */
    Session assemble(String sessionCode, List<Integer> rows, WarningTally tally) {
        String sessionContext = "session=" + sessionCode;
        List<Participant> participants = participants(sessionCode, rows, tally);
        if (participants.isEmpty()) {
            tally.emptySession();
            log.warn("[SessionAssembler] Session has no labelled participants; skipped. session={}", sessionCode);
            return null;
        }

        Map<Integer, String> labels = new LinkedHashMap<>();
        participants.forEach(p -> labels.put(p.participantId(), p.label()));

        Map<String, Segment> segments = new LinkedHashMap<>();
        for (String segmentName : schema.segmentNames()) {
            Segment segment = assembleSegment(sessionCode, segmentName, participants, tally);
            if (segment != null) {
                segments.put(segmentName, segment);
            }
        }
        if (segments.isEmpty()) {
            tally.emptySession();
            log.warn("[SessionAssembler] Session has no segment data; skipped. {}", sessionContext);
            return null;
        }

        Session session = new Session(sessionCode, segments, labels, metadata(rows.get(0)));
        log.info("[SessionAssembler] Session built. session={} segments={} participants={}",
                 sessionCode, segments.keySet(), labels.size());
        return session;
    }

    private List<Participant> participants(String sessionCode, List<Integer> rows, WarningTally tally) {
        Map<String, Participant> byLabel = new LinkedHashMap<>();
        for (int row : rows) {
            String label = table.cell(row, schema.labelColumn());
            if (label == null) {
                tally.unlabeledParticipant();
                log.debug("[SessionAssembler] Row without participant.label skipped. session={} row={}", sessionCode, row);
                continue;
            }
            String context = "session=" + sessionCode + " participant=" + label;
            Integer participantId = parseInteger(table.cell(row, schema.participantIdColumn()), context, WideSchema.PARTICIPANT_ID);
            if (participantId == null) {
                throw new StructuralIntegrityException(context, "participant.id_in_session is empty");
            }
            Participant previous = byLabel.putIfAbsent(label, new Participant(row, label, participantId));
            if (previous != null) {
                throw new StructuralIntegrityException(context,
                    "label appears on rows " + previous.row() + " and " + row);
            }
        }
        return List.copyOf(byLabel.values());
    }

    private Map<String, String> metadata(int firstRow) {
        Map<String, String> metadata = new LinkedHashMap<>();
        METADATA_COLUMNS.forEach((key, column) -> {
            String value = table.cell(firstRow, column);
            if (value != null) {
                metadata.put(key, value);
            }
        });
        return metadata;
    }

    // ── Segment ─────────────────────────────────────────────────────────────

    private Segment assembleSegment(String sessionCode, String segmentName,
                                    List<Participant> participants, WarningTally tally) {
        String segmentContext = "session=" + sessionCode + " segment=" + segmentName;
        SoldTransitionTracker soldTracker = new SoldTransitionTracker();
        GroupRoster roster = new GroupRoster(segmentContext);
        Map<Integer, RoundDraft> drafts = new TreeMap<>();

        for (Participant participant : participants) {
            boolean seen = scanParticipant(segmentContext, segmentName, participant, soldTracker, roster, drafts, tally);
            if (!seen) {
                tally.participantSegmentSkipped();
                log.debug("[SessionAssembler] Participant has no data in segment. {} participant={}",
                          segmentContext, participant.label());
            }
        }
        if (drafts.isEmpty()) {
            return null;
        }

        Map<Integer, List<String>> rosters = roster.freeze();
        ChatAlignment chat = chatAligner != null
            ? chatAligner.align(sessionCode, segmentName, rosters, drafts.keySet())
            : ChatAlignment.none();
        if (chat.stats() != null) {
            tally.chatSegment(chat.stats());
        }

        Map<Integer, Round> rounds = new LinkedHashMap<>();
        for (Map.Entry<Integer, RoundDraft> e : drafts.entrySet()) {
            Map<Integer, Period> periods = new LinkedHashMap<>();
            e.getValue().periods.forEach((n, players) -> periods.put(n, new Period(n, players)));
            rounds.put(e.getKey(), new Round(e.getKey(), periods, e.getValue().payoffs, chat.messagesFor(e.getKey())));
        }
        Map<Integer, Group> groups = new LinkedHashMap<>();
        rosters.forEach((groupId, labels) ->
            groups.put(groupId, new Group(segmentName, groupId, labels, chat.channelsFor(groupId))));

        log.debug("[SessionAssembler] Segment built. {} rounds={} groups={}", segmentContext, rounds.size(), groups.size());
        return new Segment(segmentName, rounds, groups);
    }

    /** @return whether the participant has at least one observation in the segment */
    private boolean scanParticipant(String segmentContext, String segmentName, Participant participant,
                                    SoldTransitionTracker soldTracker, GroupRoster roster,
                                    Map<Integer, RoundDraft> drafts, WarningTally tally) {
        int row = participant.row();
        String label = participant.label();
        // round → column period holding the round's last observation for this player
        Map<Integer, Integer> lastColumnOfRound = new TreeMap<>();
        boolean defaulted = false;

        for (int columnPeriod : schema.periods(segmentName)) {
            String context = segmentContext + " participant=" + label + " period=" + columnPeriod;
            Integer idInGroup = parseInteger(field(row, segmentName, columnPeriod, WideSchema.ID_IN_GROUP),
                                             context, WideSchema.ID_IN_GROUP);
            if (idInGroup == null) {
                continue;
            }

            Integer roundNumber = parseInteger(field(row, segmentName, columnPeriod, WideSchema.ROUND_NUMBER_IN_SEGMENT),
                                               context, WideSchema.ROUND_NUMBER_IN_SEGMENT);
            Integer periodInRound = parseInteger(field(row, segmentName, columnPeriod, WideSchema.PERIOD_IN_ROUND),
                                                 context, WideSchema.PERIOD_IN_ROUND);
            tally.observation();
            if (roundNumber == null || periodInRound == null) {
                tally.fallbackObservation();
                defaulted = true;
            }
            if (roundNumber == null) {
                tally.roundNumberFallback();
                roundNumber = 1;
            }
            if (periodInRound == null) {
                tally.periodInRoundFallback();
                periodInRound = 1;
            }

            int sold        = parseInteger(field(row, segmentName, columnPeriod, WideSchema.SOLD), context, WideSchema.SOLD, 0);
            Double sellTime = parseDouble(field(row, segmentName, columnPeriod, WideSchema.SELL_CLICK_TIME), context, WideSchema.SELL_CLICK_TIME);
            Double signal   = parseDouble(field(row, segmentName, columnPeriod, WideSchema.SIGNAL), context, WideSchema.SIGNAL);
            Double price    = parseDouble(field(row, segmentName, columnPeriod, WideSchema.PRICE), context, WideSchema.PRICE);
            int state       = parseInteger(field(row, segmentName, columnPeriod, WideSchema.STATE), context, WideSchema.STATE, 0);
            Double payoff   = parseDouble(field(row, segmentName, columnPeriod, WideSchema.PAYOFF), context, WideSchema.PAYOFF);

            boolean soldThisPeriod;
            try {
                soldThisPeriod = soldTracker.observe(label, roundNumber, sold, sellTime != null, context);
            } catch (StructuralIntegrityException e) {
                if (!defaulted) {
                    throw e;
                }
                throw new StructuralIntegrityException(context,
                    "round or period number missing and defaulted to 1 for this player, which merges rounds; "
                    + e.getReason(), e);
            }

            Integer groupId = parseInteger(table.cell(row, schema.groupColumn(segmentName, columnPeriod, WideSchema.GROUP_ID_IN_SUBSESSION)),
                                           context, WideSchema.GROUP_ID_IN_SUBSESSION);
            if (groupId != null) {
                roster.record(groupId, label);
            }

            PlayerPeriodData observation = new PlayerPeriodData(participant.participantId(), label, idInGroup,
                sold, soldThisPeriod, signal, price, sellTime, state, payoff);
            Map<String, PlayerPeriodData> players = drafts.computeIfAbsent(roundNumber, k -> new RoundDraft())
                .periods.computeIfAbsent(periodInRound, k -> new LinkedHashMap<>());
            if (players.put(label, observation) != null) {
                log.debug("[SessionAssembler] Observation replaced an earlier one for the same round and period. {} round={} periodInRound={}",
                          context, roundNumber, periodInRound);
            }
            lastColumnOfRound.put(roundNumber, columnPeriod);
        }

        for (Map.Entry<Integer, Integer> e : lastColumnOfRound.entrySet()) {
            int roundNumber = e.getKey();
            String context = segmentContext + " participant=" + label + " period=" + e.getValue();
            String payoffField = WideSchema.roundPayoffField(roundNumber);
            Double payoff = parseDouble(field(row, segmentName, e.getValue(), payoffField), context, payoffField);
            if (payoff != null) {
                drafts.get(roundNumber).payoffs.put(label, payoff);
            } else {
                tally.missingRoundPayoff();
                log.debug("[SessionAssembler] Round payoff missing at the round's last period. {} round={}", context, roundNumber);
            }
        }
        return !lastColumnOfRound.isEmpty();
    }

    // ── Cells ───────────────────────────────────────────────────────────────

    private String field(int row, String segmentName, int columnPeriod, String field) {
        return table.cell(row, schema.playerColumn(segmentName, columnPeriod, field));
    }

    private static Integer parseInteger(String cell, String context, String field) {
        try {
            return Cells.toInteger(cell);
        } catch (IllegalArgumentException e) {
            throw new StructuralIntegrityException(context, field + ": " + e.getMessage(), e);
        }
    }

    private static int parseInteger(String cell, String context, String field, int fallback) {
        Integer value = parseInteger(cell, context, field);
        return value != null ? value : fallback;
    }

    private static Double parseDouble(String cell, String context, String field) {
        try {
            return Cells.toDouble(cell);
        } catch (IllegalArgumentException e) {
            throw new StructuralIntegrityException(context, field + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, String> metadataColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put(Session.PARTICIPATION_FEE, WideSchema.SESSION_PARTICIPATION_FEE);
        columns.put(Session.REAL_WORLD_CURRENCY_PER_POINT, WideSchema.SESSION_CURRENCY_PER_POINT);
        columns.put(Session.ROOM, WideSchema.SESSION_ROOM);
        columns.put(Session.IS_DEMO, WideSchema.SESSION_IS_DEMO);
        return columns;
    }
}
