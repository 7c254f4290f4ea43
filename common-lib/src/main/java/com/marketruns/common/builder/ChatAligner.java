package com.marketruns.common.builder;

import com.marketruns.common.exception.SchemaMismatchException;
import com.marketruns.common.model.ChatMessage;
import com.marketruns.common.table.Cells;
import com.marketruns.common.table.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;

/**
 * Attributes chat messages to rounds and groups.
 *
 * <p>The log only tags each message with a channel {@code <const>-<segment>-<n>}. Per segment:
 * <ol>
 *   <li>A channel belongs to the group of the first sender (by timestamp) who is a known
 *       member of one of the segment's groups.</li>
 *   <li>Channel numbers are assumed contiguous and opened round by round, so
 *       {@code round = (channel - minChannel) / channelsPerRound + 1} with
 *       {@code minChannel} the lowest channel seen for the segment.</li>
 * </ol>
 * Messages on unattributable channels, whose round does not exist, or on a second channel
 * of a group that already chatted elsewhere in the round are dropped and counted. Gaps in
 * the channel numbering are reported because they shift every later round.
 *
 * <p>The chat table is parsed once per build; {@link #align} is then called per segment.
 * Rows for a session or segment that is never aligned are reported by {@link #unmatchedRows}.
 */
final class ChatAligner {

    private static final Logger log = LoggerFactory.getLogger(ChatAligner.class);

    static final String SESSION_CODE     = "session_code";
    static final String CHANNEL          = "channel";
    static final String NICKNAME         = "nickname";
    static final String BODY             = "body";
    static final String TIMESTAMP        = "timestamp";
    static final String PARTICIPANT_CODE = "participant_code";
    static final String ID_IN_SESSION    = "id_in_session";

    private record SegmentKey(String sessionCode, String segmentName) {}

    private record ChatRow(int channel, String nickname, String body, double timestamp,
                           String participantCode, Integer idInSession) {}

    private final BuildOptions options;
    private final Map<SegmentKey, List<ChatRow>> rowsBySegment = new HashMap<>();
    private final Set<SegmentKey> aligned = new HashSet<>();
    private int unparseableRows;

    /**
     * @throws SchemaMismatchException if a required chat column is missing
     */
    ChatAligner(DataTable chat, BuildOptions options) {
        this.options = options;
        for (String required : List.of(SESSION_CODE, CHANNEL, NICKNAME, BODY, TIMESTAMP)) {
            if (!chat.hasColumn(required)) {
                throw new SchemaMismatchException("source=" + chat.source(),
                    "required chat column missing: " + required);
            }
        }
        index(chat);
    }

    private void index(DataTable chat) {
        int sessionCol  = chat.columnIndex(SESSION_CODE);
        int channelCol  = chat.columnIndex(CHANNEL);
        int nickCol     = chat.columnIndex(NICKNAME);
        int bodyCol     = chat.columnIndex(BODY);
        int tsCol       = chat.columnIndex(TIMESTAMP);
        int codeCol     = chat.columnIndex(PARTICIPANT_CODE);
        int idCol       = chat.columnIndex(ID_IN_SESSION);

        for (int r = 0; r < chat.rowCount(); r++) {
            String sessionCode = chat.cell(r, sessionCol);
            String channel     = chat.cell(r, channelCol);
            String nickname    = chat.cell(r, nickCol);
            Matcher m = channel != null ? options.chatChannelPattern().matcher(channel) : null;
            if (sessionCode == null || nickname == null || m == null || !m.matches()) {
                unparseableRows++;
                log.debug("[ChatAligner] Unparseable chat row skipped. row={} channel={}", r, channel);
                continue;
            }
            int channelNumber;
            Double timestamp;
            Integer idInSession;
            try {
                channelNumber = Integer.parseInt(m.group(2));
                timestamp   = Cells.toDouble(chat.cell(r, tsCol));
                idInSession = Cells.toInteger(chat.cell(r, idCol));
            } catch (IllegalArgumentException e) {
                unparseableRows++;
                log.debug("[ChatAligner] Chat row with bad number skipped. row={} reason={}", r, e.getMessage());
                continue;
            }
            if (timestamp == null) {
                unparseableRows++;
                log.debug("[ChatAligner] Chat row without timestamp skipped. row={}", r);
                continue;
            }
            String body = chat.cell(r, bodyCol);
            ChatRow row = new ChatRow(channelNumber, nickname, body != null ? body : "",
                timestamp, chat.cell(r, codeCol), idInSession);
            rowsBySegment.computeIfAbsent(new SegmentKey(sessionCode, m.group(1)), k -> new ArrayList<>()).add(row);
        }
        // stable: equal timestamps keep file order
        rowsBySegment.values().forEach(rows -> rows.sort(Comparator.comparingDouble(ChatRow::timestamp)));
    }

    int unparseableRows() {
        return unparseableRows;
    }

    /**
     * Rows whose session and segment were not aligned into a built session: an unknown
     * session code, a segment absent from the wide export, or a session whose build failed.
     */
    int unmatchedRows(Set<String> builtSessions) {
        Map<SegmentKey, Integer> unmatched = new TreeMap<>(
            Comparator.comparing(SegmentKey::sessionCode).thenComparing(SegmentKey::segmentName));
        rowsBySegment.forEach((key, rows) -> {
            if (!aligned.contains(key) || !builtSessions.contains(key.sessionCode())) {
                unmatched.put(key, rows.size());
            }
        });
        if (!unmatched.isEmpty()) {
            log.warn("[ChatAligner] Chat rows match no built session and segment; not attached. segments={}", unmatched);
        }
        return unmatched.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Round a channel maps to, given the lowest channel number of the segment. */
    static int roundForChannel(int channel, int minChannel, int channelsPerRound) {
        return (channel - minChannel) / channelsPerRound + 1;
    }

    /**
     * @param rosters      the segment's group id → member labels
     * @param roundNumbers rounds that exist in the segment
     */
    ChatAlignment align(String sessionCode, String segmentName,
                        Map<Integer, List<String>> rosters, Set<Integer> roundNumbers) {
        SegmentKey key = new SegmentKey(sessionCode, segmentName);
        aligned.add(key);
        List<ChatRow> rows = rowsBySegment.getOrDefault(key, List.of());
        if (rows.isEmpty()) {
            return ChatAlignment.none();
        }

        Map<String, Integer> groupOfLabel = new HashMap<>();
        rosters.forEach((groupId, labels) -> labels.forEach(l -> groupOfLabel.put(l, groupId)));

        TreeSet<Integer> observed = new TreeSet<>();
        Map<Integer, Integer> channelOwner = new HashMap<>();
        for (ChatRow row : rows) {
            observed.add(row.channel());
            if (!channelOwner.containsKey(row.channel())) {
                Integer groupId = groupOfLabel.get(row.nickname());
                if (groupId != null) {
                    channelOwner.put(row.channel(), groupId);
                }
            }
        }
        int minChannel = observed.first();

        List<Integer> missingChannels = new ArrayList<>();
        for (int c = minChannel; c <= observed.last(); c++) {
            if (!observed.contains(c)) missingChannels.add(c);
        }
        List<Integer> unownedChannels = new ArrayList<>();
        for (int c : observed) {
            if (!channelOwner.containsKey(c)) unownedChannels.add(c);
        }

        Map<Integer, List<ChatMessage>> byRound = new TreeMap<>();
        Map<Integer, Map<Integer, Integer>> channelsByGroup = new TreeMap<>();
        int attached = 0;
        int unowned = 0;
        int outOfRange = 0;
        int conflicting = 0;
        Set<Integer> conflictingChannels = new TreeSet<>();
        for (ChatRow row : rows) {
            Integer groupId = channelOwner.get(row.channel());
            if (groupId == null) {
                unowned++;
                continue;
            }
            int round = roundForChannel(row.channel(), minChannel, options.channelsPerRound());
            if (!roundNumbers.contains(round)) {
                outOfRange++;
                continue;
            }
            // first channel seen for the group in the round is its room
            Integer previous = channelsByGroup.computeIfAbsent(groupId, k -> new TreeMap<>())
                .putIfAbsent(round, row.channel());
            if (previous != null && previous != row.channel()) {
                conflicting++;
                conflictingChannels.add(row.channel());
                continue;
            }
            byRound.computeIfAbsent(round, k -> new ArrayList<>()).add(new ChatMessage(
                row.nickname(), row.body(), row.timestamp(), row.participantCode(), row.idInSession(), row.channel()));
            attached++;
        }

        ChatSegmentStats stats = new ChatSegmentStats(sessionCode, segmentName, rows.size(),
            attached, unowned, outOfRange, conflicting, unownedChannels, missingChannels);

        if (!conflictingChannels.isEmpty()) {
            log.warn("[ChatAligner] Groups with a second channel in one round; those messages dropped. "
                     + "session={} segment={} channels={} dropped={}",
                     sessionCode, segmentName, conflictingChannels, conflicting);
        }
        if (!missingChannels.isEmpty()) {
            log.warn("[ChatAligner] Channel numbering has gaps; round attribution may be shifted. "
                     + "session={} segment={} missing={}", sessionCode, segmentName, missingChannels);
        }
        log.debug("[ChatAligner] Segment aligned. session={} segment={} total={} attached={} dropped={}",
                  sessionCode, segmentName, rows.size(), attached, stats.droppedMessages());
        return new ChatAlignment(byRound, channelsByGroup, stats);
    }
}
