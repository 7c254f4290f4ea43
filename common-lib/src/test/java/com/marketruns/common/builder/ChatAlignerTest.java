package com.marketruns.common.builder;

import com.marketruns.common.exception.SchemaMismatchException;
import com.marketruns.common.model.ChatMessage;
import com.marketruns.common.table.DataTable;
import com.marketruns.common.testing.ChatTableBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChatAlignerTest {

    private static final Map<Integer, List<String>> ROSTERS = Map.of(
        1, List.of("A", "B"),
        2, List.of("C", "D"));

    private static final Set<Integer> ROUNDS = Set.of(1, 2, 3);

    private static ChatAligner aligner(DataTable chat, int channelsPerRound) {
        return new ChatAligner(chat, BuildOptions.defaults().withChannelsPerRound(channelsPerRound));
    }

    // ── roundForChannel() ──────────────────────────────────────────────────

    @Nested
    @DisplayName("roundForChannel()")
    class RoundMappingTests {

        @Test
        @DisplayName("channels 5..12 with 4 per round → rounds 1,1,1,1,2,2,2,2")
        void contiguousChannels() {
            List<Integer> rounds = new ArrayList<>();
            for (int channel = 5; channel <= 12; channel++) {
                rounds.add(ChatAligner.roundForChannel(channel, 5, 4));
            }
            assertEquals(List.of(1, 1, 1, 1, 2, 2, 2, 2), rounds);
        }

        @Test
        @DisplayName("the lowest channel is always round 1")
        void minChannel() {
            assertEquals(1, ChatAligner.roundForChannel(37, 37, 4));
        }
    }

    // ── align() ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("align()")
    class AlignTests {

        @Test
        @DisplayName("channel owner is the first known member to write on it")
        void firstWriterWins() {
            DataTable chat = ChatTableBuilder.create()
                .message("s1", "seg", 5, "Z", "lurker", 1.0)
                .message("s1", "seg", 5, "A", "hi", 2.0)
                .message("s1", "seg", 5, "C", "wrong room?", 3.0)
                .build();

            ChatAlignment alignment = aligner(chat, 2).align("s1", "seg", ROSTERS, ROUNDS);

            assertEquals(Map.of(1, 5), alignment.channelsFor(1));
            assertTrue(alignment.channelsFor(2).isEmpty());
            assertEquals(3, alignment.messagesFor(1).size());
            assertEquals(3, alignment.stats().attachedMessages());
        }

        @Test
        @DisplayName("messages are attached in timestamp order, ties keep file order")
        void timestampOrder() {
            DataTable chat = ChatTableBuilder.create()
                .message("s1", "seg", 5, "B", "second", 20.0)
                .message("s1", "seg", 5, "A", "first", 10.0)
                .message("s1", "seg", 6, "C", "tie-1", 20.0)
                .build();

            List<ChatMessage> round1 = aligner(chat, 2).align("s1", "seg", ROSTERS, ROUNDS).messagesFor(1);

            assertEquals(List.of("first", "second", "tie-1"), round1.stream().map(ChatMessage::body).toList());
        }

        @Test
        @DisplayName("attached + dropped equals the segment's message count")
        void partitionCompleteness() {
            DataTable chat = ChatTableBuilder.create()
                .message("s1", "seg", 5, "A", "a", 1.0)
                .message("s1", "seg", 6, "C", "c", 2.0)
                .message("s1", "seg", 7, "Z", "unowned", 3.0)
                .message("s1", "seg", 7, "Y", "unowned too", 4.0)
                .message("s1", "seg", 8, "D", "d", 5.0)
                .message("s1", "seg", 11, "B", "round four", 6.0)
                .build();

            ChatSegmentStats stats = aligner(chat, 2)
                .align("s1", "seg", ROSTERS, ROUNDS).stats();

            assertEquals(6, stats.totalMessages());
            assertEquals(3, stats.attachedMessages());
            assertEquals(2, stats.unownedMessages());
            assertEquals(1, stats.outOfRangeMessages());
            assertEquals(stats.totalMessages(), stats.attachedMessages() + stats.droppedMessages());
            assertEquals(List.of(7), stats.unownedChannels());
        }

        @Test
        @DisplayName("a missing channel shifts later rounds and is reported as a gap")
        void gapFragility() {
            // channel 7 never opened: 8 now lands in round 2 instead of round 1's second room
            DataTable chat = ChatTableBuilder.create()
                .message("s1", "seg", 5, "A", "r1", 1.0)
                .message("s1", "seg", 6, "C", "r1", 2.0)
                .message("s1", "seg", 8, "D", "meant for r2", 3.0)
                .message("s1", "seg", 9, "B", "meant for r3", 4.0)
                .build();

            ChatAlignment alignment = aligner(chat, 2).align("s1", "seg", ROSTERS, ROUNDS);

            assertTrue(alignment.stats().hasChannelGaps());
            assertEquals(List.of(7), alignment.stats().missingChannels());
            assertEquals(Map.of(1, 5, 3, 9), alignment.channelsFor(1));
            assertEquals(Map.of(1, 6, 2, 8), alignment.channelsFor(2));
        }

        @Test
        @DisplayName("a group's second channel in one round is dropped and counted, not attached")
        void secondChannelInRound() {
            // 5 and 6 both map to round 1 and both are first written by group 1
            DataTable chat = ChatTableBuilder.create()
                .message("s1", "seg", 5, "A", "room one", 1.0)
                .message("s1", "seg", 6, "B", "stray room", 2.0)
                .message("s1", "seg", 5, "B", "back", 3.0)
                .build();

            ChatAlignment alignment = aligner(chat, 2).align("s1", "seg", ROSTERS, ROUNDS);
            ChatSegmentStats stats = alignment.stats();

            assertEquals(Map.of(1, 5), alignment.channelsFor(1));
            assertEquals(List.of("room one", "back"),
                         alignment.messagesFor(1).stream().map(ChatMessage::body).toList());
            assertEquals(1, stats.conflictingMessages());
            assertEquals(stats.totalMessages(), stats.attachedMessages() + stats.droppedMessages());
        }

        @Test
        @DisplayName("segment names match exactly, a prefix does not leak")
        void exactSegmentMatch() {
            DataTable chat = ChatTableBuilder.create()
                .message("s1", "chat_noavg", 5, "A", "mine", 1.0)
                .message("s1", "chat_noavg2", 1, "A", "other segment", 2.0)
                .build();

            ChatAlignment alignment = aligner(chat, 4).align("s1", "chat_noavg", ROSTERS, ROUNDS);

            assertEquals(1, alignment.stats().totalMessages());
            assertEquals("mine", alignment.messagesFor(1).get(0).body());
        }

        @Test
        @DisplayName("a segment absent from the log contributes nothing")
        void absentSegment() {
            DataTable chat = ChatTableBuilder.create()
                .message("s1", "other", 5, "A", "x", 1.0)
                .build();

            ChatAlignment alignment = aligner(chat, 4).align("s1", "seg", ROSTERS, ROUNDS);

            assertNull(alignment.stats());
            assertTrue(alignment.messagesFor(1).isEmpty());
        }

        @Test
        @DisplayName("sessions do not share channels")
        void sessionScoped() {
            DataTable chat = ChatTableBuilder.create()
                .message("s1", "seg", 5, "A", "s1", 1.0)
                .message("s2", "seg", 5, "A", "s2", 2.0)
                .build();

            ChatAlignment alignment = aligner(chat, 4).align("s2", "seg", ROSTERS, ROUNDS);

            assertEquals(List.of("s2"), alignment.messagesFor(1).stream().map(ChatMessage::body).toList());
        }

        @Test
        @DisplayName("attached messages keep sender, code, sequence and channel")
        void messageFields() {
            DataTable chat = ChatTableBuilder.create()
                .message("s1", "seg", 5, "A", "hi", 1700000000.0)
                .build();

            ChatMessage m = aligner(chat, 4).align("s1", "seg", ROSTERS, ROUNDS).messagesFor(1).get(0);

            assertEquals("A", m.senderLabel());
            assertEquals("code_A", m.participantCode());
            assertEquals(1, m.sequenceId());
            assertEquals(5, m.channelNumber());
            assertEquals(1700000000L, m.sentAt().getEpochSecond());
        }
    }

    // ── unmatchedRows() ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("unmatchedRows()")
    class UnmatchedTests {

        private DataTable chat() {
            return ChatTableBuilder.create()
                .message("s1", "seg", 5, "A", "known", 1.0)
                .message("s1x", "seg", 5, "A", "typo in session", 2.0)
                .message("s1", "other", 5, "A", "unknown segment", 3.0)
                .message("s1", "other", 6, "C", "unknown segment", 4.0)
                .build();
        }

        @Test
        @DisplayName("rows for a session or segment never aligned are counted")
        void unknownSessionAndSegment() {
            ChatAligner aligner = aligner(chat(), 4);
            aligner.align("s1", "seg", ROSTERS, ROUNDS);

            assertEquals(3, aligner.unmatchedRows(Set.of("s1")));
        }

        @Test
        @DisplayName("rows of an aligned segment whose session was not built are counted")
        void sessionNotBuilt() {
            ChatAligner aligner = aligner(chat(), 4);
            aligner.align("s1", "seg", ROSTERS, ROUNDS);

            assertEquals(4, aligner.unmatchedRows(Set.of()));
        }
    }

    // ── parsing ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("chat table parsing")
    class ParsingTests {

        @Test
        @DisplayName("rows with a bad or oversized channel, or a bad timestamp, are counted and skipped")
        void unparseableRows() {
            DataTable chat = ChatTableBuilder.create()
                .raw("s1", "garbage", "A", "x", "1.0")
                .raw("s1", "1-seg-5", "A", "x", "not-a-time")
                .raw("s1", "1-seg-5", "A", "x", "")
                .raw("s1", "1-seg-99999999999", "A", "x", "5.0")
                .raw("s1", "1-seg-5", "A", "ok", "4.0")
                .build();

            ChatAligner aligner = aligner(chat, 4);

            assertEquals(4, aligner.unparseableRows());
            assertEquals(1, aligner.align("s1", "seg", ROSTERS, ROUNDS).stats().totalMessages());
        }

        @Test
        @DisplayName("missing required column → SchemaMismatchException")
        void missingColumn() {
            DataTable chat = DataTable.of("chat", List.of("session_code", "channel", "nickname", "body"), List.of());

            SchemaMismatchException e = assertThrows(SchemaMismatchException.class, () -> aligner(chat, 4));
            assertTrue(e.getMessage().contains("timestamp"));
        }
    }
}
