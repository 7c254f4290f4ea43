package com.marketruns.common.builder;

import java.util.List;

/**
 * Recoverable data-quality findings of one build, aggregated so they can be reviewed in
 * one place rather than line by line. Counts include what was scanned in sessions whose build
 * later failed; only their chat outcome is left out, and their chat rows count as unmatched.
 *
 * @param rowsWithoutSession        participant rows with an empty {@code session.code}
 * @param unlabeledParticipants     participant rows skipped for an empty label
 * @param emptySessions             sessions that yielded no segment data
 * @param participantSegmentsSkipped participant/segment pairs with no data at all
 * @param observations              player-period observations built
 * @param roundNumberFallbacks      observations that used round 1 for a missing round number
 * @param periodInRoundFallbacks    observations that used period 1 for a missing period
 * @param fallbackObservations      observations that used at least one of the two defaults
 * @param missingRoundPayoffs       player rounds whose final payoff cell was empty
 * @param unparseableChatRows       chat rows whose channel or timestamp could not be read
 * @param unmatchedChatRows         chat rows for a session or segment that was not built
 * @param chatSegments              per-segment chat alignment outcome
 */
public record BuildReport(
    int rowsWithoutSession,
    int unlabeledParticipants,
    int emptySessions,
    int participantSegmentsSkipped,
    int observations,
    int roundNumberFallbacks,
    int periodInRoundFallbacks,
    int fallbackObservations,
    int missingRoundPayoffs,
    int unparseableChatRows,
    int unmatchedChatRows,
    List<ChatSegmentStats> chatSegments
) {

    public BuildReport {
        chatSegments = List.copyOf(chatSegments);
    }

    public int fallbackCount() {
        return roundNumberFallbacks + periodInRoundFallbacks;
    }

    /** Share of observations that used at least one default; 0 when nothing was observed. */
    public double fallbackRatio() {
        if (observations == 0) return 0.0;
        return (double) fallbackObservations / observations;
    }

    public int attachedChatMessages() {
        return chatSegments.stream().mapToInt(ChatSegmentStats::attachedMessages).sum();
    }

    public int droppedChatMessages() {
        return chatSegments.stream().mapToInt(ChatSegmentStats::droppedMessages).sum();
    }

    public boolean hasWarnings() {
        return rowsWithoutSession > 0
            || unlabeledParticipants > 0
            || emptySessions > 0
            || participantSegmentsSkipped > 0
            || fallbackCount() > 0
            || missingRoundPayoffs > 0
            || unparseableChatRows > 0
            || unmatchedChatRows > 0
            || droppedChatMessages() > 0
            || chatSegments.stream().anyMatch(ChatSegmentStats::hasChannelGaps);
    }

    public String summary() {
        long gapSegments = chatSegments.stream().filter(ChatSegmentStats::hasChannelGaps).count();
        return "rowsWithoutSession=" + rowsWithoutSession
            + " unlabeledParticipants=" + unlabeledParticipants
            + " emptySessions=" + emptySessions
            + " participantSegmentsSkipped=" + participantSegmentsSkipped
            + " observations=" + observations
            + " roundNumberFallbacks=" + roundNumberFallbacks
            + " periodInRoundFallbacks=" + periodInRoundFallbacks
            + " missingRoundPayoffs=" + missingRoundPayoffs
            + " chatAttached=" + attachedChatMessages()
            + " chatDropped=" + droppedChatMessages()
            + " chatSegmentsWithGaps=" + gapSegments
            + " unparseableChatRows=" + unparseableChatRows
            + " unmatchedChatRows=" + unmatchedChatRows;
    }
}
