package com.marketruns.common.builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable counters behind a {@link BuildReport}. One per session; a failed session's counts are
 * merged without its chat outcome, since none of its chat reaches the model.
 */
final class WarningTally {

    private int rowsWithoutSession;
    private int unlabeledParticipants;
    private int emptySessions;
    private int participantSegmentsSkipped;
    private int observations;
    private int roundNumberFallbacks;
    private int periodInRoundFallbacks;
    private int fallbackObservations;
    private int missingRoundPayoffs;
    private int unparseableChatRows;
    private int unmatchedChatRows;
    private final List<ChatSegmentStats> chatSegments = new ArrayList<>();

    void rowWithoutSession()         { rowsWithoutSession++; }
    void unlabeledParticipant()      { unlabeledParticipants++; }
    void emptySession()              { emptySessions++; }
    void participantSegmentSkipped() { participantSegmentsSkipped++; }
    void observation()               { observations++; }
    void roundNumberFallback()       { roundNumberFallbacks++; }
    void periodInRoundFallback()     { periodInRoundFallbacks++; }
    void fallbackObservation()       { fallbackObservations++; }
    void missingRoundPayoff()        { missingRoundPayoffs++; }
    void unparseableChatRows(int n)  { unparseableChatRows += n; }
    void unmatchedChatRows(int n)    { unmatchedChatRows += n; }
    void chatSegment(ChatSegmentStats stats) { chatSegments.add(stats); }

    void merge(WarningTally other) {
        mergeCounts(other);
        chatSegments.addAll(other.chatSegments);
    }

    void mergeFailed(WarningTally other) {
        mergeCounts(other);
    }

    private void mergeCounts(WarningTally other) {
        rowsWithoutSession         += other.rowsWithoutSession;
        unlabeledParticipants      += other.unlabeledParticipants;
        emptySessions              += other.emptySessions;
        participantSegmentsSkipped += other.participantSegmentsSkipped;
        observations               += other.observations;
        roundNumberFallbacks       += other.roundNumberFallbacks;
        periodInRoundFallbacks     += other.periodInRoundFallbacks;
        fallbackObservations       += other.fallbackObservations;
        missingRoundPayoffs        += other.missingRoundPayoffs;
        unparseableChatRows        += other.unparseableChatRows;
        unmatchedChatRows          += other.unmatchedChatRows;
    }

    BuildReport toReport() {
        return new BuildReport(rowsWithoutSession, unlabeledParticipants, emptySessions,
            participantSegmentsSkipped, observations, roundNumberFallbacks, periodInRoundFallbacks,
            fallbackObservations, missingRoundPayoffs, unparseableChatRows, unmatchedChatRows, chatSegments);
    }
}
