package com.marketruns.common.builder;

import java.util.List;

/**
 * Outcome of aligning one segment's chat log.
 *
 * <p>{@code totalMessages == attachedMessages + droppedMessages()}.
 *
 * @param unownedMessages    messages on channels where no sender is a known group member
 * @param outOfRangeMessages messages whose inferred round does not exist in the segment
 * @param conflictingMessages messages on a second channel of a group that already has a
 *                           channel in the same round
 * @param unownedChannels    channels that could not be attributed to a group
 * @param missingChannels    channel numbers absent between the lowest and highest observed;
 *                           non-empty means the round inference may be shifted
 */
public record ChatSegmentStats(
    String        sessionCode,
    String        segmentName,
    int           totalMessages,
    int           attachedMessages,
    int           unownedMessages,
    int           outOfRangeMessages,
    int           conflictingMessages,
    List<Integer> unownedChannels,
    List<Integer> missingChannels
) {

    public ChatSegmentStats {
        unownedChannels = List.copyOf(unownedChannels);
        missingChannels = List.copyOf(missingChannels);
    }

    public int droppedMessages() {
        return unownedMessages + outOfRangeMessages + conflictingMessages;
    }

    public boolean hasChannelGaps() {
        return !missingChannels.isEmpty();
    }
}
