package com.marketruns.common.builder;

import com.marketruns.common.model.ChatMessage;

import java.util.List;
import java.util.Map;

/**
 * Result of aligning one segment's chat: messages per round, each group's channel per
 * round, and the counts behind them. {@code stats} is {@code null} for a segment with no chat.
 */
record ChatAlignment(
    Map<Integer, List<ChatMessage>>       messagesByRound,
    Map<Integer, Map<Integer, Integer>>   channelsByGroup,
    ChatSegmentStats                      stats
) {

    static ChatAlignment none() {
        return new ChatAlignment(Map.of(), Map.of(), null);
    }

    List<ChatMessage> messagesFor(int roundNumber) {
        return messagesByRound.getOrDefault(roundNumber, List.of());
    }

    Map<Integer, Integer> channelsFor(int groupId) {
        return channelsByGroup.getOrDefault(groupId, Map.of());
    }
}
