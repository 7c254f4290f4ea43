package com.marketruns.common.model;

import java.time.Instant;

/**
 * A single chat message, attached to exactly one {@link Round} once the channel it was
 * posted on has been resolved to a group and a round.
 *
 * @param senderLabel     participant label of the sender (the chat nickname)
 * @param body            message text
 * @param timestamp       unix epoch seconds
 * @param participantCode sender's participant code, {@code null} if not exported
 * @param sequenceId      sender's {@code id_in_session}, {@code null} if not exported
 * @param channelNumber   numeric suffix of the chat channel the message was posted on
 */
public record ChatMessage(
    String  senderLabel,
    String  body,
    double  timestamp,
    String  participantCode,
    Integer sequenceId,
    int     channelNumber
) {

    public Instant sentAt() {
        return PlayerPeriodData.toInstant(timestamp);
    }

    @Override
    public String toString() {
        return "[" + senderLabel + "]: " + body;
    }
}
