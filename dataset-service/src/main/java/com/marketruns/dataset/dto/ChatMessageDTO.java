package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketruns.common.model.ChatMessage;

import java.time.Instant;

public record ChatMessageDTO(
    @JsonProperty("sender")  String  sender,
    @JsonProperty("body")    String  body,
    @JsonProperty("sentAt")  Instant sentAt,
    @JsonProperty("channel") int     channel
) {

    public static ChatMessageDTO from(ChatMessage m) {
        return new ChatMessageDTO(m.senderLabel(), m.body(), m.sentAt(), m.channelNumber());
    }
}
