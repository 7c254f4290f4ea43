package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketruns.common.model.Round;

import java.util.List;
import java.util.Map;

public record RoundDTO(
    @JsonProperty("roundNumber")     int                         roundNumber,
    @JsonProperty("periodCount")     int                         periodCount,
    @JsonProperty("terminalPayoffs") Map<String, Double>         terminalPayoffs,
    @JsonProperty("sellersByPeriod") Map<Integer, List<String>>  sellersByPeriod,
    @JsonProperty("totalSellers")    int                         totalSellers,
    @JsonProperty("chatMessages")    List<ChatMessageDTO>        chatMessages
) {

    public static RoundDTO from(Round round) {
        return new RoundDTO(round.roundNumber(), round.periodCount(), round.terminalPayoffs(),
            round.sellersByPeriod(), round.totalSellers(),
            round.chatMessages().stream().map(ChatMessageDTO::from).toList());
    }
}
