package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketruns.common.model.PlayerPeriodData;

import java.time.Instant;

public record ObservationDTO(
    @JsonProperty("participantId")  int     participantId,
    @JsonProperty("label")          String  label,
    @JsonProperty("idInGroup")      int     idInGroup,
    @JsonProperty("sold")           int     sold,
    @JsonProperty("soldThisPeriod") boolean soldThisPeriod,
    @JsonProperty("signal")         Double  signal,
    @JsonProperty("price")          Double  price,
    @JsonProperty("sellTime")       Instant sellTime,
    @JsonProperty("state")          int     state,
    @JsonProperty("payoff")         Double  payoff
) {

    public static ObservationDTO from(PlayerPeriodData d) {
        return new ObservationDTO(d.participantId(), d.label(), d.idInGroup(), d.soldCumulative(),
            d.soldThisPeriod(), d.signal(), d.price(), d.sellInstant(), d.state(), d.payoff());
    }
}
