package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketruns.common.model.Period;

import java.util.List;

public record PeriodDTO(
    @JsonProperty("periodInRound")    int                  periodInRound,
    @JsonProperty("sellers")          List<String>         sellers,
    @JsonProperty("averageSalePrice") Double               averageSalePrice,   // null when nobody sold
    @JsonProperty("players")          List<ObservationDTO> players
) {

    public static PeriodDTO from(Period period) {
        return new PeriodDTO(period.periodInRound(), period.sellers(), period.averageSalePrice(),
            period.players().values().stream().map(ObservationDTO::from).toList());
    }
}
