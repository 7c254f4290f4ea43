package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExportResultDTO(
    @JsonProperty("level") String level,
    @JsonProperty("path")  String path,
    @JsonProperty("rows")  int    rows
) {}
