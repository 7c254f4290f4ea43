package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketruns.common.model.Session;

import java.util.List;
import java.util.Map;

public record SessionDTO(
    @JsonProperty("sessionCode")       String               sessionCode,
    @JsonProperty("segments")          List<String>         segments,
    @JsonProperty("participantLabels") Map<Integer, String> participantLabels,
    @JsonProperty("metadata")          Map<String, String>  metadata
) {

    public static SessionDTO from(Session session) {
        return new SessionDTO(session.sessionCode(), session.segmentNames(),
                              session.participantLabels(), session.metadata());
    }
}
