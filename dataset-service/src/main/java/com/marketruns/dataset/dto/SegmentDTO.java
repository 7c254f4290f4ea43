package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketruns.common.model.Round;
import com.marketruns.common.model.Segment;

import java.util.List;

/** A segment's round index and group rosters, without per-period detail. */
public record SegmentDTO(
    @JsonProperty("name")   String             name,
    @JsonProperty("rounds") List<RoundSummary> rounds,
    @JsonProperty("groups") List<GroupDTO>     groups
) {

    public record RoundSummary(
        @JsonProperty("roundNumber")      int roundNumber,
        @JsonProperty("periodCount")      int periodCount,
        @JsonProperty("totalSellers")     int totalSellers,
        @JsonProperty("chatMessageCount") int chatMessageCount
    ) {
        static RoundSummary from(Round round) {
            return new RoundSummary(round.roundNumber(), round.periodCount(),
                                    round.totalSellers(), round.chatMessageCount());
        }
    }

    public static SegmentDTO from(Segment segment) {
        return new SegmentDTO(segment.name(),
            segment.rounds().values().stream().map(RoundSummary::from).toList(),
            segment.groups().values().stream().map(GroupDTO::from).toList());
    }
}
