package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketruns.common.model.Group;

import java.util.List;
import java.util.Map;

public record GroupDTO(
    @JsonProperty("segment")      String                segment,
    @JsonProperty("groupId")      int                   groupId,
    @JsonProperty("playerLabels") List<String>          playerLabels,
    @JsonProperty("chatChannels") Map<Integer, Integer> chatChannels   // round → channel
) {

    public static GroupDTO from(Group group) {
        return new GroupDTO(group.segmentName(), group.groupId(), group.playerLabels(), group.chatChannels());
    }
}
