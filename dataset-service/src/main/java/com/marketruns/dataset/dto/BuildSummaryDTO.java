package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketruns.common.builder.BuildReport;
import com.marketruns.common.builder.BuildResult;

import java.time.Instant;
import java.util.List;

/** Outcome of the latest load: status, what was built, and the data-quality counts. */
public record BuildSummaryDTO(
    @JsonProperty("experimentName")     String       experimentName,
    @JsonProperty("status")             String       status,
    @JsonProperty("loadedAt")           Instant      loadedAt,
    @JsonProperty("sessionCodes")       List<String> sessionCodes,
    @JsonProperty("totalParticipants")  int          totalParticipants,
    @JsonProperty("failures")           List<FailureDTO> failures,

    // ── Data quality ──────────────────────────────────────────────────────────
    @JsonProperty("observations")               int    observations,
    @JsonProperty("rowsWithoutSession")         int    rowsWithoutSession,
    @JsonProperty("unlabeledParticipants")      int    unlabeledParticipants,
    @JsonProperty("emptySessions")              int    emptySessions,
    @JsonProperty("participantSegmentsSkipped") int    participantSegmentsSkipped,
    @JsonProperty("fallbackRatio")              double fallbackRatio,
    @JsonProperty("missingRoundPayoffs")        int    missingRoundPayoffs,
    @JsonProperty("chatAttached")               int    chatAttached,
    @JsonProperty("chatDropped")                int    chatDropped,
    @JsonProperty("unparseableChatRows")        int    unparseableChatRows,
    @JsonProperty("unmatchedChatRows")          int    unmatchedChatRows
) {

    public record FailureDTO(
        @JsonProperty("sessionCode") String sessionCode,
        @JsonProperty("message")     String message
    ) {}

    public static BuildSummaryDTO from(BuildResult result, Instant loadedAt) {
        BuildReport r = result.report();
        List<FailureDTO> failures = result.failures().stream()
            .map(f -> new FailureDTO(f.sessionCode(), f.message()))
            .toList();
        return new BuildSummaryDTO(
            result.experiment().name(), result.status().name(), loadedAt,
            result.experiment().sessionCodes(), result.experiment().totalParticipants(), failures,
            r.observations(), r.rowsWithoutSession(), r.unlabeledParticipants(), r.emptySessions(),
            r.participantSegmentsSkipped(), r.fallbackRatio(), r.missingRoundPayoffs(),
            r.attachedChatMessages(), r.droppedChatMessages(), r.unparseableChatRows(), r.unmatchedChatRows());
    }
}
