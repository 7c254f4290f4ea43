package com.marketruns.dataset.controller;

import com.marketruns.common.exception.MissingInputException;
import com.marketruns.common.exception.SchemaMismatchException;
import com.marketruns.dataset.dto.BuildSummaryDTO;
import com.marketruns.dataset.dto.ChatMessageDTO;
import com.marketruns.dataset.dto.ExportResultDTO;
import com.marketruns.dataset.dto.FlatTableDTO;
import com.marketruns.dataset.dto.GroupDTO;
import com.marketruns.dataset.dto.ObservationDTO;
import com.marketruns.dataset.dto.PeriodDTO;
import com.marketruns.dataset.dto.RoundDTO;
import com.marketruns.dataset.dto.SegmentDTO;
import com.marketruns.dataset.dto.SessionDTO;
import com.marketruns.dataset.service.ExperimentNotLoadedException;
import com.marketruns.dataset.service.ExperimentQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only HTTP surface over the rebuilt experiment.
 *
 * <p>Unknown keys answer 404, queries before the first build 503, a bad flatten level 400.
 */
@RestController
@RequestMapping("/api/v1/experiment")
public class ExperimentController {

    private static final Logger log = LoggerFactory.getLogger(ExperimentController.class);

    private final ExperimentQueryService queryService;

    public ExperimentController(ExperimentQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public Mono<ResponseEntity<BuildSummaryDTO>> summary() {
        log.info("[ExperimentAPI] Summary requested");
        return respond(queryService.summary(), "summary");
    }

    @PostMapping("/reload")
    public Mono<ResponseEntity<BuildSummaryDTO>> reload() {
        log.info("[ExperimentAPI] Reload requested");
        return respond(queryService.reload(), "reload");
    }

    // ── Navigation ──────────────────────────────────────────────────────────

    @GetMapping("/sessions")
    public Mono<ResponseEntity<List<SessionDTO>>> sessions() {
        return respond(queryService.sessions(), "sessions");
    }

    @GetMapping("/sessions/{sessionCode}")
    public Mono<ResponseEntity<SessionDTO>> session(@PathVariable String sessionCode) {
        return respond(queryService.session(sessionCode), "session " + sessionCode);
    }

    @GetMapping("/sessions/{sessionCode}/segments/{segment}")
    public Mono<ResponseEntity<SegmentDTO>> segment(@PathVariable String sessionCode,
                                                    @PathVariable String segment) {
        return respond(queryService.segment(sessionCode, segment), "segment " + segment);
    }

    @GetMapping("/sessions/{sessionCode}/segments/{segment}/rounds/{round}")
    public Mono<ResponseEntity<RoundDTO>> round(@PathVariable String sessionCode,
                                                @PathVariable String segment,
                                                @PathVariable int round) {
        return respond(queryService.round(sessionCode, segment, round), "round " + round);
    }

    @GetMapping("/sessions/{sessionCode}/segments/{segment}/rounds/{round}/periods/{period}")
    public Mono<ResponseEntity<PeriodDTO>> period(@PathVariable String sessionCode,
                                                  @PathVariable String segment,
                                                  @PathVariable int round,
                                                  @PathVariable int period) {
        return respond(queryService.period(sessionCode, segment, round, period), "period " + period);
    }

    @GetMapping("/sessions/{sessionCode}/segments/{segment}/rounds/{round}/periods/{period}/players/{label}")
    public Mono<ResponseEntity<ObservationDTO>> player(@PathVariable String sessionCode,
                                                       @PathVariable String segment,
                                                       @PathVariable int round,
                                                       @PathVariable int period,
                                                       @PathVariable String label) {
        return respond(queryService.player(sessionCode, segment, round, period, label), "player " + label);
    }

    @GetMapping("/sessions/{sessionCode}/segments/{segment}/players/{label}/group")
    public Mono<ResponseEntity<GroupDTO>> groupByPlayer(@PathVariable String sessionCode,
                                                        @PathVariable String segment,
                                                        @PathVariable String label) {
        return respond(queryService.groupByPlayer(sessionCode, segment, label), "group of " + label);
    }

    @GetMapping("/sessions/{sessionCode}/segments/{segment}/groups/{groupId}/rounds/{round}/chat")
    public Mono<ResponseEntity<List<ChatMessageDTO>>> groupChat(@PathVariable String sessionCode,
                                                                @PathVariable String segment,
                                                                @PathVariable int groupId,
                                                                @PathVariable int round) {
        return respond(queryService.groupChat(sessionCode, segment, groupId, round), "chat of group " + groupId);
    }

    // ── Flatten / export ────────────────────────────────────────────────────

    @GetMapping("/flatten")
    public Mono<ResponseEntity<FlatTableDTO>> flatten(@RequestParam(defaultValue = "period") String level) {
        log.info("[ExperimentAPI] Flatten requested. level={}", level);
        return respond(queryService.flattenTable(level), "flatten " + level);
    }

    @GetMapping(value = "/flatten.csv", produces = "text/csv")
    public Mono<ResponseEntity<String>> flattenCsv(@RequestParam(defaultValue = "period") String level) {
        log.info("[ExperimentAPI] CSV flatten requested. level={}", level);
        return queryService.flattenCsv(level)
            .map(csv -> ResponseEntity.ok().contentType(MediaType.parseMediaType("text/csv")).body(csv))
            .onErrorResume(e -> Mono.just(this.<String>failure(e, "flatten.csv " + level)));
    }

    @PostMapping("/export")
    public Mono<ResponseEntity<ExportResultDTO>> export(@RequestParam(defaultValue = "period") String level) {
        log.info("[ExperimentAPI] Export requested. level={}", level);
        return respond(queryService.export(level), "export " + level);
    }

    // ── Error mapping ───────────────────────────────────────────────────────

    private <T> Mono<ResponseEntity<T>> respond(Mono<T> body, String what) {
        return body
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .onErrorResume(e -> Mono.just(this.<T>failure(e, what)));
    }

    private <T> ResponseEntity<T> failure(Throwable e, String what) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError() && status != HttpStatus.SERVICE_UNAVAILABLE) {
            log.error("[ExperimentAPI] Request failed. request={}", what, e);
        } else {
            log.warn("[ExperimentAPI] Request rejected. request={} status={} reason={}", what, status.value(), e.getMessage());
        }
        return ResponseEntity.status(status).build();
    }

    static HttpStatus statusFor(Throwable e) {
        if (e instanceof ExperimentNotLoadedException) return HttpStatus.SERVICE_UNAVAILABLE;
        if (e instanceof MissingInputException)        return HttpStatus.NOT_FOUND;
        if (e instanceof SchemaMismatchException)      return HttpStatus.UNPROCESSABLE_ENTITY;
        if (e instanceof IllegalArgumentException)     return HttpStatus.BAD_REQUEST;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
