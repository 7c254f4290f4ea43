package com.marketruns.dataset.service;

import com.marketruns.common.flatten.FlatTable;
import com.marketruns.common.flatten.FlatTableCsvWriter;
import com.marketruns.common.flatten.FlattenLevel;
import com.marketruns.common.model.Experiment;
import com.marketruns.common.model.Group;
import com.marketruns.common.model.Session;
import com.marketruns.dataset.config.DatasetProperties;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Read-only views over the current experiment. Lookups that miss complete empty; a query
 * before the first build errors with {@link ExperimentNotLoadedException}.
 */
@Service
public class ExperimentQueryService {

    private static final Logger log = LoggerFactory.getLogger(ExperimentQueryService.class);

    private final ExperimentLoaderService loader;
    private final FlatTableCsvWriter csvWriter;
    private final DatasetProperties properties;

    public ExperimentQueryService(ExperimentLoaderService loader, FlatTableCsvWriter csvWriter,
                                  DatasetProperties properties) {
        this.loader     = loader;
        this.csvWriter  = csvWriter;
        this.properties = properties;
    }

    private Mono<Experiment> experiment() {
        return loader.requireCurrent().map(loaded -> loaded.result().experiment());
    }

    public Mono<BuildSummaryDTO> summary() {
        return loader.requireCurrent()
            .map(loaded -> BuildSummaryDTO.from(loaded.result(), loaded.loadedAt()));
    }

    public Mono<BuildSummaryDTO> reload() {
        return loader.reload()
            .map(loaded -> BuildSummaryDTO.from(loaded.result(), loaded.loadedAt()));
    }

    // ── Navigation ──────────────────────────────────────────────────────────

    public Mono<List<SessionDTO>> sessions() {
        return experiment().map(e -> e.sessions().stream().map(SessionDTO::from).toList());
    }

    public Mono<SessionDTO> session(String sessionCode) {
        return experiment().mapNotNull(e -> e.session(sessionCode)).map(SessionDTO::from);
    }

    public Mono<SegmentDTO> segment(String sessionCode, String segment) {
        return experiment().mapNotNull(e -> e.segment(sessionCode, segment)).map(SegmentDTO::from);
    }

    public Mono<RoundDTO> round(String sessionCode, String segment, int round) {
        return experiment().mapNotNull(e -> e.round(sessionCode, segment, round)).map(RoundDTO::from);
    }

    public Mono<PeriodDTO> period(String sessionCode, String segment, int round, int period) {
        return experiment().mapNotNull(e -> e.period(sessionCode, segment, round, period)).map(PeriodDTO::from);
    }

    public Mono<ObservationDTO> player(String sessionCode, String segment, int round, int period, String label) {
        return experiment().mapNotNull(e -> e.player(sessionCode, segment, round, period, label))
            .map(ObservationDTO::from);
    }

    public Mono<GroupDTO> groupByPlayer(String sessionCode, String segment, String label) {
        return experiment().mapNotNull(e -> e.groupByPlayer(sessionCode, segment, label)).map(GroupDTO::from);
    }

    /** One group's chat room for a round; empty when the session, segment or group is unknown. */
    public Mono<List<ChatMessageDTO>> groupChat(String sessionCode, String segment, int groupId, int round) {
        return experiment().mapNotNull(e -> {
            Session session = e.session(sessionCode);
            if (session == null || session.segment(segment) == null) {
                return null;
            }
            Group group = session.segment(segment).group(groupId);
            if (group == null) {
                return null;
            }
            return group.chatForRound(session, round).stream().map(ChatMessageDTO::from).toList();
        });
    }

    // ── Flatten / export ────────────────────────────────────────────────────

    private Mono<FlatTable> flatten(String level) {
        return Mono.fromCallable(() -> FlattenLevel.fromString(level))
            .flatMap(l -> experiment().map(e -> e.flatten(l)));
    }

    public Mono<FlatTableDTO> flattenTable(String level) {
        return flatten(level).map(FlatTableDTO::from);
    }

    public Mono<String> flattenCsv(String level) {
        return flatten(level).map(csvWriter::toCsv);
    }

    /** Writes the projection to {@code dataset.export-dir}, one file per level. */
    public Mono<ExportResultDTO> export(String level) {
        return flatten(level)
            .publishOn(Schedulers.boundedElastic())
            .map(table -> {
                String name = table.level().name().toLowerCase(Locale.ROOT);
                Path target = Path.of(properties.getExportDir()).resolve("experiment_" + name + ".csv");
                try {
                    csvWriter.write(table, target);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                log.info("[DatasetQuery] Export written. level={} path={} rows={}", name, target, table.rowCount());
                return new ExportResultDTO(name, target.toString(), table.rowCount());
            });
    }
}
