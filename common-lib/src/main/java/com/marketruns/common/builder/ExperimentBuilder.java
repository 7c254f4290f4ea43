package com.marketruns.common.builder;

import com.marketruns.common.exception.StructuralIntegrityException;
import com.marketruns.common.model.Experiment;
import com.marketruns.common.model.Session;
import com.marketruns.common.table.CsvTableReader;
import com.marketruns.common.table.DataTable;
import com.marketruns.common.table.WideSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point: turns a wide participant export, plus an optional chat log, into an
 * {@link Experiment}.
 *
 * <p>Input-level problems (missing file, missing required column) fail the whole build.
 * Each session is then built independently; a session with inconsistent data is recorded
 * as a {@link SessionFailure} and the other sessions are still built. Recoverable findings
 * are counted in the {@link BuildReport} and logged once as a summary.
 *
 * <p>A builder holds no state between calls and may be shared across threads.
 */
public final class ExperimentBuilder {

    private static final Logger log = LoggerFactory.getLogger(ExperimentBuilder.class);

    private final BuildOptions options;
    private final CsvTableReader reader = new CsvTableReader();

    public ExperimentBuilder() {
        this(BuildOptions.defaults());
    }

    public ExperimentBuilder(BuildOptions options) {
        this.options = options;
    }

    public BuildOptions options() {
        return options;
    }

    /**
     * @param chatPath chat log, or {@code null} to build without chat
     * @throws com.marketruns.common.exception.MissingInputException if a given file cannot be read
     * @throws com.marketruns.common.exception.SchemaMismatchException if a required column is missing
     */
    public BuildResult build(Path widePath, Path chatPath) {
        DataTable wide = reader.read(widePath);
        DataTable chat = chatPath != null ? reader.read(chatPath) : null;
        return build(wide, chat);
    }

    public BuildResult build(DataTable wide) {
        return build(wide, null);
    }

    /**
     * @param chat chat table, or {@code null} to build without chat
     * @throws com.marketruns.common.exception.SchemaMismatchException if a required column is missing
     */
    public BuildResult build(DataTable wide, DataTable chat) {
        long start = System.currentTimeMillis();
        WideSchema schema = WideSchema.resolve(wide, options.segmentPattern());
        ChatAligner chatAligner = chat != null ? new ChatAligner(chat, options) : null;
        log.info("[ExperimentBuilder] Schema resolved. source={} segments={} chat={}",
                 wide.source(), schema.segmentNames(), chat != null ? chat.source() : "none");

        WarningTally total = new WarningTally();
        if (chatAligner != null) {
            total.unparseableChatRows(chatAligner.unparseableRows());
        }

        Map<String, List<Integer>> rowsBySession = new LinkedHashMap<>();
        for (int row = 0; row < wide.rowCount(); row++) {
            String sessionCode = wide.cell(row, schema.sessionCodeColumn());
            if (sessionCode == null) {
                total.rowWithoutSession();
                continue;
            }
            rowsBySession.computeIfAbsent(sessionCode, k -> new ArrayList<>()).add(row);
        }

        SessionAssembler assembler = new SessionAssembler(schema, chatAligner);
        List<Session> sessions = new ArrayList<>();
        List<SessionFailure> failures = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> e : rowsBySession.entrySet()) {
            WarningTally tally = new WarningTally();
            try {
                Session session = assembler.assemble(e.getKey(), e.getValue(), tally);
                if (session != null) {
                    sessions.add(session);
                }
                total.merge(tally);
            } catch (StructuralIntegrityException ex) {
                log.error("[ExperimentBuilder] Session build failed. session={} error={}", e.getKey(), ex.getMessage());
                failures.add(new SessionFailure(e.getKey(), ex));
                total.mergeFailed(tally);
            }
        }
        if (chatAligner != null) {
            Set<String> built = new HashSet<>();
            sessions.forEach(s -> built.add(s.sessionCode()));
            total.unmatchedChatRows(chatAligner.unmatchedRows(built));
        }

        BuildResult result = new BuildResult(new Experiment(options.experimentName(), sessions),
                                             total.toReport(), failures);
        logSummary(result, System.currentTimeMillis() - start);
        return result;
    }

    private void logSummary(BuildResult result, long elapsedMs) {
        BuildReport report = result.report();
        if (report.fallbackRatio() > options.fallbackWarningRatio()) {
            log.error("[ExperimentBuilder] Round/period defaults used broadly; round structure is unreliable. "
                      + "ratio={} threshold={} {}", report.fallbackRatio(), options.fallbackWarningRatio(), report.summary());
        } else if (report.hasWarnings()) {
            log.warn("[ExperimentBuilder] Build finished with data warnings. {}", report.summary());
        }
        log.info("[ExperimentBuilder] Build complete. status={} sessions={} failures={} participants={} elapsedMs={}",
                 result.status(), result.experiment().sessionCount(), result.failures().size(),
                 result.experiment().totalParticipants(), elapsedMs);
    }
}
