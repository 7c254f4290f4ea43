package com.marketruns.common.table;

import com.marketruns.common.exception.SchemaMismatchException;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Column lookup for a wide per-participant export, resolved once before any row is read.
 *
 * <p>Headers of the form {@code {segment}.{period}.player.{field}} and
 * {@code {segment}.{period}.group.{field}} are indexed by {@link ColumnKey}. A segment
 * exists when at least one player column carries its name and its name fully matches the
 * configured segment pattern. Segments come back in sorted-name order, periods in ascending
 * numeric order.
 *
 * <p>Resolution fails with {@link SchemaMismatchException} when a participant-level column
 * the build needs is missing, or when a segment period has player columns but no
 * {@code id_in_group}.
 */
public final class WideSchema {

    public static final String SESSION_CODE       = "session.code";
    public static final String PARTICIPANT_LABEL  = "participant.label";
    public static final String PARTICIPANT_ID     = "participant.id_in_session";

    public static final String SESSION_PARTICIPATION_FEE = "session.config.participation_fee";
    public static final String SESSION_CURRENCY_PER_POINT = "session.config.real_world_currency_per_point";
    public static final String SESSION_ROOM      = "session.config.room";
    public static final String SESSION_IS_DEMO   = "session.is_demo";

    public static final String ID_IN_GROUP             = "id_in_group";
    public static final String ROUND_NUMBER_IN_SEGMENT = "round_number_in_segment";
    public static final String PERIOD_IN_ROUND         = "period_in_round";
    public static final String SOLD                    = "sold";
    public static final String SELL_CLICK_TIME         = "sell_click_time";
    public static final String SIGNAL                  = "signal";
    public static final String PRICE                   = "price";
    public static final String STATE                   = "state";
    public static final String PAYOFF                  = "payoff";
    public static final String GROUP_ID_IN_SUBSESSION  = "id_in_subsession";

    private static final Pattern WIDE_COLUMN = Pattern.compile("^([^.]+)\\.(\\d+)\\.(player|group)\\.(.+)$");

    private final DataTable table;
    private final Map<ColumnKey, Integer> columns;
    private final Map<String, List<Integer>> periodsBySegment;

    private WideSchema(DataTable table, Map<ColumnKey, Integer> columns,
                       Map<String, List<Integer>> periodsBySegment) {
        this.table            = table;
        this.columns          = Collections.unmodifiableMap(columns);
        this.periodsBySegment = Collections.unmodifiableMap(periodsBySegment);
    }

    /** Field name of the per-round payoff slot for {@code roundNumber}. */
    public static String roundPayoffField(int roundNumber) {
        return "round_" + roundNumber + "_payoff";
    }

    /**
     * Indexes the table's headers.
     *
     * @param segmentPattern a segment name must match this pattern in full to be built
     * @throws SchemaMismatchException on a missing required column or an unreadable period number
     */
    public static WideSchema resolve(DataTable table, Pattern segmentPattern) {
        requireColumn(table, SESSION_CODE);
        requireColumn(table, PARTICIPANT_LABEL);
        requireColumn(table, PARTICIPANT_ID);

        Map<ColumnKey, Integer> columns = new HashMap<>();
        Map<String, TreeSet<Integer>> periods = new TreeMap<>();
        List<String> headers = table.headers();
        for (int i = 0; i < headers.size(); i++) {
            Matcher m = WIDE_COLUMN.matcher(headers.get(i));
            if (!m.matches()) continue;

            String segment = m.group(1);
            if (!segmentPattern.matcher(segment).matches()) continue;

            int period;
            try {
                period = Integer.parseInt(m.group(2));
            } catch (NumberFormatException e) {
                throw new SchemaMismatchException("source=" + table.source(),
                    "period number out of range in column " + headers.get(i), e);
            }
            ColumnKey.Scope scope = ColumnKey.Scope.fromPrefix(m.group(3));
            columns.putIfAbsent(new ColumnKey(segment, period, scope, m.group(4)), i);
            if (scope == ColumnKey.Scope.PLAYER) {
                periods.computeIfAbsent(segment, k -> new TreeSet<>()).add(period);
            }
        }

        Map<String, List<Integer>> periodsBySegment = new TreeMap<>();
        for (Map.Entry<String, TreeSet<Integer>> e : periods.entrySet()) {
            for (int period : e.getValue()) {
                ColumnKey idKey = ColumnKey.player(e.getKey(), period, ID_IN_GROUP);
                if (!columns.containsKey(idKey)) {
                    throw new SchemaMismatchException("source=" + table.source(),
                        "player columns present without " + idKey.header());
                }
            }
            periodsBySegment.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return new WideSchema(table, columns, periodsBySegment);
    }

    private static void requireColumn(DataTable table, String header) {
        if (!table.hasColumn(header)) {
            throw new SchemaMismatchException("source=" + table.source(),
                "required column missing: " + header);
        }
    }

    public DataTable table() {
        return table;
    }

    /** Detected segment names, sorted. */
    public List<String> segmentNames() {
        return List.copyOf(periodsBySegment.keySet());
    }

    /** Column period indices of the segment, ascending; empty for an unknown segment. */
    public List<Integer> periods(String segment) {
        return periodsBySegment.getOrDefault(segment, List.of());
    }

    /** Column index for the key, or {@link DataTable#ABSENT}. */
    public int column(ColumnKey key) {
        Integer i = columns.get(key);
        return i != null ? i : DataTable.ABSENT;
    }

    public int playerColumn(String segment, int period, String field) {
        return column(ColumnKey.player(segment, period, field));
    }

    public int groupColumn(String segment, int period, String field) {
        return column(ColumnKey.group(segment, period, field));
    }

    public int sessionCodeColumn() {
        return table.columnIndex(SESSION_CODE);
    }

    public int labelColumn() {
        return table.columnIndex(PARTICIPANT_LABEL);
    }

    public int participantIdColumn() {
        return table.columnIndex(PARTICIPANT_ID);
    }
}
