package com.marketruns.common.flatten;

import com.marketruns.common.model.Experiment;
import com.marketruns.common.model.Group;
import com.marketruns.common.model.Period;
import com.marketruns.common.model.PlayerPeriodData;
import com.marketruns.common.model.Round;
import com.marketruns.common.model.Segment;
import com.marketruns.common.model.Session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Projects an {@link Experiment} into a {@link FlatTable}. Reads the model only; the same
 * experiment always yields an equal table.
 */
public final class ExperimentFlattener {

    public static final List<String> PERIOD_COLUMNS = List.of(
        "session_code", "segment", "round", "period", "label", "participant_id", "id_in_group",
        "sold", "sold_this_period", "signal", "price", "sell_click_time", "state", "payoff",
        "round_payoff", "group_id");

    public static final List<String> ROUND_COLUMNS = List.of(
        "session_code", "segment", "round", "label", "participant_id", "id_in_group",
        "final_sold_status", "round_payoff", "total_sellers_in_round", "n_periods", "group_id");

    private ExperimentFlattener() {}

    public static FlatTable flatten(Experiment experiment, FlattenLevel level) {
        return switch (level) {
            case PERIOD -> new FlatTable(level, PERIOD_COLUMNS, periodRows(experiment));
            case ROUND  -> new FlatTable(level, ROUND_COLUMNS, roundRows(experiment));
        };
    }

    private static List<Map<String, Object>> periodRows(Experiment experiment) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Session session : experiment.sessions()) {
            for (Segment segment : session.segments().values()) {
                for (Round round : segment.rounds().values()) {
                    for (Period period : round.periods().values()) {
                        for (PlayerPeriodData d : period.players().values()) {
                            Map<String, Object> row = new LinkedHashMap<>();
                            row.put("session_code", session.sessionCode());
                            row.put("segment", segment.name());
                            row.put("round", round.roundNumber());
                            row.put("period", period.periodInRound());
                            row.put("label", d.label());
                            row.put("participant_id", d.participantId());
                            row.put("id_in_group", d.idInGroup());
                            row.put("sold", d.soldCumulative());
                            row.put("sold_this_period", d.soldThisPeriod());
                            row.put("signal", d.signal());
                            row.put("price", d.price());
                            row.put("sell_click_time", d.sellTimestamp());
                            row.put("state", d.state());
                            row.put("payoff", d.payoff());
                            row.put("round_payoff", round.terminalPayoff(d.label()));
                            row.put("group_id", groupId(segment, d.label()));
                            rows.add(row);
                        }
                    }
                }
            }
        }
        return rows;
    }

    private static List<Map<String, Object>> roundRows(Experiment experiment) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Session session : experiment.sessions()) {
            for (Segment segment : session.segments().values()) {
                for (Round round : segment.rounds().values()) {
                    int totalSellers = round.totalSellers();
                    for (String label : labelsIn(round)) {
                        PlayerPeriodData last = round.lastObservation(label);
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("session_code", session.sessionCode());
                        row.put("segment", segment.name());
                        row.put("round", round.roundNumber());
                        row.put("label", label);
                        row.put("participant_id", last.participantId());
                        row.put("id_in_group", last.idInGroup());
                        row.put("final_sold_status", last.soldCumulative());
                        row.put("round_payoff", round.terminalPayoff(label));
                        row.put("total_sellers_in_round", totalSellers);
                        row.put("n_periods", round.periodCount());
                        row.put("group_id", groupId(segment, label));
                        rows.add(row);
                    }
                }
            }
        }
        return rows;
    }

    /** Labels observed anywhere in the round, in first-appearance order. */
    private static Set<String> labelsIn(Round round) {
        Set<String> labels = new LinkedHashSet<>();
        round.periods().values().forEach(p -> labels.addAll(p.players().keySet()));
        return labels;
    }

    private static Integer groupId(Segment segment, String label) {
        Group group = segment.groupByPlayer(label);
        return group != null ? group.groupId() : null;
    }
}
