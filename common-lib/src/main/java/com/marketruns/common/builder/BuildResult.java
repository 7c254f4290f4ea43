package com.marketruns.common.builder;

import com.marketruns.common.model.Experiment;

import java.util.List;

/**
 * What a build hands back: the experiment (possibly empty), the aggregated data-quality
 * report, and the sessions that failed.
 */
public record BuildResult(Experiment experiment, BuildReport report, List<SessionFailure> failures) {

    public BuildResult {
        failures = List.copyOf(failures);
    }

    public BuildStatus status() {
        if (!failures.isEmpty()) {
            return experiment.isEmpty() ? BuildStatus.FAILED : BuildStatus.PARTIAL;
        }
        return experiment.isEmpty() ? BuildStatus.EMPTY : BuildStatus.COMPLETE;
    }

    public boolean isEmpty() {
        return experiment.isEmpty();
    }
}
