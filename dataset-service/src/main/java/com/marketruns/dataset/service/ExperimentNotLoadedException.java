package com.marketruns.dataset.service;

/** Raised by queries issued before any build has completed. */
public class ExperimentNotLoadedException extends RuntimeException {

    public ExperimentNotLoadedException() {
        super("No experiment loaded yet. Configure dataset.data-path or POST /api/v1/experiment/reload");
    }
}
