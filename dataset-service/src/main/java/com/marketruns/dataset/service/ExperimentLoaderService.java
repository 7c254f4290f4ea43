package com.marketruns.dataset.service;

import com.marketruns.common.builder.BuildResult;
import com.marketruns.common.builder.ExperimentBuilder;
import com.marketruns.common.exception.MissingInputException;
import com.marketruns.dataset.config.DatasetProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the latest build. Builds run on the bounded-elastic scheduler since they read files
 * and are CPU-bound; the previous result keeps serving until a new build succeeds.
 */
@Service
public class ExperimentLoaderService {

    private static final Logger log = LoggerFactory.getLogger(ExperimentLoaderService.class);

    /** A build result plus when it was produced. */
    public record LoadedExperiment(BuildResult result, Instant loadedAt) {}

    private final ExperimentBuilder builder;
    private final DatasetProperties properties;
    private final AtomicReference<LoadedExperiment> current = new AtomicReference<>();

    public ExperimentLoaderService(ExperimentBuilder builder, DatasetProperties properties) {
        this.builder    = builder;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (!properties.isLoadOnStartup()) {
            log.info("[DatasetLoader] Startup load disabled. Waiting for an explicit reload.");
            return;
        }
        if (properties.widePath() == null) {
            log.warn("[DatasetLoader] dataset.data-path is not set; nothing loaded at startup.");
            return;
        }
        reload().subscribe(
            loaded -> log.info("[DatasetLoader] Startup load finished. status={}", loaded.result().status()),
            e -> log.error("[DatasetLoader] Startup load failed. dataPath={}", properties.getDataPath(), e));
    }

    /** Rebuilds from the configured files and replaces the current result on success. */
    public Mono<LoadedExperiment> reload() {
        return Mono.fromCallable(this::buildNow)
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(current::set);
    }

    private LoadedExperiment buildNow() {
        Path wide = properties.widePath();
        if (wide == null) {
            throw new MissingInputException("dataset.data-path", "no wide export configured");
        }
        Path chat = properties.chatLogPath();
        log.info("[DatasetLoader] Building experiment. dataPath={} chatPath={}", wide, chat);
        BuildResult result = builder.build(wide, chat);
        return new LoadedExperiment(result, Instant.now());
    }

    public Optional<LoadedExperiment> current() {
        return Optional.ofNullable(current.get());
    }

    /** Emits the current build, or errors with {@link ExperimentNotLoadedException}. */
    public Mono<LoadedExperiment> requireCurrent() {
        return Mono.justOrEmpty(current.get())
            .switchIfEmpty(Mono.error(ExperimentNotLoadedException::new));
    }
}
