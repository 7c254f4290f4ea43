package com.marketruns.dataset.service;

import com.marketruns.common.builder.BuildStatus;
import com.marketruns.common.exception.MissingInputException;
import com.marketruns.dataset.TestFixtures;
import com.marketruns.dataset.config.DatasetProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentLoaderServiceTest {

    @TempDir
    Path exportDir;

    private ExperimentLoaderService loader(DatasetProperties properties) {
        return new ExperimentLoaderService(TestFixtures.builderFor(properties), properties);
    }

    @Test
    @DisplayName("reload builds the configured files and keeps the result")
    void reload() {
        ExperimentLoaderService loader = loader(TestFixtures.marketProperties(exportDir));

        StepVerifier.create(loader.reload())
            .assertNext(loaded -> {
                assertEquals(BuildStatus.COMPLETE, loaded.result().status());
                assertNotNull(loaded.loadedAt());
            })
            .verifyComplete();
        assertTrue(loader.current().isPresent());
    }

    @Test
    @DisplayName("queries before the first build error with ExperimentNotLoadedException")
    void notLoaded() {
        ExperimentLoaderService loader = loader(TestFixtures.marketProperties(exportDir));

        StepVerifier.create(loader.requireCurrent())
            .expectError(ExperimentNotLoadedException.class)
            .verify();
    }

    @Test
    @DisplayName("no configured data path → MissingInputException")
    void noDataPath() {
        DatasetProperties properties = TestFixtures.marketProperties(exportDir);
        properties.setDataPath("  ");

        StepVerifier.create(loader(properties).reload())
            .expectError(MissingInputException.class)
            .verify();
    }

    @Test
    @DisplayName("a failed reload keeps serving the previous build")
    void failedReloadKeepsPrevious() {
        DatasetProperties properties = TestFixtures.marketProperties(exportDir);
        ExperimentLoaderService loader = loader(properties);
        loader.reload().block();
        ExperimentLoaderService.LoadedExperiment before = loader.current().orElseThrow();

        properties.setChatPath(exportDir.resolve("missing_chat.csv").toString());
        StepVerifier.create(loader.reload())
            .expectError(MissingInputException.class)
            .verify();

        assertSame(before, loader.current().orElseThrow());
    }

    @Test
    @DisplayName("startup load is skipped when disabled")
    void startupDisabled() {
        ExperimentLoaderService loader = loader(TestFixtures.marketProperties(exportDir));

        loader.loadOnStartup();

        assertTrue(loader.current().isEmpty());
    }
}
