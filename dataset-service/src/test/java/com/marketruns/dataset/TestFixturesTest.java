package com.marketruns.dataset;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/** The service fixtures are copies of the library's; they must not drift apart. */
class TestFixturesTest {

    private static final Path LIBRARY_FIXTURES = Path.of("..", "common-lib", "src", "test", "resources", "fixtures");

    @ParameterizedTest(name = "{0} matches the common-lib copy")
    @ValueSource(strings = {"two_player.csv", "market_wide.csv", "market_chat.csv"})
    void sameAsLibraryCopy(String name) throws IOException {
        Path original = LIBRARY_FIXTURES.resolve(name);
        assumeTrue(Files.exists(original), "common-lib sources not next to this module");

        assertArrayEquals(Files.readAllBytes(original), Files.readAllBytes(TestFixtures.path(name)));
    }
}
