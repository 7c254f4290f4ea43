package com.marketruns.common.testing;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/** Locates CSV fixtures under {@code src/test/resources/fixtures}. */
public final class Fixtures {

    public static final String TWO_PLAYER  = "two_player.csv";
    public static final String MARKET_WIDE = "market_wide.csv";
    public static final String MARKET_CHAT = "market_chat.csv";

    private Fixtures() {}

    public static Path path(String name) {
        URL url = Fixtures.class.getResource("/fixtures/" + name);
        if (url == null) {
            throw new IllegalStateException("fixture not on classpath: " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
