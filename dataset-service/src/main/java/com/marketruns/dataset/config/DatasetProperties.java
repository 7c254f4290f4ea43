package com.marketruns.dataset.config;

import com.marketruns.common.builder.BuildOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/** Binds {@code dataset.*}: which exports to load and how to build them. */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "dataset")
public class DatasetProperties {

    private String dataPath;
    private String chatPath;
    private String exportDir = "exports";
    private String experimentName = BuildOptions.DEFAULT_EXPERIMENT_NAME;
    private String segmentPattern = BuildOptions.DEFAULT_SEGMENT_PATTERN;
    private int channelsPerRound = BuildOptions.DEFAULT_CHANNELS_PER_ROUND;
    private double fallbackWarningRatio = BuildOptions.DEFAULT_FALLBACK_RATIO;
    private boolean loadOnStartup = true;

    /** Wide export path, or {@code null} when not configured. */
    public Path widePath() {
        return isBlank(dataPath) ? null : Path.of(dataPath);
    }

    /** Chat log path, or {@code null} to build without chat. */
    public Path chatLogPath() {
        return isBlank(chatPath) ? null : Path.of(chatPath);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
