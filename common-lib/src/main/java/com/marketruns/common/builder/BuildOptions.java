package com.marketruns.common.builder;

import java.util.regex.Pattern;

/**
 * Settings for one {@link ExperimentBuilder}.
 *
 * @param experimentName       name given to the built experiment
 * @param segmentPattern       a segment name must match this in full to be built
 * @param channelsPerRound     chat rooms opened per round (one per group)
 * @param chatChannelPattern   channel format; group 1 is the segment name, group 2 the channel number
 * @param fallbackWarningRatio share of observations using the default round/period above which
 *                             the build summary escalates from WARN to ERROR
 */
public record BuildOptions(
    String  experimentName,
    Pattern segmentPattern,
    int     channelsPerRound,
    Pattern chatChannelPattern,
    double  fallbackWarningRatio
) {

    public static final String DEFAULT_EXPERIMENT_NAME    = "Market Runs Experiment";
    public static final String DEFAULT_SEGMENT_PATTERN    = "[^.]+";
    public static final int    DEFAULT_CHANNELS_PER_ROUND = 4;
    public static final String DEFAULT_CHANNEL_PATTERN    = "^[^-]+-(.+)-(\\d+)$";
    public static final double DEFAULT_FALLBACK_RATIO     = 0.05;

    public BuildOptions {
        if (experimentName == null || experimentName.isBlank()) {
            throw new IllegalArgumentException("experimentName must not be blank");
        }
        if (segmentPattern == null || chatChannelPattern == null) {
            throw new IllegalArgumentException("segment and channel patterns are required");
        }
        if (channelsPerRound < 1) {
            throw new IllegalArgumentException("channelsPerRound must be >= 1, got " + channelsPerRound);
        }
        if (fallbackWarningRatio < 0.0 || fallbackWarningRatio > 1.0) {
            throw new IllegalArgumentException("fallbackWarningRatio must be within [0, 1], got " + fallbackWarningRatio);
        }
    }

    public static BuildOptions defaults() {
        return new BuildOptions(
            DEFAULT_EXPERIMENT_NAME,
            Pattern.compile(DEFAULT_SEGMENT_PATTERN),
            DEFAULT_CHANNELS_PER_ROUND,
            Pattern.compile(DEFAULT_CHANNEL_PATTERN),
            DEFAULT_FALLBACK_RATIO);
    }

    public BuildOptions withExperimentName(String name) {
        return new BuildOptions(name, segmentPattern, channelsPerRound, chatChannelPattern, fallbackWarningRatio);
    }

    public BuildOptions withSegmentPattern(String regex) {
        return new BuildOptions(experimentName, Pattern.compile(regex), channelsPerRound, chatChannelPattern, fallbackWarningRatio);
    }

    public BuildOptions withChannelsPerRound(int channels) {
        return new BuildOptions(experimentName, segmentPattern, channels, chatChannelPattern, fallbackWarningRatio);
    }

    public BuildOptions withChatChannelPattern(String regex) {
        return new BuildOptions(experimentName, segmentPattern, channelsPerRound, Pattern.compile(regex), fallbackWarningRatio);
    }

    public BuildOptions withFallbackWarningRatio(double ratio) {
        return new BuildOptions(experimentName, segmentPattern, channelsPerRound, chatChannelPattern, ratio);
    }
}
