package io.swarmmesh.config;

import io.swarmmesh.error.InvalidConfigException;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Engine tunables consumed when a coordinator is constructed.
 *
 * <p>Read from {@code swarmmesh-settings.json} under the engine root. Every field is optional in the
 * file; missing or out-of-range values fall back to {@link #defaults()}.
 */
public record EngineSettings(
        TopologyKind defaultTopology,
        int maxAgents,
        ConsensusAlgorithm consensusAlgorithm,
        long stateSyncIntervalMs,
        boolean bottleneckDetectionEnabled,
        boolean selfHealingEnabled,
        boolean predictiveHealingEnabled,
        boolean metricsEnabled,
        boolean healthChecksEnabled,
        int latencyWindowSize,
        int minLatencySamples,
        double degradedLatencyMultiplier,
        int missedProbeThreshold,
        int maxRestartAttempts,
        int predictiveDegradedWindows,
        double bottleneckThroughputRatio,
        int bottleneckIntervals,
        int throughputBaselineWindow,
        int hierarchicalBranchingFactor,
        int adaptiveMeshMaxAgents,
        int adaptiveStarMaxAgents,
        long probeTimeoutMs,
        double quorumThreshold,
        int gossipFanout,
        int gossipMaxRounds,
        long gossipRoundDelayMs,
        double gossipConvergenceThreshold,
        int metricsRetentionDays,
        int recentMetricsLimit
) {
    public static EngineSettings defaults() {
        return new EngineSettings(
                TopologyKind.MESH,
                64,
                ConsensusAlgorithm.QUORUM,
                1_000L,
                true,
                true,
                true,
                true,
                true,
                20,
                5,
                2.0d,
                3,
                3,
                5,
                0.7d,
                3,
                10,
                4,
                5,
                20,
                1_000L,
                0.5d,
                3,
                10,
                50L,
                0.9d,
                7,
                50
        );
    }

    public static EngineSettings load(Path settingsFile) {
        EngineSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            EngineSettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), EngineSettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new InvalidConfigException("Failed to load engine settings: " + settingsFile, e);
        }
    }

    static EngineSettings fromFile(EngineSettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        TopologyKind topology = file.defaultTopology() == null
                ? defaults.defaultTopology()
                : parseTopology(file.defaultTopology());
        ConsensusAlgorithm algorithm = file.consensusAlgorithm() == null
                ? defaults.consensusAlgorithm()
                : parseAlgorithm(file.consensusAlgorithm());
        int maxAgents = sanitizeInt(file.maxAgents(), defaults.maxAgents(), 1);
        long syncInterval = sanitizeLong(file.stateSyncIntervalMs(), defaults.stateSyncIntervalMs(), 10L);
        int latencyWindow = sanitizeInt(file.latencyWindowSize(), defaults.latencyWindowSize(), 2);
        int minSamples = sanitizeInt(file.minLatencySamples(), defaults.minLatencySamples(), 1);
        if (minSamples > latencyWindow) {
            minSamples = latencyWindow;
        }
        int meshMax = sanitizeInt(file.adaptiveMeshMaxAgents(), defaults.adaptiveMeshMaxAgents(), 1);
        int starMax = sanitizeInt(file.adaptiveStarMaxAgents(), defaults.adaptiveStarMaxAgents(), meshMax);
        if (starMax < meshMax) {
            starMax = meshMax;
        }
        return new EngineSettings(
                topology,
                maxAgents,
                algorithm,
                syncInterval,
                sanitizeBoolean(file.bottleneckDetectionEnabled(), defaults.bottleneckDetectionEnabled()),
                sanitizeBoolean(file.selfHealingEnabled(), defaults.selfHealingEnabled()),
                sanitizeBoolean(file.predictiveHealingEnabled(), defaults.predictiveHealingEnabled()),
                sanitizeBoolean(file.metricsEnabled(), defaults.metricsEnabled()),
                sanitizeBoolean(file.healthChecksEnabled(), defaults.healthChecksEnabled()),
                latencyWindow,
                minSamples,
                sanitizeDouble(file.degradedLatencyMultiplier(), defaults.degradedLatencyMultiplier(), 1.0d, 100.0d),
                sanitizeInt(file.missedProbeThreshold(), defaults.missedProbeThreshold(), 1),
                sanitizeInt(file.maxRestartAttempts(), defaults.maxRestartAttempts(), 1),
                sanitizeInt(file.predictiveDegradedWindows(), defaults.predictiveDegradedWindows(), 1),
                sanitizeDouble(file.bottleneckThroughputRatio(), defaults.bottleneckThroughputRatio(), 0.01d, 1.0d),
                sanitizeInt(file.bottleneckIntervals(), defaults.bottleneckIntervals(), 1),
                sanitizeInt(file.throughputBaselineWindow(), defaults.throughputBaselineWindow(), 1),
                sanitizeInt(file.hierarchicalBranchingFactor(), defaults.hierarchicalBranchingFactor(), 1),
                meshMax,
                starMax,
                sanitizeLong(file.probeTimeoutMs(), defaults.probeTimeoutMs(), 10L),
                sanitizeDouble(file.quorumThreshold(), defaults.quorumThreshold(), 0.5d, 1.0d),
                sanitizeInt(file.gossipFanout(), defaults.gossipFanout(), 1),
                sanitizeInt(file.gossipMaxRounds(), defaults.gossipMaxRounds(), 1),
                sanitizeLong(file.gossipRoundDelayMs(), defaults.gossipRoundDelayMs(), 0L),
                sanitizeDouble(file.gossipConvergenceThreshold(), defaults.gossipConvergenceThreshold(), 0.51d, 1.0d),
                sanitizeInt(file.metricsRetentionDays(), defaults.metricsRetentionDays(), 1),
                sanitizeInt(file.recentMetricsLimit(), defaults.recentMetricsLimit(), 1)
        );
    }

    private static TopologyKind parseTopology(String raw) {
        try {
            return TopologyKind.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("defaultTopology: " + e.getMessage(), e);
        }
    }

    private static ConsensusAlgorithm parseAlgorithm(String raw) {
        try {
            return ConsensusAlgorithm.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("consensusAlgorithm: " + e.getMessage(), e);
        }
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static double sanitizeDouble(Double value, double fallback, double min, double max) {
        if (value == null || value.isNaN() || value < min || value > max) {
            return fallback;
        }
        return value;
    }

    private static boolean sanitizeBoolean(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    public record EngineSettingsFile(
            String defaultTopology,
            Integer maxAgents,
            String consensusAlgorithm,
            Long stateSyncIntervalMs,
            Boolean bottleneckDetectionEnabled,
            Boolean selfHealingEnabled,
            Boolean predictiveHealingEnabled,
            Boolean metricsEnabled,
            Boolean healthChecksEnabled,
            Integer latencyWindowSize,
            Integer minLatencySamples,
            Double degradedLatencyMultiplier,
            Integer missedProbeThreshold,
            Integer maxRestartAttempts,
            Integer predictiveDegradedWindows,
            Double bottleneckThroughputRatio,
            Integer bottleneckIntervals,
            Integer throughputBaselineWindow,
            Integer hierarchicalBranchingFactor,
            Integer adaptiveMeshMaxAgents,
            Integer adaptiveStarMaxAgents,
            Long probeTimeoutMs,
            Double quorumThreshold,
            Integer gossipFanout,
            Integer gossipMaxRounds,
            Long gossipRoundDelayMs,
            Double gossipConvergenceThreshold,
            Integer metricsRetentionDays,
            Integer recentMetricsLimit
    ) {
    }
}
