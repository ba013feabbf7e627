package com.gdin.affinity.config;

import com.gdin.affinity.config.properties.AffinityProperties;
import com.gdin.affinity.exception.InvalidClusterConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 单次运行使用的不可变配置，作为流水线的 config 对象传给每个 workflow。
 */
@Value
@Builder(toBuilder = true)
public class ClusterSettings {

    public static final double DEFAULT_RESOLUTION = 1.0;
    public static final int DEFAULT_TOP_N = 5;
    public static final int DEFAULT_MAX_LEVELS = 32;
    public static final int DEFAULT_MAX_PASSES = 100;
    public static final String DEFAULT_IDENTIFIER_DELIMITER = ", ";

    @Builder.Default
    double resolution = DEFAULT_RESOLUTION;

    @Builder.Default
    int topN = DEFAULT_TOP_N;

    Integer seed;

    @Builder.Default
    int maxLevels = DEFAULT_MAX_LEVELS;

    @Builder.Default
    int maxPasses = DEFAULT_MAX_PASSES;

    @Builder.Default
    String identifierDelimiter = DEFAULT_IDENTIFIER_DELIMITER;

    @Builder.Default
    Set<String> excludedInterests = Set.of();

    public static ClusterSettings defaults() {
        return ClusterSettings.builder().build();
    }

    public static ClusterSettings from(AffinityProperties properties) {
        AffinityProperties.Cluster cluster = properties.getCluster();
        AffinityProperties.Summary summary = properties.getSummary();
        List<String> excluded = properties.getExcludedInterests();

        return ClusterSettings.builder()
                .resolution(cluster.getResolution() == null ? DEFAULT_RESOLUTION : cluster.getResolution())
                .seed(cluster.getSeed())
                .maxLevels(cluster.getMaxLevels() == null ? DEFAULT_MAX_LEVELS : cluster.getMaxLevels())
                .maxPasses(cluster.getMaxPasses() == null ? DEFAULT_MAX_PASSES : cluster.getMaxPasses())
                .topN(summary.getTopN() == null ? DEFAULT_TOP_N : summary.getTopN())
                .identifierDelimiter(summary.getIdentifierDelimiter())
                .excludedInterests(excluded == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(excluded)))
                .build();
    }

    /**
     * 校验配置，失败直接抛 {@link InvalidClusterConfigurationException}，整个运行中止。
     */
    public ClusterSettings validate() {
        if (Double.isNaN(resolution) || Double.isInfinite(resolution) || resolution <= 0) {
            throw new InvalidClusterConfigurationException("resolution 必须是大于 0 的有限数，当前值: " + resolution);
        }
        if (topN < 0) {
            throw new InvalidClusterConfigurationException("topN 不能为负数，当前值: " + topN);
        }
        if (maxLevels < 1) {
            throw new InvalidClusterConfigurationException("maxLevels 至少为 1，当前值: " + maxLevels);
        }
        if (maxPasses < 1) {
            throw new InvalidClusterConfigurationException("maxPasses 至少为 1，当前值: " + maxPasses);
        }
        if (identifierDelimiter == null) {
            throw new InvalidClusterConfigurationException("identifierDelimiter 不能为空");
        }
        if (excludedInterests == null) {
            throw new InvalidClusterConfigurationException("excludedInterests 不能为 null");
        }
        return this;
    }
}
