package com.gdin.affinity.index.cluster;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Louvain 某一层上的一个聚类：(level, clusterId, parentClusterId, [nodeTitles])
 */
@Value
@Builder
public class LouvainCluster {

    /**
     * 层级，从 0 开始，越大越高层；最高层即最终划分。
     */
    @JsonProperty("level")
    int level;

    /**
     * 层内唯一，按成员中最小的兴趣池下标排序后从 0 连续编号。
     */
    @JsonProperty("cluster_id")
    int clusterId;

    /**
     * 上一层（level + 1）中包含本聚类的聚类编号，最高层为 -1。
     */
    @JsonProperty("parent_id")
    int parentClusterId;

    /**
     * 展开到原始图后的兴趣标签，保持兴趣池顺序。
     */
    @JsonProperty("titles")
    List<String> nodeTitles;
}
