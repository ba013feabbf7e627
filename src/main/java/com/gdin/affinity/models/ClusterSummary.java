package com.gdin.affinity.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.SortedMap;

@Value
@Builder
public class ClusterSummary {

    // 按 (group, cluster) 升序
    @JsonProperty("group_clusters")
    List<GroupClusterSummary> groupClusters;

    // cluster -> top-N 兴趣
    @JsonProperty("top_interests")
    SortedMap<Integer, List<InterestCount>> topInterests;

    public int countOf(String group, int clusterId) {
        return groupClusters.stream()
                .filter(g -> Objects.equals(g.getGroup(), group) && g.getClusterId() == clusterId)
                .mapToInt(GroupClusterSummary::getCount)
                .findFirst()
                .orElse(0);
    }
}
