package com.gdin.affinity.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * (group, cluster) 维度的汇总：人数 + 按输入顺序拼接的 identifier 列表。
 */
@Value
@Builder
public class GroupClusterSummary {

    @JsonProperty("track")
    String group;

    @JsonProperty("cluster")
    int clusterId;

    @JsonProperty("count")
    int count;

    @JsonProperty("identifiers")
    List<String> identifiers;

    @JsonProperty("joined_identifiers")
    String joinedIdentifiers;
}
