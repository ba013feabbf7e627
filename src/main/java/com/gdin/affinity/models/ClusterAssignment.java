package com.gdin.affinity.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 一个个体的聚类分配结果，一行对应导出表中的一行。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusterAssignment {

    @JsonProperty("email")
    String identifier;

    @JsonProperty("firstName")
    String firstName;

    @JsonProperty("lastName")
    String lastName;

    @JsonProperty("track")
    String group;

    @JsonProperty("cluster")
    int clusterId;

    // 个体池内兴趣 ∩ 所选聚类的兴趣集合，顺序同个体原始兴趣
    @JsonProperty("matched_interests")
    List<String> matchedInterests;
}
