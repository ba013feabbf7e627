package com.gdin.affinity.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * 共现图的一条无向边，source 的池下标总是小于 target。
 * weight = 同时选了这两个兴趣的人数。
 */
@Value
@Builder
public class InterestEdge {

    @JsonProperty("source")
    String source;

    @JsonProperty("target")
    String target;

    @JsonProperty("weight")
    int weight;
}
