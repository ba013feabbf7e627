package com.gdin.affinity.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class InterestCount {

    @JsonProperty("interest")
    String interest;

    @JsonProperty("count")
    int count;
}
