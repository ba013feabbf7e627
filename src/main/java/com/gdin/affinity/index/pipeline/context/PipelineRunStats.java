package com.gdin.affinity.index.pipeline.context;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class PipelineRunStats {

    // workflow -> 耗时（秒），按执行顺序
    private final Map<String, Double> workflowSeconds = new LinkedHashMap<>();

    @Setter
    private double totalSeconds;
}
