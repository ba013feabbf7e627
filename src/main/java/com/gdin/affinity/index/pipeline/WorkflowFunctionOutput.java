package com.gdin.affinity.index.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorkflowFunctionOutput {
    Object result;
    // true 时流水线在本步之后停止
    @Builder.Default
    boolean stop = false;
}
