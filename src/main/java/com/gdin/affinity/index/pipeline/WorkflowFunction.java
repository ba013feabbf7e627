package com.gdin.affinity.index.pipeline;

import com.gdin.affinity.index.pipeline.context.PipelineRunContext;

/**
 * 流水线中的一步：读取 context 中上游的产物，写回自己的产物。
 */
@FunctionalInterface
public interface WorkflowFunction<C> {
    WorkflowFunctionOutput run(C config, PipelineRunContext context) throws Exception;
}
