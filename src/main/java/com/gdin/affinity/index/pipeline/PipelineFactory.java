package com.gdin.affinity.index.pipeline;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * workflow 按名字注册，pipeline 是 workflow 名字的有序列表。
 */
public class PipelineFactory<C> {

    private final Map<String, WorkflowFunction<C>> workflows = new HashMap<>();
    private final Map<String, List<String>> pipelines = new HashMap<>();

    public void register(String name, WorkflowFunction<C> workflow) {
        if (workflows.putIfAbsent(name, workflow) != null) {
            throw new IllegalStateException("Workflow already registered: " + name);
        }
    }

    public void registerPipeline(String name, List<String> workflowNames) {
        pipelines.put(name, List.copyOf(workflowNames));
    }

    public boolean hasPipeline(String name) {
        return pipelines.containsKey(name);
    }

    public Pipeline<C> createPipeline(String pipelineName) {
        List<String> names = pipelines.get(pipelineName);
        if (names == null) {
            throw new IllegalArgumentException("Pipeline not registered: " + pipelineName);
        }
        Pipeline<C> pipeline = new Pipeline<>(pipelineName);
        for (String n : names) {
            WorkflowFunction<C> wf = workflows.get(n);
            if (wf == null) {
                throw new IllegalStateException("Workflow not registered: " + n);
            }
            pipeline.add(n, wf);
        }
        return pipeline;
    }
}
