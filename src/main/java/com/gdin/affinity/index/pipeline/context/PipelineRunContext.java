package com.gdin.affinity.index.pipeline.context;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * workflow 之间传递产物的共享状态。流水线单线程顺序执行。
 */
@Getter
public class PipelineRunContext {

    private final PipelineRunStats stats = new PipelineRunStats();
    private final Map<String, Object> state = new LinkedHashMap<>();

    public void put(String key, Object value) { state.put(key, value); }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) { return (T) state.get(key); }

    /** 缺少上游产物时直接失败 */
    public <T> T require(String key) {
        T value = get(key);
        if (value == null) {
            throw new IllegalStateException("pipeline context 缺少 " + key + "，上游 workflow 未执行或未产出");
        }
        return value;
    }
}
