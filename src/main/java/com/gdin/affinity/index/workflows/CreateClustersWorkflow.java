package com.gdin.affinity.index.workflows;

import com.gdin.affinity.config.ClusterSettings;
import com.gdin.affinity.index.operation.CreateClustersOperation;
import com.gdin.affinity.models.InterestGraph;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 输入（来自 context.state）：
 * - interest_graph
 *
 * 输出（写回 context.state）：
 * - partition
 * - cluster_hierarchy
 */
@Slf4j
@Service
public class CreateClustersWorkflow {

    @Resource
    private CreateClustersOperation createClustersOperation;

    public CreateClustersOperation.Result run(InterestGraph graph, ClusterSettings settings) {
        if (graph == null) throw new IllegalStateException("interest_graph 不能为空");

        log.info(
                "开始聚类：nodes={}, edges={}, resolution={}, seed={}",
                graph.nodeCount(),
                graph.getEdges().size(),
                settings.getResolution(),
                settings.getSeed()
        );

        return createClustersOperation.createClusters(
                graph,
                settings.getResolution(),
                settings.getMaxLevels(),
                settings.getMaxPasses(),
                settings.getSeed()
        );
    }
}
