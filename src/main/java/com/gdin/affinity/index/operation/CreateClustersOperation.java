package com.gdin.affinity.index.operation;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.affinity.index.cluster.GraphClusterClient;
import com.gdin.affinity.index.cluster.LouvainCluster;
import com.gdin.affinity.index.cluster.ModularityCalculator;
import com.gdin.affinity.index.cluster.WeightedGraph;
import com.gdin.affinity.models.InterestGraph;
import com.gdin.affinity.models.Partition;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对兴趣共现图做模块度聚类：
 *
 * 1. 调用 GraphClusterClient 得到每一层的聚类 (level, cluster, parent, titles)；
 * 2. 取最高层展开成 兴趣 -> 聚类编号；
 * 3. 校验每个图节点恰好出现一次；
 * 4. 在原始图上计算最终划分的模块度。
 */
@Slf4j
@Component
public class CreateClustersOperation {

    private final GraphClusterClient graphClusterClient;

    public CreateClustersOperation(GraphClusterClient graphClusterClient) {
        this.graphClusterClient = graphClusterClient;
    }

    /**
     * @param graph      只读的兴趣共现图
     * @param resolution 模块度分辨率 γ
     * @param maxLevels  聚合层数上限
     * @param maxPasses  每层遍历轮数上限
     * @param seed       随机种子，可为 null
     */
    public Result createClusters(
            InterestGraph graph,
            double resolution,
            int maxLevels,
            int maxPasses,
            Integer seed
    ) {
        if (graph == null) throw new IllegalArgumentException("graph 不能为 null");
        if (graph.isEmpty()) {
            log.warn("兴趣池为空，返回空划分");
            return new Result(Partition.empty(), List.of());
        }

        List<LouvainCluster> clusters = graphClusterClient.clusterGraph(graph, resolution, maxLevels, maxPasses, seed);
        if (CollectionUtil.isEmpty(clusters)) {
            throw new IllegalStateException("聚类结果为空，但兴趣图有 " + graph.nodeCount() + " 个节点");
        }

        int topLevel = clusters.stream().mapToInt(LouvainCluster::getLevel).max().orElse(0);

        Map<String, Integer> clusterByTag = new LinkedHashMap<>();
        for (String node : graph.getNodes()) clusterByTag.put(node, null);

        for (LouvainCluster cluster : clusters) {
            if (cluster.getLevel() != topLevel || cluster.getNodeTitles() == null) continue;
            for (String title : cluster.getNodeTitles()) {
                if (!clusterByTag.containsKey(title)) {
                    throw new IllegalStateException("聚类结果包含不在兴趣图中的节点: " + title);
                }
                Integer previous = clusterByTag.put(title, cluster.getClusterId());
                if (previous != null) {
                    throw new IllegalStateException("节点被分到多个聚类: " + title + " -> " + previous + ", " + cluster.getClusterId());
                }
            }
        }
        clusterByTag.forEach((tag, cluster) -> {
            if (cluster == null) throw new IllegalStateException("节点没有被分配到任何聚类: " + tag);
        });

        int[] community = new int[graph.nodeCount()];
        for (int i = 0; i < community.length; i++) {
            community[i] = clusterByTag.get(graph.getNodes().get(i));
        }
        double modularity = ModularityCalculator.modularity(WeightedGraph.of(graph), community, resolution);

        Partition partition = new Partition(clusterByTag, modularity, topLevel + 1);
        log.info(
                "聚类完成：nodes={}, clusters={}, levels={}, modularity={}",
                graph.nodeCount(),
                partition.clusterCount(),
                partition.getLevels(),
                String.format("%.4f", modularity)
        );
        return new Result(partition, List.copyOf(clusters));
    }

    @Value
    public static class Result {
        Partition partition;
        List<LouvainCluster> hierarchy;
    }
}
