package com.gdin.affinity.index.cluster;

import com.gdin.affinity.models.InterestGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 进程内的 Louvain 实现：local moving + 聚合，循环直到某一层不再合并或只剩一个节点。
 * <p>
 * 每一层都构造一张新的聚合图，输入的 {@link InterestGraph} 始终只读。
 * 无种子时按节点编号（即兴趣池字典序）访问；有种子时每层用同一个 {@link Random} 打乱一次访问顺序。
 */
@Slf4j
@Component
public class LouvainGraphClusterClient implements GraphClusterClient {

    @Override
    public List<LouvainCluster> clusterGraph(
            InterestGraph graph,
            double resolution,
            int maxLevels,
            int maxPasses,
            Integer seed
    ) {
        if (graph == null || graph.isEmpty()) {
            return Collections.emptyList();
        }

        int n0 = graph.nodeCount();
        WeightedGraph current = WeightedGraph.of(graph);

        // 没有任何共现：合并永远不会带来正增益，直接返回单点聚类
        if (current.totalWeight() == 0) {
            log.info("兴趣图没有任何边，{} 个节点各自成簇", n0);
            int[] identity = identity(n0);
            return toClusters(graph, List.of(identity));
        }

        Random random = seed == null ? null : new Random(seed);

        // membership[原始节点] = 当前层节点编号
        int[] membership = identity(n0);
        List<int[]> levels = new ArrayList<>();

        for (int level = 0; level < maxLevels; level++) {
            int nodeCount = current.nodeCount();
            LocalMovingPhase phase = new LocalMovingPhase(current, resolution, visitingOrder(nodeCount, random), maxPasses);
            int[] community = renumber(phase.run());
            int clusterCount = maxOf(community) + 1;

            log.debug(
                    "Louvain level={}: nodes={}, clusters={}, passes={}, moves={}, modularity={}",
                    level,
                    nodeCount,
                    clusterCount,
                    phase.getPasses(),
                    phase.getTotalMoves(),
                    phase.getModularityHistory().get(phase.getModularityHistory().size() - 1)
            );

            boolean merged = clusterCount < nodeCount;
            if (merged || levels.isEmpty()) {
                for (int i = 0; i < n0; i++) {
                    membership[i] = community[membership[i]];
                }
                levels.add(membership.clone());
            }

            if (!merged || clusterCount == 1) {
                return toClusters(graph, levels);
            }
            current = current.aggregate(community, clusterCount);
        }

        log.warn("Louvain 达到聚合层数上限 {}，返回当前最优划分", maxLevels);
        return toClusters(graph, levels);
    }

    private static int[] identity(int n) {
        int[] ids = new int[n];
        for (int i = 0; i < n; i++) ids[i] = i;
        return ids;
    }

    private static int[] visitingOrder(int n, Random random) {
        int[] order = identity(n);
        if (random == null) return order;
        List<Integer> shuffled = new ArrayList<>(n);
        for (int i : order) shuffled.add(i);
        Collections.shuffle(shuffled, random);
        for (int i = 0; i < n; i++) order[i] = shuffled.get(i);
        return order;
    }

    /**
     * 聚类编号改为 0..k-1，按节点编号升序首次出现的顺序分配。
     */
    static int[] renumber(int[] community) {
        Map<Integer, Integer> remap = new LinkedHashMap<>();
        int[] result = new int[community.length];
        for (int i = 0; i < community.length; i++) {
            Integer id = remap.get(community[i]);
            if (id == null) {
                id = remap.size();
                remap.put(community[i], id);
            }
            result[i] = id;
        }
        return result;
    }

    private static int maxOf(int[] values) {
        return Arrays.stream(values).max().orElse(-1);
    }

    private static List<LouvainCluster> toClusters(InterestGraph graph, List<int[]> levels) {
        List<String> nodes = graph.getNodes();
        List<LouvainCluster> clusters = new ArrayList<>();
        for (int level = 0; level < levels.size(); level++) {
            int[] membership = levels.get(level);
            int[] parent = level + 1 < levels.size() ? levels.get(level + 1) : null;

            Map<Integer, List<String>> titles = new LinkedHashMap<>();
            Map<Integer, Integer> parents = new LinkedHashMap<>();
            for (int i = 0; i < membership.length; i++) {
                titles.computeIfAbsent(membership[i], k -> new ArrayList<>()).add(nodes.get(i));
                parents.putIfAbsent(membership[i], parent == null ? -1 : parent[i]);
            }

            for (Map.Entry<Integer, List<String>> entry : titles.entrySet()) {
                clusters.add(LouvainCluster.builder()
                        .level(level)
                        .clusterId(entry.getKey())
                        .parentClusterId(parents.get(entry.getKey()))
                        .nodeTitles(List.copyOf(entry.getValue()))
                        .build());
            }
        }
        return clusters;
    }
}
