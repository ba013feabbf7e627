package com.gdin.affinity.index.cluster;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Louvain 第一阶段：每个节点初始各自成簇，按固定顺序反复遍历节点，
 * 把节点移到模块度增益最大的相邻聚类，直到某一轮没有任何移动。
 * <p>
 * 节点 i 移入聚类 C 的增益（已先把 i 从原聚类移出，省略常数因子 1/m）：
 * {@code w(i,C) - γ * tot(C) * k_i / 2m}。
 * 只有当候选聚类的增益严格大于留在原聚类的增益时才移动；候选聚类按编号升序比较，
 * 因此并列时保留原聚类，其次取编号最小者。
 */
@Slf4j
public class LocalMovingPhase {

    static final double EPSILON = 1e-12;

    private final WeightedGraph graph;
    private final double resolution;
    private final int[] order;
    private final int maxPasses;

    private final int[] community;
    private final double[] tot;

    /** 初始（全部单点）以及每一轮结束后的模块度 */
    @Getter
    private final List<Double> modularityHistory = new ArrayList<>();

    @Getter
    private int passes;

    @Getter
    private int totalMoves;

    @Getter
    private boolean passCapReached;

    /**
     * @param order 节点访问顺序，必须是 0..n-1 的一个排列
     */
    public LocalMovingPhase(WeightedGraph graph, double resolution, int[] order, int maxPasses) {
        if (order.length != graph.nodeCount()) {
            throw new IllegalArgumentException("访问顺序长度与节点数不一致: " + order.length + " vs " + graph.nodeCount());
        }
        this.graph = graph;
        this.resolution = resolution;
        this.order = order.clone();
        this.maxPasses = maxPasses;

        int n = graph.nodeCount();
        this.community = new int[n];
        this.tot = new double[n];
        for (int i = 0; i < n; i++) {
            community[i] = i;
            tot[i] = graph.degree(i);
        }
    }

    /**
     * @return 节点 -> 聚类编号（编号为原节点号，未重新编号）
     */
    public int[] run() {
        double m2 = 2 * graph.totalWeight();
        modularityHistory.add(ModularityCalculator.modularity(graph, community, resolution));
        if (m2 == 0) {
            return community.clone();
        }

        while (passes < maxPasses) {
            int moves = 0;
            for (int node : order) {
                if (moveNode(node, m2)) moves++;
            }
            passes++;
            totalMoves += moves;
            modularityHistory.add(ModularityCalculator.modularity(graph, community, resolution));
            if (moves == 0) {
                return community.clone();
            }
        }

        passCapReached = true;
        log.warn("local moving 达到遍历上限 {} 轮仍未收敛，返回当前划分", maxPasses);
        return community.clone();
    }

    private boolean moveNode(int node, double m2) {
        int current = community[node];
        double k = graph.degree(node);
        Map<Integer, Double> links = neighborCommunityWeights(node);

        // 先移出原聚类
        tot[current] -= k;

        int best = current;
        double bestGain = gain(links.getOrDefault(current, 0.0), tot[current], k, m2);
        for (Map.Entry<Integer, Double> entry : links.entrySet()) {
            int candidate = entry.getKey();
            if (candidate == current) continue;
            double g = gain(entry.getValue(), tot[candidate], k, m2);
            if (g > bestGain + EPSILON) {
                best = candidate;
                bestGain = g;
            }
        }

        tot[best] += k;
        community[node] = best;
        return best != current;
    }

    private double gain(double linkWeight, double communityTotal, double k, double m2) {
        return linkWeight - resolution * communityTotal * k / m2;
    }

    /** 相邻聚类 -> 连到该聚类的边权之和，不含自环，按聚类编号升序 */
    private Map<Integer, Double> neighborCommunityWeights(int node) {
        int[] ns = graph.neighbors(node);
        double[] ws = graph.neighborWeights(node);
        if (ns.length == 0) return Collections.emptyMap();
        Map<Integer, Double> links = new TreeMap<>();
        for (int p = 0; p < ns.length; p++) {
            links.merge(community[ns[p]], ws[p], Double::sum);
        }
        return links;
    }
}
