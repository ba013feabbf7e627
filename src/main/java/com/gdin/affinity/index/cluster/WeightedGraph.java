package com.gdin.affinity.index.cluster;

import com.gdin.affinity.models.InterestEdge;
import com.gdin.affinity.models.InterestGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Louvain 每一层使用的整数节点无向加权图，节点编号 0..n-1，邻接表按编号升序。
 * 聚合图里的节点是上一层的聚类，聚类内部边权记为自环。
 * <p>
 * 加权度 k_i = 邻边权重之和 + 2 * 自环权重；总权重 m = Σk_i / 2。
 */
public final class WeightedGraph {

    private final int[][] neighbors;
    private final double[][] weights;
    private final double[] selfLoops;
    private final double[] degrees;
    private final double totalWeight;

    private WeightedGraph(int[][] neighbors, double[][] weights, double[] selfLoops) {
        this.neighbors = neighbors;
        this.weights = weights;
        this.selfLoops = selfLoops;
        this.degrees = new double[selfLoops.length];
        double sum = 0;
        for (int i = 0; i < selfLoops.length; i++) {
            double k = 2 * selfLoops[i];
            for (double w : weights[i]) k += w;
            degrees[i] = k;
            sum += k;
        }
        this.totalWeight = sum / 2;
    }

    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount);
    }

    /** 节点编号即兴趣池下标 */
    public static WeightedGraph of(InterestGraph graph) {
        Builder builder = builder(graph.nodeCount());
        for (InterestEdge edge : graph.getEdges()) {
            builder.addEdge(graph.indexOf(edge.getSource()), graph.indexOf(edge.getTarget()), edge.getWeight());
        }
        return builder.build();
    }

    public int nodeCount() {
        return selfLoops.length;
    }

    public int[] neighbors(int node) {
        return neighbors[node];
    }

    public double[] neighborWeights(int node) {
        return weights[node];
    }

    public double selfLoop(int node) {
        return selfLoops[node];
    }

    public double degree(int node) {
        return degrees[node];
    }

    public double totalWeight() {
        return totalWeight;
    }

    /**
     * 按聚类折叠成下一层的图：community 必须是 0..clusterCount-1 的连续编号。
     */
    public WeightedGraph aggregate(int[] community, int clusterCount) {
        if (community.length != nodeCount()) {
            throw new IllegalArgumentException("community 长度与节点数不一致: " + community.length + " vs " + nodeCount());
        }
        Builder builder = builder(clusterCount);
        for (int i = 0; i < nodeCount(); i++) {
            int ci = community[i];
            if (selfLoops[i] > 0) builder.addEdge(ci, ci, selfLoops[i]);
            int[] ns = neighbors[i];
            double[] ws = weights[i];
            for (int p = 0; p < ns.length; p++) {
                // 每条无向边只计一次
                if (ns[p] > i) builder.addEdge(ci, community[ns[p]], ws[p]);
            }
        }
        return builder.build();
    }

    public static final class Builder {
        private final List<Map<Integer, Double>> adjacency;
        private final double[] selfLoops;

        private Builder(int nodeCount) {
            if (nodeCount < 0) throw new IllegalArgumentException("nodeCount 不能为负: " + nodeCount);
            this.adjacency = new ArrayList<>(nodeCount);
            for (int i = 0; i < nodeCount; i++) adjacency.add(new TreeMap<>());
            this.selfLoops = new double[nodeCount];
        }

        /** a == b 时累加为自环，否则双向累加 */
        public Builder addEdge(int a, int b, double weight) {
            if (weight < 0) throw new IllegalArgumentException("边权不能为负: " + weight);
            if (weight == 0) return this;
            if (a == b) {
                selfLoops[a] += weight;
            } else {
                adjacency.get(a).merge(b, weight, Double::sum);
                adjacency.get(b).merge(a, weight, Double::sum);
            }
            return this;
        }

        public WeightedGraph build() {
            int n = selfLoops.length;
            int[][] neighbors = new int[n][];
            double[][] weights = new double[n][];
            for (int i = 0; i < n; i++) {
                Map<Integer, Double> adj = adjacency.get(i);
                neighbors[i] = new int[adj.size()];
                weights[i] = new double[adj.size()];
                int p = 0;
                for (Map.Entry<Integer, Double> e : adj.entrySet()) {
                    neighbors[i][p] = e.getKey();
                    weights[i][p] = e.getValue();
                    p++;
                }
            }
            return new WeightedGraph(neighbors, weights, selfLoops.clone());
        }
    }
}
