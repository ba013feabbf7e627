package com.gdin.affinity.models;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 兴趣共现图：节点为兴趣池中的全部标签（包括孤立点），边按 (source 下标, target 下标) 升序排列。
 * 构建之后只读，聚类阶段不会修改它。
 */
public final class InterestGraph {

    @Getter
    private final List<String> nodes;

    @Getter
    private final List<InterestEdge> edges;

    private final Map<String, Integer> indexByNode = new HashMap<>();
    private final Map<Long, Integer> weightByPair = new HashMap<>();
    private final int[] degrees;
    private final long totalWeight;

    public InterestGraph(List<String> nodes, List<InterestEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = Collections.unmodifiableList(List.copyOf(edges));
        for (int i = 0; i < this.nodes.size(); i++) {
            indexByNode.put(this.nodes.get(i), i);
        }

        this.degrees = new int[this.nodes.size()];
        long total = 0;
        for (InterestEdge edge : this.edges) {
            int s = requireIndex(edge.getSource());
            int t = requireIndex(edge.getTarget());
            if (s == t) throw new IllegalArgumentException("兴趣图不允许自环: " + edge.getSource());
            if (edge.getWeight() <= 0) throw new IllegalArgumentException("边权必须为正: " + edge);
            if (weightByPair.put(pairKey(s, t), edge.getWeight()) != null) {
                throw new IllegalArgumentException("重复边: " + edge.getSource() + " - " + edge.getTarget());
            }
            degrees[s] += edge.getWeight();
            degrees[t] += edge.getWeight();
            total += edge.getWeight();
        }
        this.totalWeight = total;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** 不在图中返回 -1 */
    public int indexOf(String node) {
        Integer i = indexByNode.get(node);
        return i == null ? -1 : i;
    }

    public boolean hasEdge(String a, String b) {
        return weight(a, b) > 0;
    }

    /** 没有边返回 0 */
    public int weight(String a, String b) {
        Integer i = indexByNode.get(a);
        Integer j = indexByNode.get(b);
        if (i == null || j == null || i.equals(j)) return 0;
        return weightByPair.getOrDefault(pairKey(i, j), 0);
    }

    /** 加权度 */
    public int degree(String node) {
        return degrees[requireIndex(node)];
    }

    /** 所有边权之和 m */
    public long totalWeight() {
        return totalWeight;
    }

    private int requireIndex(String node) {
        Integer i = indexByNode.get(node);
        if (i == null) throw new IllegalArgumentException("节点不在兴趣图中: " + node);
        return i;
    }

    private static long pairKey(int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        return ((long) lo << 32) | hi;
    }
}
