package com.gdin.affinity.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 兴趣标签 -> 聚类编号。每个池内标签恰好属于一个聚类，收敛之后不再修改。
 */
public final class Partition {

    @JsonProperty("assignments")
    private final Map<String, Integer> clusterByTag;

    @Getter
    @JsonProperty("modularity")
    private final double modularity;

    @Getter
    @JsonProperty("levels")
    private final int levels;

    public Partition(Map<String, Integer> clusterByTag, double modularity, int levels) {
        Map<String, Integer> copy = new LinkedHashMap<>();
        clusterByTag.forEach((tag, cluster) -> {
            if (tag == null || cluster == null) throw new IllegalArgumentException("partition 不允许 null 键或值");
            if (cluster < 0) throw new IllegalArgumentException("聚类编号不能为负: " + tag + " -> " + cluster);
            copy.put(tag, cluster);
        });
        this.clusterByTag = Collections.unmodifiableMap(copy);
        this.modularity = modularity;
        this.levels = levels;
    }

    public static Partition empty() {
        return new Partition(Map.of(), 0.0, 0);
    }

    public Map<String, Integer> asMap() {
        return clusterByTag;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return clusterByTag.isEmpty();
    }

    public int size() {
        return clusterByTag.size();
    }

    /** 标签不在 partition 中返回 null */
    public Integer clusterOf(String tag) {
        return clusterByTag.get(tag);
    }

    /** 升序的聚类编号 */
    @JsonIgnore
    public SortedSet<Integer> clusterIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(clusterByTag.values()));
    }

    @JsonIgnore
    public int clusterCount() {
        return clusterIds().size();
    }

    /**
     * ClusterInterestSet：聚类编号 -> 该聚类的兴趣集合（保持兴趣池顺序）。
     */
    @JsonProperty("clusters")
    public SortedMap<Integer, Set<String>> clusterInterestSets() {
        SortedMap<Integer, Set<String>> sets = new TreeMap<>();
        clusterByTag.forEach((tag, cluster) -> sets.computeIfAbsent(cluster, k -> new LinkedHashSet<>()).add(tag));
        SortedMap<Integer, Set<String>> result = new TreeMap<>();
        sets.forEach((cluster, tags) -> result.put(cluster, Collections.unmodifiableSet(tags)));
        return Collections.unmodifiableSortedMap(result);
    }

    public List<String> interestsOf(int clusterId) {
        List<String> tags = new ArrayList<>();
        clusterByTag.forEach((tag, cluster) -> {
            if (cluster == clusterId) tags.add(tag);
        });
        return tags;
    }

    @Override
    public String toString() {
        return "Partition{modularity=" + modularity + ", levels=" + levels + ", clusters=" + clusterInterestSets() + "}";
    }
}
