package com.gdin.affinity.index.operation;

import com.gdin.affinity.models.ClusterAssignment;
import com.gdin.affinity.models.ClusterSummary;
import com.gdin.affinity.models.GroupClusterSummary;
import com.gdin.affinity.models.Individual;
import com.gdin.affinity.models.InterestCount;
import com.gdin.affinity.models.Partition;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 分配结果的汇总，只读派生：
 * <ul>
 *   <li>(group, cluster) 人数；</li>
 *   <li>每个聚类出现次数最多的 top-N 兴趣（只统计分到该聚类的个体、且属于该聚类的兴趣），
 *       次数并列时按首次出现顺序；</li>
 *   <li>(group, cluster) 的 identifier 列表，按分配顺序拼接。</li>
 * </ul>
 */
@Slf4j
@Component
public class SummarizeClustersOperation {

    private static final Comparator<GroupKey> GROUP_KEY_ORDER = Comparator
            .comparing(GroupKey::getGroup, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparingInt(GroupKey::getClusterId);

    public ClusterSummary summarize(
            List<ClusterAssignment> assignments,
            List<Individual> individuals,
            Partition partition,
            int topN,
            String identifierDelimiter
    ) {
        if (topN < 0) throw new IllegalArgumentException("topN 不能为负数: " + topN);
        String delimiter = identifierDelimiter == null ? ", " : identifierDelimiter;

        // 1. (group, cluster) -> identifiers，保持分配顺序
        Map<GroupKey, List<String>> identifiersByKey = new TreeMap<>(GROUP_KEY_ORDER);
        for (ClusterAssignment assignment : assignments) {
            identifiersByKey
                    .computeIfAbsent(new GroupKey(assignment.getGroup(), assignment.getClusterId()), k -> new ArrayList<>())
                    .add(assignment.getIdentifier());
        }

        List<GroupClusterSummary> groupClusters = new ArrayList<>();
        identifiersByKey.forEach((key, ids) -> groupClusters.add(GroupClusterSummary.builder()
                .group(key.getGroup())
                .clusterId(key.getClusterId())
                .count(ids.size())
                .identifiers(List.copyOf(ids))
                .joinedIdentifiers(String.join(delimiter, ids))
                .build()));

        // 2. 每个聚类的 top-N 兴趣
        Map<String, Individual> individualById = new HashMap<>();
        for (Individual individual : individuals) {
            individualById.putIfAbsent(individual.getIdentifier(), individual);
        }

        SortedMap<Integer, Set<String>> clusterInterests = partition.clusterInterestSets();
        SortedMap<Integer, List<InterestCount>> topInterests = new TreeMap<>();
        for (Map.Entry<Integer, Set<String>> entry : clusterInterests.entrySet()) {
            int clusterId = entry.getKey();
            Set<String> interests = entry.getValue();

            // LinkedHashMap 保留首次出现顺序，配合稳定排序实现并列按插入顺序
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (ClusterAssignment assignment : assignments) {
                if (assignment.getClusterId() != clusterId) continue;
                Individual individual = individualById.get(assignment.getIdentifier());
                if (individual == null || individual.getInterests() == null) continue;
                for (String interest : individual.getInterests()) {
                    if (interests.contains(interest)) counts.merge(interest, 1, Integer::sum);
                }
            }

            List<InterestCount> ranked = new ArrayList<>();
            counts.forEach((interest, count) -> ranked.add(new InterestCount(interest, count)));
            ranked.sort(Comparator.comparingInt(InterestCount::getCount).reversed());
            topInterests.put(clusterId, List.copyOf(ranked.subList(0, Math.min(topN, ranked.size()))));
        }

        log.info("聚类汇总完成：groupClusters={}, clusters={}, topN={}", groupClusters.size(), topInterests.size(), topN);
        return ClusterSummary.builder()
                .groupClusters(List.copyOf(groupClusters))
                .topInterests(Collections.unmodifiableSortedMap(topInterests))
                .build();
    }

    @Value
    private static class GroupKey {
        String group;
        int clusterId;
    }
}
