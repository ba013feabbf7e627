package com.gdin.affinity.index.operation;

import com.gdin.affinity.models.ClusterAssignment;
import com.gdin.affinity.models.Individual;
import com.gdin.affinity.models.InterestPool;
import com.gdin.affinity.models.Partition;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;

/**
 * 把每个个体分到与其池内兴趣交集最大的聚类。
 * 交集大小并列时取编号最小的聚类（按编号升序遍历，取第一个最大值）。
 * 池内兴趣为空的个体不分配，也不算错误。
 */
@Slf4j
@Component
public class AssignClustersOperation {

    /**
     * 单个个体的分配，纯函数。
     *
     * @return 池内兴趣为空时返回 empty
     */
    public Optional<ClusterAssignment> assign(Individual individual, InterestPool pool, Partition partition) {
        List<String> poolInterests = pool.restrict(individual.getInterests());
        if (poolInterests.isEmpty()) return Optional.empty();

        SortedMap<Integer, Set<String>> clusterInterests = partition.clusterInterestSets();
        int bestCluster = -1;
        int bestOverlap = -1;
        for (Map.Entry<Integer, Set<String>> entry : clusterInterests.entrySet()) {
            int overlap = 0;
            for (String interest : poolInterests) {
                if (entry.getValue().contains(interest)) overlap++;
            }
            if (overlap > bestOverlap) {
                bestOverlap = overlap;
                bestCluster = entry.getKey();
            }
        }
        if (bestCluster < 0) {
            throw new IllegalStateException("partition 中没有任何聚类，无法分配: " + individual.getIdentifier());
        }

        Set<String> chosen = clusterInterests.get(bestCluster);
        List<String> matched = new ArrayList<>();
        for (String interest : poolInterests) {
            if (chosen.contains(interest)) matched.add(interest);
        }

        return Optional.of(ClusterAssignment.builder()
                .identifier(individual.getIdentifier())
                .firstName(individual.getFirstName())
                .lastName(individual.getLastName())
                .group(individual.getGroup())
                .clusterId(bestCluster)
                .matchedInterests(List.copyOf(matched))
                .build());
    }

    /**
     * 按 group 首次出现的顺序逐组分配，组内保持输入顺序。
     */
    public Result assignAll(List<Individual> individuals, InterestPool pool, Partition partition) {
        Map<String, List<Individual>> byGroup = new LinkedHashMap<>();
        for (Individual individual : individuals) {
            byGroup.computeIfAbsent(individual.getGroup(), k -> new ArrayList<>()).add(individual);
        }

        List<ClusterAssignment> assignments = new ArrayList<>();
        List<String> unassigned = new ArrayList<>();
        for (List<Individual> group : byGroup.values()) {
            for (Individual individual : group) {
                Optional<ClusterAssignment> assignment = assign(individual, pool, partition);
                if (assignment.isPresent()) {
                    assignments.add(assignment.get());
                } else {
                    unassigned.add(individual.getIdentifier());
                }
            }
        }

        log.info("聚类分配完成：individuals={}, assigned={}, noPoolOverlap={}", individuals.size(), assignments.size(), unassigned.size());
        return new Result(List.copyOf(assignments), List.copyOf(unassigned));
    }

    @Value
    public static class Result {
        List<ClusterAssignment> assignments;
        List<String> unassignedIdentifiers;
    }
}
