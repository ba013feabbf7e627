package com.gdin.affinity.index.run;

import com.gdin.affinity.index.cluster.LouvainCluster;
import com.gdin.affinity.models.ClusterAssignment;
import com.gdin.affinity.models.ClusterSummary;
import com.gdin.affinity.models.CoOccurrenceMatrix;
import com.gdin.affinity.models.InterestGraph;
import com.gdin.affinity.models.InterestPool;
import com.gdin.affinity.models.Partition;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.SortedMap;

/**
 * 一次运行的完整、不可变结果。
 */
@Value
@Builder
public class AffinityResult {
    InterestPool pool;
    InterestGraph graph;
    CoOccurrenceMatrix matrix;
    Partition partition;
    // 每一层的聚类，最高层即 partition
    List<LouvainCluster> hierarchy;
    List<ClusterAssignment> assignments;
    ClusterSummary summary;
    // 目标人群中找不到记录的 identifier
    List<String> missingIdentifiers;
    // 没有任何池内兴趣、未参与分配的 identifier
    List<String> unassignedIdentifiers;

    public SortedMap<Integer, Set<String>> getClusterInterestSets() {
        return partition.clusterInterestSets();
    }
}
