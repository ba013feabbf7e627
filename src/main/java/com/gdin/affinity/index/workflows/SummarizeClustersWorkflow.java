package com.gdin.affinity.index.workflows;

import com.gdin.affinity.index.operation.SummarizeClustersOperation;
import com.gdin.affinity.models.ClusterAssignment;
import com.gdin.affinity.models.ClusterSummary;
import com.gdin.affinity.models.GroupClusterSummary;
import com.gdin.affinity.models.Individual;
import com.gdin.affinity.models.InterestCount;
import com.gdin.affinity.models.Partition;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 输入（来自 context.state）：
 * - assignments / individuals / partition
 *
 * 输出（写回 context.state）：
 * - cluster_summary
 *
 * 同时把汇总报告打到日志里。
 */
@Slf4j
@Service
public class SummarizeClustersWorkflow {

    @Resource
    private SummarizeClustersOperation summarizeClustersOperation;

    public ClusterSummary run(
            List<ClusterAssignment> assignments,
            List<Individual> individuals,
            Partition partition,
            int topN,
            String identifierDelimiter
    ) {
        if (assignments == null) throw new IllegalStateException("assignments 不能为空");
        if (partition == null) throw new IllegalStateException("partition 不能为空");

        log.info("开始汇总：assignments={}, clusters={}, topN={}", assignments.size(), partition.clusterCount(), topN);
        ClusterSummary summary = summarizeClustersOperation.summarize(
                assignments,
                individuals == null ? List.of() : individuals,
                partition,
                topN,
                identifierDelimiter
        );
        logReport(summary);
        return summary;
    }

    private void logReport(ClusterSummary summary) {
        log.info("Cluster summary (individuals per track and cluster):");
        for (GroupClusterSummary g : summary.getGroupClusters()) {
            log.info("  track={} cluster={} count={}", g.getGroup(), g.getClusterId(), g.getCount());
        }

        log.info("Top interests in each cluster:");
        for (Map.Entry<Integer, List<InterestCount>> entry : summary.getTopInterests().entrySet()) {
            log.info("  cluster {}:", entry.getKey());
            for (InterestCount c : entry.getValue()) {
                log.info("    {} ({})", c.getInterest(), c.getCount());
            }
        }

        log.info("Identifier lists per track and cluster:");
        for (GroupClusterSummary g : summary.getGroupClusters()) {
            log.info("  track={} cluster={} -> {}", g.getGroup(), g.getClusterId(), g.getJoinedIdentifiers());
        }
    }
}
