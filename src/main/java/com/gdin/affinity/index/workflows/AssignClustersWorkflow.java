package com.gdin.affinity.index.workflows;

import com.gdin.affinity.index.operation.AssignClustersOperation;
import com.gdin.affinity.models.Individual;
import com.gdin.affinity.models.InterestPool;
import com.gdin.affinity.models.Partition;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 输入（来自 context.state）：
 * - individuals / interest_pool / partition
 *
 * 输出（写回 context.state）：
 * - assignments
 * - unassigned_identifiers
 */
@Slf4j
@Service
public class AssignClustersWorkflow {

    @Resource
    private AssignClustersOperation assignClustersOperation;

    public AssignClustersOperation.Result run(List<Individual> individuals, InterestPool pool, Partition partition) {
        if (individuals == null) throw new IllegalStateException("individuals 不能为空");
        if (pool == null) throw new IllegalStateException("interest_pool 不能为空");
        if (partition == null) throw new IllegalStateException("partition 不能为空");

        log.info("开始分配聚类：individuals={}, clusters={}", individuals.size(), partition.clusterCount());
        return assignClustersOperation.assignAll(individuals, pool, partition);
    }
}
