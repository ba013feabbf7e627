package com.gdin.affinity.index.workflows;

import com.gdin.affinity.index.operation.BuildInterestGraphOperation;
import com.gdin.affinity.index.operation.BuildInterestPoolOperation;
import com.gdin.affinity.models.CoOccurrenceMatrix;
import com.gdin.affinity.models.Individual;
import com.gdin.affinity.models.InterestGraph;
import com.gdin.affinity.models.InterestPool;
import com.gdin.affinity.models.StudentRecord;
import com.gdin.affinity.models.TargetMember;
import jakarta.annotation.Resource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 输入（来自 context.state）：
 * - student_records
 * - target_members
 *
 * 输出（写回 context.state）：
 * - interest_pool / individuals / missing_identifiers
 * - interest_graph / co_occurrence_matrix
 */
@Slf4j
@Service
public class BuildInterestGraphWorkflow {

    @Resource
    private BuildInterestPoolOperation buildInterestPoolOperation;

    @Resource
    private BuildInterestGraphOperation buildInterestGraphOperation;

    public Result run(
            Map<String, StudentRecord> records,
            List<TargetMember> members,
            Collection<String> excludedInterests
    ) {
        if (records == null) throw new IllegalStateException("student_records 不能为空");
        if (members == null) throw new IllegalStateException("target_members 不能为空");

        log.info("开始构建兴趣共现图：records={}, members={}", records.size(), members.size());

        BuildInterestPoolOperation.Result poolResult = buildInterestPoolOperation.buildPool(records, members, excludedInterests);
        BuildInterestGraphOperation.Result graphResult = buildInterestGraphOperation.buildGraph(
                poolResult.getIndividuals(),
                poolResult.getPool()
        );

        return new Result(
                poolResult.getPool(),
                poolResult.getIndividuals(),
                poolResult.getMissingIdentifiers(),
                graphResult.getGraph(),
                graphResult.getMatrix()
        );
    }

    @Value
    public static class Result {
        InterestPool pool;
        List<Individual> individuals;
        List<String> missingIdentifiers;
        InterestGraph graph;
        CoOccurrenceMatrix matrix;
    }
}
