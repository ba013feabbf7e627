package com.gdin.affinity.index.workflows;

import cn.hutool.core.util.StrUtil;
import com.gdin.affinity.config.properties.AffinityProperties;
import com.gdin.affinity.models.ClusterAssignment;
import com.gdin.affinity.models.ClusterSummary;
import com.gdin.affinity.models.CoOccurrenceMatrix;
import com.gdin.affinity.models.InterestPool;
import com.gdin.affinity.models.Partition;
import com.gdin.affinity.storage.AffinityResultExporter;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 按配置导出结果；某个输出路径为空就跳过该项。
 */
@Slf4j
@Service
public class ExportResultsWorkflow {

    @Resource
    private AffinityResultExporter affinityResultExporter;

    public int run(
            AffinityProperties.Output output,
            InterestPool pool,
            CoOccurrenceMatrix matrix,
            Partition partition,
            List<ClusterAssignment> assignments,
            ClusterSummary summary
    ) throws Exception {
        int written = 0;
        if (StrUtil.isNotBlank(output.getAssignmentsPath())) {
            affinityResultExporter.writeAssignments(output.getAssignmentsPath(), assignments);
            written++;
        }
        if (StrUtil.isNotBlank(output.getMatrixPath())) {
            affinityResultExporter.writeMatrix(output.getMatrixPath(), matrix);
            written++;
        }
        if (StrUtil.isNotBlank(output.getSummaryPath())) {
            affinityResultExporter.writeSummary(output.getSummaryPath(), pool, partition, summary);
            written++;
        }
        if (written == 0) {
            log.info("未配置任何输出路径，跳过导出");
        }
        return written;
    }
}
