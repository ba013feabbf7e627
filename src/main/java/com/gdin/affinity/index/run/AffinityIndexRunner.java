package com.gdin.affinity.index.run;

import com.gdin.affinity.config.ClusterSettings;
import com.gdin.affinity.config.properties.AffinityProperties;
import com.gdin.affinity.index.pipeline.Pipeline;
import com.gdin.affinity.index.pipeline.PipelineFactory;
import com.gdin.affinity.index.pipeline.StandardPipelineRegistrar;
import com.gdin.affinity.index.pipeline.context.PipelineRunContext;
import com.gdin.affinity.index.pipeline.context.PipelineRunResult;
import com.gdin.affinity.index.pipeline.context.RunPipeline;
import com.gdin.affinity.models.StudentRecord;
import com.gdin.affinity.models.TargetMember;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 运行入口：组装 context，跑 pipeline，再从 context 里收集结果。
 * 配置不合法时在任何计算之前就失败。
 */
@Slf4j
@Service
public class AffinityIndexRunner {

    @Resource
    private AffinityProperties affinityProperties;

    @Resource
    private PipelineFactory<ClusterSettings> factory;

    /**
     * 按配置文件里的输入输出路径跑完整流水线。
     */
    public AffinityResult runStandard() {
        ClusterSettings settings = ClusterSettings.from(affinityProperties).validate();
        AffinityProperties.Input input = affinityProperties.getInput();

        PipelineRunContext ctx = new PipelineRunContext();
        // ==============load_input_records==============
        ctx.put("student_data_path", input.getStudentDataPath());
        ctx.put("target_pool_path", input.getTargetPoolPath());
        ctx.put("identifier_column", input.getIdentifierColumn());
        ctx.put("group_column", input.getGroupColumn());

        return run(StandardPipelineRegistrar.STANDARD, settings, ctx);
    }

    /**
     * 使用配置文件中的参数，对内存中的数据跑一遍。
     */
    public AffinityResult runStandard(Map<String, StudentRecord> records, List<TargetMember> members) {
        return runStandard(records, members, ClusterSettings.from(affinityProperties));
    }

    public AffinityResult runStandard(
            Map<String, StudentRecord> records,
            List<TargetMember> members,
            ClusterSettings settings
    ) {
        settings.validate();

        PipelineRunContext ctx = new PipelineRunContext();
        ctx.put("student_records", records);
        ctx.put("target_members", members);

        return run(StandardPipelineRegistrar.STANDARD_IN_MEMORY, settings, ctx);
    }

    private AffinityResult run(String pipelineName, ClusterSettings settings, PipelineRunContext ctx) {
        Pipeline<ClusterSettings> pipeline = factory.createPipeline(pipelineName);
        List<PipelineRunResult> results = new RunPipeline<ClusterSettings>().run(pipeline, settings, ctx);

        for (PipelineRunResult r : results) {
            if (r.hasErrors()) {
                Exception cause = r.getErrors().get(0);
                throw new IllegalStateException("workflow " + r.getWorkflow() + " 执行失败: " + cause.getMessage(), cause);
            }
        }

        log.info("pipeline {} 完成，用时 {}s", pipelineName, String.format("%.3f", ctx.getStats().getTotalSeconds()));
        return AffinityResult.builder()
                .pool(ctx.require("interest_pool"))
                .graph(ctx.require("interest_graph"))
                .matrix(ctx.require("co_occurrence_matrix"))
                .partition(ctx.require("partition"))
                .hierarchy(ctx.require("cluster_hierarchy"))
                .assignments(ctx.require("assignments"))
                .summary(ctx.require("cluster_summary"))
                .missingIdentifiers(ctx.require("missing_identifiers"))
                .unassignedIdentifiers(ctx.require("unassigned_identifiers"))
                .build();
    }
}
