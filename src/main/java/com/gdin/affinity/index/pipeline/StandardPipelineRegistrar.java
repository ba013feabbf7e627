package com.gdin.affinity.index.pipeline;

import com.gdin.affinity.config.ClusterSettings;
import com.gdin.affinity.config.properties.AffinityProperties;
import com.gdin.affinity.index.operation.AssignClustersOperation;
import com.gdin.affinity.index.operation.CreateClustersOperation;
import com.gdin.affinity.index.workflows.*;
import com.gdin.affinity.models.ClusterSummary;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class StandardPipelineRegistrar {

    public static final String STANDARD = "standard";
    public static final String STANDARD_IN_MEMORY = "standard-in-memory";

    @Resource
    private LoadInputRecordsWorkflow loadInputRecordsWorkflow;
    @Resource
    private BuildInterestGraphWorkflow buildInterestGraphWorkflow;
    @Resource
    private CreateClustersWorkflow createClustersWorkflow;
    @Resource
    private AssignClustersWorkflow assignClustersWorkflow;
    @Resource
    private SummarizeClustersWorkflow summarizeClustersWorkflow;
    @Resource
    private ExportResultsWorkflow exportResultsWorkflow;

    @Resource
    private AffinityProperties affinityProperties;

    @Resource
    public PipelineFactory<ClusterSettings> factory;

    @PostConstruct
    public void init() {

        // 1) load_input_records
        factory.register("load_input_records", (cfg, ctx) -> {
            LoadInputRecordsWorkflow.Result out = loadInputRecordsWorkflow.run(
                    ctx.require("student_data_path"),
                    ctx.require("target_pool_path"),
                    ctx.get("identifier_column"),
                    ctx.get("group_column")
            );
            ctx.put("student_records", out.getRecords());
            ctx.put("target_members", out.getMembers());
            return WorkflowFunctionOutput.builder().result("load_input_records_done").build();
        });

        // 2) build_interest_graph
        factory.register("build_interest_graph", (cfg, ctx) -> {
            BuildInterestGraphWorkflow.Result out = buildInterestGraphWorkflow.run(
                    ctx.get("student_records"),
                    ctx.get("target_members"),
                    cfg.getExcludedInterests()
            );
            ctx.put("interest_pool", out.getPool());
            ctx.put("individuals", out.getIndividuals());
            ctx.put("missing_identifiers", out.getMissingIdentifiers());
            ctx.put("interest_graph", out.getGraph());
            ctx.put("co_occurrence_matrix", out.getMatrix());
            return WorkflowFunctionOutput.builder().result("build_interest_graph_done").build();
        });

        // 3) create_clusters
        factory.register("create_clusters", (cfg, ctx) -> {
            CreateClustersOperation.Result out = createClustersWorkflow.run(ctx.get("interest_graph"), cfg);
            ctx.put("partition", out.getPartition());
            ctx.put("cluster_hierarchy", out.getHierarchy());
            return WorkflowFunctionOutput.builder().result("create_clusters_done").build();
        });

        // 4) assign_clusters
        factory.register("assign_clusters", (cfg, ctx) -> {
            AssignClustersOperation.Result out = assignClustersWorkflow.run(
                    ctx.get("individuals"),
                    ctx.get("interest_pool"),
                    ctx.get("partition")
            );
            ctx.put("assignments", out.getAssignments());
            ctx.put("unassigned_identifiers", out.getUnassignedIdentifiers());
            return WorkflowFunctionOutput.builder().result("assign_clusters_done").build();
        });

        // 5) summarize_clusters
        factory.register("summarize_clusters", (cfg, ctx) -> {
            ClusterSummary summary = summarizeClustersWorkflow.run(
                    ctx.get("assignments"),
                    ctx.get("individuals"),
                    ctx.get("partition"),
                    cfg.getTopN(),
                    cfg.getIdentifierDelimiter()
            );
            ctx.put("cluster_summary", summary);
            return WorkflowFunctionOutput.builder().result("summarize_clusters_done").build();
        });

        // 6) export_results
        factory.register("export_results", (cfg, ctx) -> {
            int written = exportResultsWorkflow.run(
                    affinityProperties.getOutput(),
                    ctx.require("interest_pool"),
                    ctx.require("co_occurrence_matrix"),
                    ctx.require("partition"),
                    ctx.require("assignments"),
                    ctx.require("cluster_summary")
            );
            return WorkflowFunctionOutput.builder().result("export_results_done:" + written).build();
        });

        factory.registerPipeline(STANDARD, List.of(
                "load_input_records",
                "build_interest_graph",
                "create_clusters",
                "assign_clusters",
                "summarize_clusters",
                "export_results"
        ));

        // 调用方直接给出记录和目标人群，不读文件也不导出
        factory.registerPipeline(STANDARD_IN_MEMORY, List.of(
                "build_interest_graph",
                "create_clusters",
                "assign_clusters",
                "summarize_clusters"
        ));
    }
}
