package com.gdin.affinity.storage;

import cn.hutool.core.io.FileUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.affinity.models.ClusterAssignment;
import com.gdin.affinity.models.ClusterSummary;
import com.gdin.affinity.models.CoOccurrenceMatrix;
import com.gdin.affinity.models.InterestPool;
import com.gdin.affinity.models.Partition;
import com.gdin.affinity.util.CsvUtil;
import com.gdin.affinity.util.IOUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 结果导出：分配表 CSV、共现矩阵 CSV、汇总 JSON。
 */
@Slf4j
@Component
public class AffinityResultExporter {

    public static final List<String> ASSIGNMENT_HEADERS = List.of(
            "email", "firstName", "lastName", "track", "cluster", "matched_interests"
    );
    public static final String MATCHED_INTEREST_DELIMITER = "; ";

    public String assignmentsToCsv(List<ClusterAssignment> assignments) {
        List<Map<String, Object>> rows = new ArrayList<>(assignments.size());
        for (ClusterAssignment a : assignments) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("email", a.getIdentifier());
            row.put("firstName", a.getFirstName());
            row.put("lastName", a.getLastName());
            row.put("track", a.getGroup());
            row.put("cluster", a.getClusterId());
            row.put("matched_interests", String.join(MATCHED_INTEREST_DELIMITER, a.getMatchedInterests()));
            rows.add(row);
        }
        return CsvUtil.toCsv(rows, ",", ASSIGNMENT_HEADERS);
    }

    public String matrixToCsv(CoOccurrenceMatrix matrix) {
        List<String> headers = new ArrayList<>();
        headers.add("interest");
        headers.addAll(matrix.getLabels());
        return CsvUtil.toCsv(matrix.toRows(), ",", headers);
    }

    public String summaryToJson(InterestPool pool, Partition partition, ClusterSummary summary) throws JsonProcessingException {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("pool", pool.getTags());
        doc.put("excluded", pool.getExcluded());
        doc.put("partition", partition);
        doc.put("summary", summary);
        return IOUtil.jsonSerialize(doc, true);
    }

    public File writeAssignments(String path, List<ClusterAssignment> assignments) {
        File file = FileUtil.writeUtf8String(assignmentsToCsv(assignments), IOUtil.resolveFile(path));
        log.info("分配结果已导出：path={}, rows={}", file.getAbsolutePath(), assignments.size());
        return file;
    }

    public File writeMatrix(String path, CoOccurrenceMatrix matrix) {
        File file = FileUtil.writeUtf8String(matrixToCsv(matrix), IOUtil.resolveFile(path));
        log.info("共现矩阵已导出：path={}, size={}", file.getAbsolutePath(), matrix.size());
        return file;
    }

    public File writeSummary(String path, InterestPool pool, Partition partition, ClusterSummary summary) throws JsonProcessingException {
        File file = FileUtil.writeUtf8String(summaryToJson(pool, partition, summary), IOUtil.resolveFile(path));
        log.info("聚类汇总已导出：path={}", file.getAbsolutePath());
        return file;
    }
}
