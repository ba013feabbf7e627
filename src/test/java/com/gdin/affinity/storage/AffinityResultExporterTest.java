package com.gdin.affinity.storage;

import cn.hutool.core.io.FileUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.gdin.affinity.models.ClusterAssignment;
import com.gdin.affinity.models.ClusterSummary;
import com.gdin.affinity.models.CoOccurrenceMatrix;
import com.gdin.affinity.models.InterestCount;
import com.gdin.affinity.models.InterestPool;
import com.gdin.affinity.models.Partition;
import com.gdin.affinity.util.IOUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

public class AffinityResultExporterTest {

    private final AffinityResultExporter exporter = new AffinityResultExporter();

    private static ClusterAssignment assignment() {
        return ClusterAssignment.builder()
                .identifier("alice@uni.edu")
                .firstName("Alice")
                .lastName("Li")
                .group("Design")
                .clusterId(0)
                .matchedInterests(List.of("Art", "Cooking"))
                .build();
    }

    @Test
    public void testAssignmentsCsv() {
        String csv = exporter.assignmentsToCsv(List.of(assignment()));
        assertEquals(
                "email,firstName,lastName,track,cluster,matched_interests\n"
                        + "alice@uni.edu,Alice,Li,Design,0,Art; Cooking\n",
                csv
        );
    }

    @Test
    public void testMatrixCsv() {
        CoOccurrenceMatrix matrix = new CoOccurrenceMatrix(List.of("A", "B"), new int[][]{{0, 2}, {2, 0}});
        assertEquals("interest,A,B\nA,0,2\nB,2,0\n", exporter.matrixToCsv(matrix));
    }

    @Test
    public void testSummaryJson() throws Exception {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("Art", 0);
        map.put("Cooking", 0);
        Partition partition = new Partition(map, 0.25, 1);
        InterestPool pool = new InterestPool(map.keySet(), Set.of("still figuring it out"));
        TreeMap<Integer, List<InterestCount>> top = new TreeMap<>();
        top.put(0, List.of(new InterestCount("Art", 1)));
        ClusterSummary summary = ClusterSummary.builder().groupClusters(List.of()).topInterests(top).build();

        JsonNode doc = IOUtil.mapper().readTree(exporter.summaryToJson(pool, partition, summary));

        assertEquals("Art", doc.get("pool").get(0).asText());
        assertEquals(0, doc.get("partition").get("assignments").get("Cooking").asInt());
        assertEquals(0.25, doc.get("partition").get("modularity").asDouble(), 1e-12);
        assertEquals(2, doc.get("partition").get("clusters").get("0").size());
        assertEquals(1, doc.get("summary").get("top_interests").get("0").get(0).get("count").asInt());
    }

    @Test
    public void testWriteAssignmentsCreatesFile(@TempDir Path dir) {
        String path = dir.resolve("out/assignments.csv").toString();
        File file = exporter.writeAssignments(path, List.of(assignment()));

        assertTrue(file.isFile());
        assertTrue(FileUtil.readUtf8String(file).startsWith("email,"));
    }
}
