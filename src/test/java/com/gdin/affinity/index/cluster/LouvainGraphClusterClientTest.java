package com.gdin.affinity.index.cluster;

import com.gdin.affinity.GraphFixtures;
import com.gdin.affinity.models.InterestGraph;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class LouvainGraphClusterClientTest {

    private final LouvainGraphClusterClient client = new LouvainGraphClusterClient();

    /** 最高层展开成 标签 -> 聚类编号 */
    private static Map<String, Integer> topLevel(List<LouvainCluster> clusters) {
        int top = clusters.stream().mapToInt(LouvainCluster::getLevel).max().orElse(0);
        Map<String, Integer> result = new HashMap<>();
        for (LouvainCluster c : clusters) {
            if (c.getLevel() != top) continue;
            for (String title : c.getNodeTitles()) {
                assertNull(result.put(title, c.getClusterId()), "节点重复出现: " + title);
            }
        }
        return result;
    }

    @Test
    public void testAbcMergesAllAtDefaultResolution() {
        Map<String, Integer> p = topLevel(client.clusterGraph(GraphFixtures.abcGraph(), 1.0, 32, 100, null));
        assertEquals(Map.of("A", 0, "B", 0, "C", 0), p);
    }

    @Test
    public void testAbcHigherResolutionSplitsOffC() {
        Map<String, Integer> p = topLevel(client.clusterGraph(GraphFixtures.abcGraph(), 1.5, 32, 100, null));
        assertEquals(Map.of("A", 0, "B", 0, "C", 1), p);
    }

    @Test
    public void testAbcVeryHighResolutionKeepsSingletons() {
        Map<String, Integer> p = topLevel(client.clusterGraph(GraphFixtures.abcGraph(), 2.0, 32, 100, null));
        assertEquals(Map.of("A", 0, "B", 1, "C", 2), p);
    }

    @Test
    public void testTwoTriangles() {
        List<LouvainCluster> clusters = client.clusterGraph(GraphFixtures.twoTriangles(), 1.0, 32, 100, null);
        log.info("clusters: {}", clusters);
        Map<String, Integer> p = topLevel(clusters);

        assertEquals(Map.of("a1", 0, "a2", 0, "a3", 0, "b1", 1, "b2", 1, "b3", 1), p);
        clusters.stream()
                .filter(c -> c.getLevel() == clusters.stream().mapToInt(LouvainCluster::getLevel).max().orElse(0))
                .forEach(c -> assertEquals(-1, c.getParentClusterId()));
    }

    @Test
    public void testDeterministicWithoutSeed() {
        InterestGraph g = GraphFixtures.twoTriangles();
        assertEquals(
                client.clusterGraph(g, 1.0, 32, 100, null),
                client.clusterGraph(g, 1.0, 32, 100, null)
        );
    }

    @Test
    public void testSeedGivesReproducibleResult() {
        InterestGraph g = GraphFixtures.twoTriangles();
        List<LouvainCluster> first = client.clusterGraph(g, 1.0, 32, 100, 7);
        List<LouvainCluster> second = client.clusterGraph(g, 1.0, 32, 100, 7);
        assertEquals(first, second);
        assertEquals(new HashSet<>(GraphFixtures.TRIANGLE_NODES), topLevel(first).keySet());
    }

    @Test
    public void testEmptyGraphHasNoClusters() {
        InterestGraph g = new InterestGraph(List.of(), List.of());
        assertTrue(client.clusterGraph(g, 1.0, 32, 100, null).isEmpty());
    }

    @Test
    public void testNoEdgesGivesSingletons() {
        InterestGraph g = new InterestGraph(List.of("x", "y", "z"), List.of());
        Map<String, Integer> p = topLevel(client.clusterGraph(g, 1.0, 32, 100, null));
        assertEquals(Map.of("x", 0, "y", 1, "z", 2), p);
    }

    @Test
    public void testIsolatedNodeGetsOwnCluster() {
        InterestGraph g = new InterestGraph(
                List.of("A", "B", "Z"),
                List.of(GraphFixtures.edge("A", "B", 3))
        );
        Map<String, Integer> p = topLevel(client.clusterGraph(g, 1.0, 32, 100, null));

        assertEquals(p.get("A"), p.get("B"));
        assertNotEquals(p.get("A"), p.get("Z"));
        Set<Integer> ids = new HashSet<>(p.values());
        assertEquals(Set.of(0, 1), ids);
    }

    @Test
    public void testRenumberByFirstAppearance() {
        assertArrayEquals(new int[]{0, 1, 0, 2}, LouvainGraphClusterClient.renumber(new int[]{5, 3, 5, 9}));
    }
}
