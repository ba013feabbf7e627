package com.gdin.affinity.index.cluster;

import com.gdin.affinity.GraphFixtures;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class LocalMovingPhaseTest {

    private static int[] identity(int n) {
        int[] order = new int[n];
        for (int i = 0; i < n; i++) order[i] = i;
        return order;
    }

    @Test
    public void testModularityNeverDecreasesBetweenPasses() {
        WeightedGraph g = WeightedGraph.of(GraphFixtures.twoTriangles());
        LocalMovingPhase phase = new LocalMovingPhase(g, 1.0, identity(6), 100);
        phase.run();

        List<Double> history = phase.getModularityHistory();
        log.info("modularity history: {}", history);
        assertTrue(history.size() >= 2);
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i) >= history.get(i - 1) - 1e-12, "pass " + i + " 模块度下降: " + history);
        }
        assertFalse(phase.isPassCapReached());
    }

    @Test
    public void testSplitsTrianglesAtBridge() {
        WeightedGraph g = WeightedGraph.of(GraphFixtures.twoTriangles());
        int[] community = new LocalMovingPhase(g, 1.0, identity(6), 100).run();

        assertEquals(community[0], community[1]);
        assertEquals(community[0], community[2]);
        assertEquals(community[3], community[4]);
        assertEquals(community[3], community[5]);
        assertNotEquals(community[0], community[3]);
    }

    @Test
    public void testPassCapStopsIteration() {
        WeightedGraph g = WeightedGraph.of(GraphFixtures.twoTriangles());
        LocalMovingPhase phase = new LocalMovingPhase(g, 1.0, identity(6), 1);
        phase.run();

        assertEquals(1, phase.getPasses());
        assertTrue(phase.isPassCapReached());
        assertTrue(phase.getTotalMoves() > 0);
    }

    @Test
    public void testZeroWeightGraphStaysSingletons() {
        WeightedGraph g = WeightedGraph.builder(3).build();
        LocalMovingPhase phase = new LocalMovingPhase(g, 1.0, identity(3), 10);

        assertArrayEquals(new int[]{0, 1, 2}, phase.run());
        assertEquals(0, phase.getPasses());
    }

    @Test
    public void testOrderMustMatchNodeCount() {
        WeightedGraph g = WeightedGraph.of(GraphFixtures.abcGraph());
        assertThrows(IllegalArgumentException.class, () -> new LocalMovingPhase(g, 1.0, new int[]{0, 1}, 10));
    }
}
