package com.gdin.affinity.index.cluster;

import com.gdin.affinity.GraphFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WeightedGraphTest {

    @Test
    public void testOfKeepsDegreesAndTotalWeight() {
        WeightedGraph g = WeightedGraph.of(GraphFixtures.abcGraph());

        assertEquals(3, g.nodeCount());
        assertEquals(4.0, g.totalWeight(), 1e-12);
        assertEquals(3.0, g.degree(0), 1e-12);
        assertEquals(3.0, g.degree(1), 1e-12);
        assertEquals(2.0, g.degree(2), 1e-12);
        assertArrayEquals(new int[]{1, 2}, g.neighbors(0));
    }

    @Test
    public void testAggregateTurnsInternalWeightIntoSelfLoops() {
        WeightedGraph g = WeightedGraph.of(GraphFixtures.twoTriangles());
        WeightedGraph agg = g.aggregate(new int[]{0, 0, 0, 1, 1, 1}, 2);

        assertEquals(2, agg.nodeCount());
        assertEquals(3.0, agg.selfLoop(0), 1e-12);
        assertEquals(3.0, agg.selfLoop(1), 1e-12);
        assertArrayEquals(new int[]{1}, agg.neighbors(0));
        assertEquals(1.0, agg.neighborWeights(0)[0], 1e-12);
        // 自环在度里算两次
        assertEquals(7.0, agg.degree(0), 1e-12);
        assertEquals(g.totalWeight(), agg.totalWeight(), 1e-12);
    }

    @Test
    public void testBuilderMergesParallelEdges() {
        WeightedGraph g = WeightedGraph.builder(2)
                .addEdge(0, 1, 1.5)
                .addEdge(1, 0, 0.5)
                .addEdge(0, 0, 0)
                .build();

        assertEquals(2.0, g.neighborWeights(0)[0], 1e-12);
        assertEquals(0.0, g.selfLoop(0), 1e-12);
        assertEquals(2.0, g.totalWeight(), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> WeightedGraph.builder(2).addEdge(0, 1, -1));
    }

    @Test
    public void testAggregateRejectsWrongLength() {
        WeightedGraph g = WeightedGraph.of(GraphFixtures.abcGraph());
        assertThrows(IllegalArgumentException.class, () -> g.aggregate(new int[]{0, 0}, 1));
    }
}
