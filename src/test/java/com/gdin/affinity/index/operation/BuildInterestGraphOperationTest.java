package com.gdin.affinity.index.operation;

import com.gdin.affinity.models.CoOccurrenceMatrix;
import com.gdin.affinity.models.Individual;
import com.gdin.affinity.models.InterestGraph;
import com.gdin.affinity.models.InterestPool;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.gdin.affinity.GraphFixtures.individual;
import static org.junit.jupiter.api.Assertions.*;

public class BuildInterestGraphOperationTest {

    private final BuildInterestGraphOperation operation = new BuildInterestGraphOperation();

    private static InterestPool poolOf(List<Individual> individuals, Set<String> excluded) {
        return new InterestPool(
                individuals.stream().flatMap(i -> i.getInterests().stream()).collect(Collectors.toList()),
                excluded
        );
    }

    @Test
    public void testAbcExample() {
        List<Individual> individuals = List.of(
                individual("i1", "T", "A", "B"),
                individual("i2", "T", "A", "B", "C"),
                individual("i3", "T", "C")
        );
        BuildInterestGraphOperation.Result result = operation.buildGraph(individuals, poolOf(individuals, Set.of()));
        InterestGraph g = result.getGraph();

        assertEquals(List.of("A", "B", "C"), g.getNodes());
        assertEquals(2, g.weight("A", "B"));
        assertEquals(1, g.weight("A", "C"));
        assertEquals(1, g.weight("B", "C"));
        assertEquals(3, g.getEdges().size());
    }

    @Test
    public void testMatrixIsSymmetricWithZeroDiagonal() {
        List<Individual> individuals = List.of(
                individual("i1", "T", "Art", "Cooking", "Hiking"),
                individual("i2", "T", "Hiking", "Art"),
                individual("i3", "T", "Running")
        );
        CoOccurrenceMatrix m = operation.buildGraph(individuals, poolOf(individuals, Set.of())).getMatrix();

        for (int i = 0; i < m.size(); i++) {
            assertEquals(0, m.get(i, i));
            for (int j = 0; j < m.size(); j++) {
                assertEquals(m.get(i, j), m.get(j, i));
            }
        }
        assertEquals(2, m.get("Art", "Hiking"));
        assertEquals(0, m.get("Art", "Running"));
        assertEquals(0, m.get("Art", "Unknown"));
    }

    @Test
    public void testTotalWeightEqualsSumOfPairsPerIndividual() {
        List<Individual> individuals = List.of(
                individual("i1", "T", "a", "b", "c", "d"),
                individual("i2", "T", "a", "b"),
                individual("i3", "T", "c"),
                individual("i4", "T", "b", "c", "d")
        );
        InterestGraph g = operation.buildGraph(individuals, poolOf(individuals, Set.of())).getGraph();
        // C(4,2) + C(2,2) + 0 + C(3,2)
        assertEquals(6 + 1 + 0 + 3, g.totalWeight());
    }

    @Test
    public void testIsolatedInterestIsStillANode() {
        List<Individual> individuals = List.of(
                individual("i1", "T", "Art", "Cooking"),
                individual("i2", "T", "Zumba")
        );
        InterestGraph g = operation.buildGraph(individuals, poolOf(individuals, Set.of())).getGraph();

        assertEquals(3, g.nodeCount());
        assertTrue(g.getNodes().contains("Zumba"));
        assertEquals(0, g.degree("Zumba"));
    }

    @Test
    public void testExcludedInterestsContributeNothing() {
        List<Individual> individuals = List.of(
                individual("i1", "T", "AI & machine learning", "Cooking"),
                individual("i2", "T", "AI & machine learning", "Cooking", "Art")
        );
        InterestPool pool = poolOf(individuals, Set.of("AI & machine learning"));
        InterestGraph g = operation.buildGraph(individuals, pool).getGraph();

        assertEquals(List.of("Art", "Cooking"), g.getNodes());
        assertEquals(-1, g.indexOf("AI & machine learning"));
        assertEquals(1, g.totalWeight());
    }

    @Test
    public void testEmptyPoolGivesEmptyGraph() {
        InterestGraph g = operation.buildGraph(List.of(individual("i1", "T", "x")), InterestPool.empty()).getGraph();
        assertTrue(g.isEmpty());
        assertTrue(g.getEdges().isEmpty());
    }
}
