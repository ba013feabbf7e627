package com.gdin.affinity.index.operation;

import com.gdin.affinity.models.CoOccurrenceMatrix;
import com.gdin.affinity.models.Individual;
import com.gdin.affinity.models.InterestEdge;
import com.gdin.affinity.models.InterestGraph;
import com.gdin.affinity.models.InterestPool;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 构建兴趣共现图和共现矩阵：
 * <ol>
 *   <li>每个个体只取池内兴趣（去重）；</li>
 *   <li>对其中每个无序对 (a, b)，a != b，矩阵 [a][b] 与 [b][a] 各加 1；</li>
 *   <li>矩阵上三角中大于 0 的格子即为图的边，权重相同。</li>
 * </ol>
 * 池内兴趣少于两个的个体不贡献边；池中每个标签都是图节点，哪怕是孤立点。
 */
@Slf4j
@Component
public class BuildInterestGraphOperation {

    public Result buildGraph(List<Individual> individuals, InterestPool pool) {
        if (pool == null) throw new IllegalArgumentException("pool 不能为 null");

        List<String> nodes = pool.getTags();
        int n = nodes.size();
        int[][] counts = new int[n][n];

        long pairs = 0;
        if (individuals != null) {
            for (Individual individual : individuals) {
                List<String> interests = pool.restrict(individual.getInterests());
                for (int i = 0; i < interests.size(); i++) {
                    int a = pool.indexOf(interests.get(i));
                    for (int j = i + 1; j < interests.size(); j++) {
                        int b = pool.indexOf(interests.get(j));
                        counts[a][b]++;
                        counts[b][a]++;
                        pairs++;
                    }
                }
            }
        }

        List<InterestEdge> edges = new ArrayList<>();
        for (int a = 0; a < n; a++) {
            for (int b = a + 1; b < n; b++) {
                if (counts[a][b] == 0) continue;
                edges.add(InterestEdge.builder()
                        .source(nodes.get(a))
                        .target(nodes.get(b))
                        .weight(counts[a][b])
                        .build());
            }
        }

        InterestGraph graph = new InterestGraph(nodes, edges);
        CoOccurrenceMatrix matrix = new CoOccurrenceMatrix(nodes, counts);

        log.info("兴趣共现图构建完成：nodes={}, edges={}, totalWeight={}", n, edges.size(), pairs);
        return new Result(graph, matrix);
    }

    @Value
    public static class Result {
        InterestGraph graph;
        CoOccurrenceMatrix matrix;
    }
}
