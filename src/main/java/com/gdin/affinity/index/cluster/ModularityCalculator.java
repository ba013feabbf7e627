package com.gdin.affinity.index.cluster;

/**
 * Q = (1/2m) Σ_ij [A_ij - γ k_i k_j / 2m] δ(c_i, c_j)
 * <p>
 * 按聚类汇总计算：Q = Σ_c [ in_c / 2m - γ (tot_c / 2m)^2 ]，
 * in_c 为聚类内部边权的两倍（含自环），tot_c 为聚类内节点加权度之和。
 */
public final class ModularityCalculator {
    private ModularityCalculator() {}

    /**
     * @param community 节点 -> 聚类编号，编号需落在 [0, nodeCount) 内
     */
    public static double modularity(WeightedGraph graph, int[] community, double resolution) {
        int n = graph.nodeCount();
        if (community.length != n) {
            throw new IllegalArgumentException("community 长度与节点数不一致: " + community.length + " vs " + n);
        }
        double m2 = 2 * graph.totalWeight();
        if (m2 == 0) return 0.0;

        double[] in = new double[n];
        double[] tot = new double[n];
        for (int i = 0; i < n; i++) {
            int c = community[i];
            tot[c] += graph.degree(i);
            in[c] += 2 * graph.selfLoop(i);
            int[] ns = graph.neighbors(i);
            double[] ws = graph.neighborWeights(i);
            for (int p = 0; p < ns.length; p++) {
                if (community[ns[p]] == c) in[c] += ws[p];
            }
        }

        double q = 0.0;
        for (int c = 0; c < n; c++) {
            if (tot[c] == 0 && in[c] == 0) continue;
            q += in[c] / m2 - resolution * (tot[c] / m2) * (tot[c] / m2);
        }
        return q;
    }
}
