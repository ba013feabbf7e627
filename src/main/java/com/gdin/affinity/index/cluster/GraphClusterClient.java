package com.gdin.affinity.index.cluster;

import com.gdin.affinity.models.InterestGraph;

import java.util.List;

/**
 * 图聚类接口：输入只读的兴趣共现图，输出每一层的聚类（含父子关系）。
 * 空图返回空列表；结果必须可复现（同样的图、分辨率和种子得到同样的输出）。
 */
public interface GraphClusterClient {

    List<LouvainCluster> clusterGraph(
            InterestGraph graph,
            double resolution,
            int maxLevels,
            int maxPasses,
            Integer seed
    );
}
