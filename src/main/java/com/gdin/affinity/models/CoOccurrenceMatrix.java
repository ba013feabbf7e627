package com.gdin.affinity.models;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * |pool| x |pool| 对称整数矩阵，对角线为 0，行列顺序同兴趣池。
 */
public final class CoOccurrenceMatrix {

    @Getter
    private final List<String> labels;

    private final int[][] counts;

    private final Map<String, Integer> indexByLabel = new LinkedHashMap<>();

    public CoOccurrenceMatrix(List<String> labels, int[][] counts) {
        if (counts.length != labels.size()) {
            throw new IllegalArgumentException("矩阵维度与标签数量不一致: " + counts.length + " vs " + labels.size());
        }
        this.labels = List.copyOf(labels);
        this.counts = new int[counts.length][];
        for (int i = 0; i < counts.length; i++) {
            if (counts[i].length != labels.size()) {
                throw new IllegalArgumentException("矩阵第 " + i + " 行长度不正确: " + counts[i].length);
            }
            this.counts[i] = counts[i].clone();
            indexByLabel.put(this.labels.get(i), i);
        }
    }

    public int size() {
        return labels.size();
    }

    public int get(int row, int column) {
        return counts[row][column];
    }

    /** 任一标签不在矩阵中时返回 0 */
    public int get(String a, String b) {
        Integer i = indexByLabel.get(a);
        Integer j = indexByLabel.get(b);
        if (i == null || j == null) return 0;
        return counts[i][j];
    }

    /**
     * 转成表格行，第一列 "interest" 为行标签，其余列按兴趣池顺序。
     */
    public List<Map<String, Object>> toRows() {
        List<Map<String, Object>> rows = new ArrayList<>(labels.size());
        for (int i = 0; i < labels.size(); i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("interest", labels.get(i));
            for (int j = 0; j < labels.size(); j++) {
                row.put(labels.get(j), counts[i][j]);
            }
            rows.add(row);
        }
        return rows;
    }
}
