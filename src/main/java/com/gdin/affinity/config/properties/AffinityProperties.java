package com.gdin.affinity.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "gdin.affinity")
@Component
public class AffinityProperties implements Serializable {
    // 不参与兴趣池的分类（含义模糊或与分组无关）
    private List<String> excludedInterests = new ArrayList<>(List.of(
            "AI & machine learning",
            "something not listed",
            "still figuring it out"
    ));

    // 启动时直接跑一遍文件流水线
    private Boolean runOnStartup = false;

    private Input input = new Input();
    private Cluster cluster = new Cluster();
    private Summary summary = new Summary();
    private Output output = new Output();

    @Data
    public static class Input implements Serializable {
        // identifier -> {interests, firstName, lastName} 的 JSON 文件
        private String studentDataPath;
        // 目标人群 CSV（带表头）
        private String targetPoolPath;
        private String identifierColumn = "Email";
        private String groupColumn = "Track";
    }

    @Data
    public static class Cluster implements Serializable {
        // 模块度分辨率 γ
        private Double resolution = 1.0;
        // 为空时按兴趣排序顺序访问节点
        private Integer seed;
        // 聚合轮数上限
        private Integer maxLevels = 32;
        // 每层 local moving 的遍历轮数上限
        private Integer maxPasses = 100;
    }

    @Data
    public static class Summary implements Serializable {
        private Integer topN = 5;
        private String identifierDelimiter = ", ";
    }

    @Data
    public static class Output implements Serializable {
        // 为空则不导出
        private String assignmentsPath;
        private String matrixPath;
        private String summaryPath;
    }
}
