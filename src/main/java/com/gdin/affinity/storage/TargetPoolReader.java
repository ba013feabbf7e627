package com.gdin.affinity.storage;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.text.csv.CsvData;
import cn.hutool.core.text.csv.CsvReadConfig;
import cn.hutool.core.text.csv.CsvReader;
import cn.hutool.core.text.csv.CsvRow;
import cn.hutool.core.util.StrUtil;
import com.gdin.affinity.models.TargetMember;
import com.gdin.affinity.util.IOUtil;
import com.gdin.affinity.util.IdentifierUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取目标人群 CSV（带表头），输出有序的 (identifier, group) 列表。
 * identifier 归一化，空白行跳过。
 */
@Slf4j
@Component
public class TargetPoolReader {

    public List<TargetMember> read(String path, String identifierColumn, String groupColumn) {
        if (StrUtil.isBlank(path)) throw new IllegalArgumentException("targetPoolPath 不能为空");
        File file = IOUtil.resolveFile(path);
        if (!file.isFile()) throw new IllegalArgumentException("找不到目标人群文件: " + file.getAbsolutePath());
        return readFromString(FileUtil.readUtf8String(file), identifierColumn, groupColumn);
    }

    public List<TargetMember> readFromString(String csv, String identifierColumn, String groupColumn) {
        if (StrUtil.isBlank(identifierColumn)) throw new IllegalArgumentException("identifierColumn 不能为空");
        if (StrUtil.isBlank(groupColumn)) throw new IllegalArgumentException("groupColumn 不能为空");
        if (StrUtil.isBlank(csv)) return List.of();

        // Excel 导出的 CSV 常带 BOM
        String content = StrUtil.removePrefix(csv, "\uFEFF");

        CsvReadConfig config = CsvReadConfig.defaultConfig();
        config.setContainsHeader(true);
        config.setTrimField(true);
        config.setSkipEmptyRows(true);
        CsvData data = new CsvReader(config).readFromStr(content);

        List<String> header = data.getHeader();
        if (header == null || !header.contains(identifierColumn) || !header.contains(groupColumn)) {
            throw new IllegalStateException("目标人群 CSV 缺少必需列 " + identifierColumn + " / " + groupColumn + "，实际表头: " + header);
        }

        List<TargetMember> members = new ArrayList<>();
        for (CsvRow row : data.getRows()) {
            String id = IdentifierUtil.normalize(row.getByName(identifierColumn));
            if (id == null) continue;
            members.add(TargetMember.builder()
                    .identifier(id)
                    .group(StrUtil.trim(row.getByName(groupColumn)))
                    .build());
        }
        log.info("目标人群加载完成：members={}", members.size());
        return members;
    }
}
