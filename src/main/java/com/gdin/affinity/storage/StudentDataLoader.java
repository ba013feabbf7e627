package com.gdin.affinity.storage;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.gdin.affinity.models.StudentRecord;
import com.gdin.affinity.util.IOUtil;
import com.gdin.affinity.util.IdentifierUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 读取 student_data.json：{ "email": { "interests": [...], "firstName": "...", "lastName": "..." }, ... }
 * key 统一归一化（trim + 小写），重复 key 保留第一条。
 */
@Slf4j
@Component
public class StudentDataLoader {

    private static final TypeReference<LinkedHashMap<String, StudentRecord>> RECORDS_TYPE = new TypeReference<>() {};

    public Map<String, StudentRecord> load(String path) {
        if (StrUtil.isBlank(path)) throw new IllegalArgumentException("studentDataPath 不能为空");
        File file = IOUtil.resolveFile(path);
        if (!file.isFile()) throw new IllegalArgumentException("找不到个体记录文件: " + file.getAbsolutePath());

        try (InputStream is = FileUtil.getInputStream(file)) {
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("读取个体记录失败: " + path, e);
        }
    }

    public Map<String, StudentRecord> load(InputStream is) throws IOException {
        Map<String, StudentRecord> raw = IOUtil.jsonDeserialize(is, RECORDS_TYPE);
        if (raw == null) return Collections.emptyMap();

        Map<String, StudentRecord> records = new LinkedHashMap<>();
        raw.forEach((key, record) -> {
            String id = IdentifierUtil.normalize(key);
            if (id == null || record == null) return;
            if (records.putIfAbsent(id, record) != null) {
                log.warn("个体记录 key 归一化后重复，保留第一条: {}", id);
            }
        });
        log.info("个体记录加载完成：records={}", records.size());
        return records;
    }
}
