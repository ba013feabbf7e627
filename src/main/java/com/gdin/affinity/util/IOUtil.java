package com.gdin.affinity.util;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class IOUtil {
    public static final String CLASSPATH_PREFIX = "classpath:";
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static ObjectMapper mapper() {
        return simpleMapper;
    }

    public static String jsonSerialize(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) return null;
        return pretty ? simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj) : simpleMapper.writeValueAsString(obj);
    }

    public static <T> T jsonDeserialize(InputStream is, TypeReference<T> type) throws IOException {
        return simpleMapper.readValue(is, type);
    }

    /**
     * "classpath:" 前缀按类路径解析，其余按工作目录解析
     */
    public static File resolveFile(String path) {
        if (StrUtil.startWith(path, CLASSPATH_PREFIX)) {
            return FileUtil.file(path);
        }
        return new File(path);
    }
}
