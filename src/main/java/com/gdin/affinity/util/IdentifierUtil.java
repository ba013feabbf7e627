package com.gdin.affinity.util;

import cn.hutool.core.util.StrUtil;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class IdentifierUtil {
    private IdentifierUtil() {}

    /** 邮箱类主键：去首尾空白并转小写；空白返回 null */
    public static String normalize(String identifier) {
        if (StrUtil.isBlank(identifier)) return null;
        return StrUtil.trim(identifier).toLowerCase(Locale.ROOT);
    }

    /**
     * 兴趣标签清洗：去空白、丢弃空串、去重并保持首次出现顺序。
     */
    public static List<String> cleanInterests(Collection<String> interests) {
        if (interests == null || interests.isEmpty()) return List.of();
        Set<String> cleaned = new LinkedHashSet<>();
        for (String interest : interests) {
            if (StrUtil.isBlank(interest)) continue;
            cleaned.add(StrUtil.trim(interest));
        }
        return List.copyOf(cleaned);
    }
}
