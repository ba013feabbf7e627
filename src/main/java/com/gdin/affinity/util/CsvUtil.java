package com.gdin.affinity.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class CsvUtil {
    private CsvUtil() {}

    /**
     * RFC 4180 风格输出：含分隔符 / 双引号 / 换行的字段用双引号包裹，内部双引号写成两个。
     *
     * @param rows 行数据
     * @param delimiter 分隔符
     * @param headers 指定列顺序；为 null 时沿用第一行 key 顺序
     */
    public static String toCsv(List<Map<String, Object>> rows, String delimiter, List<String> headers) {
        if (rows == null || rows.isEmpty()) {
            return headers == null || headers.isEmpty() ? "" : joinHeader(headers, delimiter) + "\n";
        }

        List<String> cols = (headers != null && !headers.isEmpty())
                ? new ArrayList<>(headers)
                : new ArrayList<>(rows.get(0).keySet());

        List<String> lines = new ArrayList<>();
        lines.add(joinHeader(cols, delimiter));

        for (Map<String, Object> row : rows) {
            List<String> vals = cols.stream()
                    .map(h -> escapeField(valToString(row.get(h)), delimiter))
                    .collect(Collectors.toList());
            lines.add(String.join(delimiter, vals));
        }
        return String.join("\n", lines) + "\n";
    }

    private static String joinHeader(List<String> cols, String delimiter) {
        return cols.stream().map(c -> escapeField(c, delimiter)).collect(Collectors.joining(delimiter));
    }

    private static String valToString(Object v) {
        return v == null ? "" : String.valueOf(v);
    }

    private static String escapeField(String s, String delimiter) {
        if (s == null) return "";
        boolean needQuote = s.contains(delimiter) || s.contains("\"") || s.contains("\n") || s.contains("\r");
        if (!needQuote) return s;
        return '"' + s.replace("\"", "\"\"") + '"';
    }
}
