package com.example.excelgroup.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 一次分组运行的列角色与输出参数。
 *
 * @param keyColumns       Key 列，按组合键顺序
 * @param detailColumns    明细列，按输出顺序
 * @param dateKeywords     日期列关键词
 * @param jsonKeyDelimiter JSON 组合键连接符
 */
public record GroupingConfig(
        List<String> keyColumns,
        List<String> detailColumns,
        List<String> dateKeywords,
        String jsonKeyDelimiter
) {
    public GroupingConfig {
        keyColumns = keyColumns == null ? List.of() : List.copyOf(keyColumns);
        detailColumns = detailColumns == null ? List.of() : List.copyOf(detailColumns);
        dateKeywords = dateKeywords == null ? List.of() : List.copyOf(dateKeywords);
        jsonKeyDelimiter = jsonKeyDelimiter == null ? "" : jsonKeyDelimiter;
    }

    /**
     * 未指定明细列时，表头中除 Key 列外的列按原顺序作为明细列。
     */
    public static GroupingConfig withRemainingAsDetail(List<String> headers,
                                                       List<String> keyColumns,
                                                       List<String> dateKeywords,
                                                       String jsonKeyDelimiter) {
        Set<String> keys = keyColumns == null ? Set.of() : new LinkedHashSet<>(keyColumns);
        List<String> details = new ArrayList<>();
        for (String header : headers) {
            if (!keys.contains(header)) {
                details.add(header);
            }
        }
        return new GroupingConfig(keyColumns, details, dateKeywords, jsonKeyDelimiter);
    }

    /**
     * 对照实际表头校验：Key 列非空，所有列必须存在，Key/明细不重叠且覆盖全部列。
     *
     * @throws GroupingConfigException 校验不通过
     */
    public void validateAgainst(List<String> headers) {
        if (keyColumns.isEmpty()) {
            throw new GroupingConfigException("请至少选择一列作为合并依据（Key）。");
        }
        Set<String> available = new LinkedHashSet<>(headers);
        Set<String> seen = new LinkedHashSet<>();
        for (String column : keyColumns) {
            if (!available.contains(column)) {
                throw new GroupingConfigException("Key 列不存在：" + column);
            }
            if (!seen.add(column)) {
                throw new GroupingConfigException("Key 列重复：" + column);
            }
        }
        for (String column : detailColumns) {
            if (!available.contains(column)) {
                throw new GroupingConfigException("明细列不存在：" + column);
            }
            if (!seen.add(column)) {
                throw new GroupingConfigException("列同时出现在 Key 与明细中或重复：" + column);
            }
        }
        if (seen.size() != available.size()) {
            List<String> unassigned = available.stream().filter(h -> !seen.contains(h)).toList();
            throw new GroupingConfigException("以下列未指定为 Key 或明细：" + unassigned);
        }
    }

    public boolean isDateColumn(String header) {
        if (header == null) {
            return false;
        }
        for (String keyword : dateKeywords) {
            if (!keyword.isEmpty() && header.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
