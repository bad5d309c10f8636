package com.example.excelgroup.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次遍历分组：丢弃全空行，按 Key 列取值构造组合键。
 * 组的顺序由组合键第一次出现的位置决定，组内保持源表顺序。
 */
@Slf4j
@Component
public class RowGrouper {

    public GroupedTable group(List<Map<String, String>> rows, GroupingConfig config) {
        Map<CompositeKey, List<Map<String, String>>> groups = new LinkedHashMap<>();
        int dropped = 0;
        for (Map<String, String> row : rows) {
            if (isEmptyRow(row)) {
                dropped++;
                continue;
            }
            CompositeKey key = keyOf(row, config.keyColumns());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        List<RowGroup> result = new ArrayList<>(groups.size());
        for (Map.Entry<CompositeKey, List<Map<String, String>>> entry : groups.entrySet()) {
            result.add(new RowGroup(entry.getKey(), entry.getValue()));
        }
        if (dropped > 0) {
            log.debug("跳过空行 {} 行", dropped);
        }
        return new GroupedTable(config.keyColumns(), config.detailColumns(), result);
    }

    CompositeKey keyOf(Map<String, String> row, List<String> keyColumns) {
        List<String> values = new ArrayList<>(keyColumns.size());
        for (String column : keyColumns) {
            String value = row.get(column);
            values.add(value == null ? "" : value);
        }
        return new CompositeKey(values);
    }

    boolean isEmptyRow(Map<String, String> row) {
        for (String value : row.values()) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
