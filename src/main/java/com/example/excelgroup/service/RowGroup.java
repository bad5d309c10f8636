package com.example.excelgroup.service;

import java.util.List;
import java.util.Map;

public record RowGroup(CompositeKey key, List<Map<String, String>> rows) {

    public RowGroup {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("分组不能为空：" + key);
        }
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
