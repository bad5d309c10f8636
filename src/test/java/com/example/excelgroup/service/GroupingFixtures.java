package com.example.excelgroup.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class GroupingFixtures {

    static final List<String> HEADERS = List.of("单号", "日期", "金额");

    private GroupingFixtures() {
    }

    static Map<String, String> row(List<String> headers, String... values) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            row.put(headers.get(i), values[i]);
        }
        return Collections.unmodifiableMap(row);
    }

    static List<Map<String, String>> rows(String[]... values) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (String[] row : values) {
            rows.add(row(HEADERS, row));
        }
        return rows;
    }

    static GroupingConfig config() {
        return new GroupingConfig(List.of("单号", "日期"), List.of("金额"),
                List.of("日期", "时间", "Date", "Time"), "_");
    }
}
