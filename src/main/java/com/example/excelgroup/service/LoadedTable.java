package com.example.excelgroup.service;

import java.util.List;
import java.util.Map;

public record LoadedTable(
        String fileName,
        String sheetName,
        int headerRow,                  // 表头行，1 开始
        List<String> headers,
        List<Map<String, String>> rows
) {
    public LoadedTable {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }
}
