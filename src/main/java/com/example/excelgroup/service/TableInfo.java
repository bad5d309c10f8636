package com.example.excelgroup.service;

import java.util.List;

public record TableInfo(
        String fileName,
        String sheetName,
        List<String> headers,
        List<String> suggestedKeyColumns,
        List<List<String>> previewRows,
        int totalRows
) {
}
