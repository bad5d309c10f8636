package com.example.excelgroup.service;

import java.util.List;

public record GroupPreview(
        String key,
        List<String> keyValues,
        int rowCount
) {
}
