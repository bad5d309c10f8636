package com.example.excelgroup.service;

import java.util.List;

public record GroupResult(
        List<String> keyColumns,
        List<String> detailColumns,
        int groupCount,
        int rowCount,
        int mergeRangeCount,
        List<String> keyCollisions,
        List<GroupPreview> previewGroups
) {
}
