package com.example.excelgroup.service;

import java.util.List;

public record GroupedTable(
        List<String> keyColumns,
        List<String> detailColumns,
        List<RowGroup> groups
) {
    public GroupedTable {
        keyColumns = List.copyOf(keyColumns);
        detailColumns = List.copyOf(detailColumns);
        groups = List.copyOf(groups);
    }

    public int rowCount() {
        int count = 0;
        for (RowGroup group : groups) {
            count += group.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
