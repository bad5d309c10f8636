package com.example.excelgroup.service;

import java.util.List;

public record GroupingOutcome(
        LoadedTable source,
        GroupingConfig config,
        GroupedTable table,
        List<MergeRange> mergeRanges,
        JsonExport jsonExport
) {
    public GroupingOutcome {
        mergeRanges = List.copyOf(mergeRanges);
    }
}
