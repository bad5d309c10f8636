package com.example.excelgroup.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RowNormalizerTest {

    private static final List<String> HEADERS = List.of("运单号码", "清美出库日期", "费用(元)");

    private final RowNormalizer normalizer = new RowNormalizer(new CellNormalizer(), new DateNormalizer());

    @Test
    public void testNormalizesCellsAndDateColumns() {
        GroupingConfig config = GroupingConfig.withRemainingAsDetail(HEADERS, List.of("运单号码", "清美出库日期"),
                List.of("日期", "时间"), "_");
        List<Map<String, String>> rows = List.of(
                GroupingFixtures.row(HEADERS, " 1.23E+11 ", "45932.0", "12.50"),
                GroupingFixtures.row(HEADERS, "SF001", "2023/1/5", "3.0"),
                GroupingFixtures.row(HEADERS, "SF002", "待定", ""));

        List<Map<String, String>> normalized = normalizer.normalize(HEADERS, rows, config);

        assertEquals(Map.of("运单号码", "123000000000", "清美出库日期", "2025-10-02", "费用(元)", "12.50"),
                normalized.get(0));
        assertEquals("2023-01-05", normalized.get(1).get("清美出库日期"));
        assertEquals("3", normalized.get(1).get("费用(元)"));
        assertEquals("待定", normalized.get(2).get("清美出库日期"));
        assertEquals(List.copyOf(HEADERS), List.copyOf(normalized.get(0).keySet()));
    }

    @Test
    public void testNonDateColumnsKeepNumbers() {
        GroupingConfig config = GroupingConfig.withRemainingAsDetail(HEADERS, List.of("运单号码"), List.of("日期"), "_");
        List<Map<String, String>> rows = List.of(GroupingFixtures.row(HEADERS, "45932", "45932", "45932"));

        Map<String, String> row = normalizer.normalize(HEADERS, rows, config).get(0);

        assertEquals("45932", row.get("运单号码"));
        assertEquals("2025-10-02", row.get("清美出库日期"));
        assertEquals("45932", row.get("费用(元)"));
    }
}
