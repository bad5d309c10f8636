package com.example.excelgroup.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按列清洗整张表：所有单元格先做通用清洗，表头命中日期关键词的列再做日期格式化。
 */
@Component
@RequiredArgsConstructor
public class RowNormalizer {

    private final CellNormalizer cellNormalizer;
    private final DateNormalizer dateNormalizer;

    public List<Map<String, String>> normalize(List<String> headers,
                                               List<Map<String, String>> rows,
                                               GroupingConfig config) {
        boolean[] dateColumns = new boolean[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            dateColumns[i] = config.isDateColumn(headers.get(i));
        }

        List<Map<String, String>> normalized = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                String header = headers.get(i);
                String value = cellNormalizer.normalize(row.get(header));
                if (dateColumns[i] && !value.isEmpty()) {
                    value = dateNormalizer.normalize(value);
                }
                values.put(header, value);
            }
            normalized.add(Collections.unmodifiableMap(values));
        }
        return Collections.unmodifiableList(normalized);
    }
}
