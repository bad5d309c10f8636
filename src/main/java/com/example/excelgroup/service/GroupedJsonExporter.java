package com.example.excelgroup.service;

import com.example.excelgroup.config.ExcelGroupProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把分组结果转成 {"Key1_Key2_...": [{明细列: 值}, ...]}。
 * 不同组合键拼接后相同时，后出现的组覆盖前面的组，并记录下来。
 */
@Slf4j
@Component
public class GroupedJsonExporter {

    private final ExcelGroupProperties properties;
    private final DetailValueConverter detailValueConverter;
    private final ObjectMapper objectMapper;

    public GroupedJsonExporter(ExcelGroupProperties properties,
                               DetailValueConverter detailValueConverter,
                               ObjectMapper objectMapper) {
        this.properties = properties;
        this.detailValueConverter = detailValueConverter;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public JsonExport export(GroupedTable table, String delimiter) {
        Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
        List<String> collisions = new ArrayList<>();
        for (RowGroup group : table.groups()) {
            String key = group.key().join(delimiter);
            List<Map<String, Object>> details = new ArrayList<>(group.size());
            for (Map<String, String> row : group.rows()) {
                details.add(toDetail(row, table.detailColumns()));
            }
            if (data.put(key, Collections.unmodifiableList(details)) != null) {
                collisions.add(key);
                log.warn("组合键拼接后重复，后一组覆盖前一组：{}", key);
            }
        }
        return new JsonExport(Collections.unmodifiableMap(data), List.copyOf(collisions));
    }

    public byte[] toJson(JsonExport export) {
        try {
            return objectMapper.writeValueAsString(export.data()).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 导出失败：" + e.getMessage(), e);
        }
    }

    private Map<String, Object> toDetail(Map<String, String> row, List<String> detailColumns) {
        Map<String, Object> detail = new LinkedHashMap<>();
        for (String column : detailColumns) {
            String outputName = properties.outputName(column);
            detail.put(outputName, detailValueConverter.convert(outputName, row.get(column)));
        }
        return Collections.unmodifiableMap(detail);
    }
}
