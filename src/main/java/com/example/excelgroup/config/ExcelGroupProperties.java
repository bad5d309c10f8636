package com.example.excelgroup.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * 分组导出配置，对应 application.yml 中的 {@code excel.group.*}。
 *
 * @param dateKeywords        表头包含任一关键词（区分大小写）即视为日期列
 * @param jsonKeyDelimiter    JSON 输出中组合键的连接符
 * @param standardKeyColumns  标准 Key 列，加载后默认勾选，并决定 Key 列的输出顺序
 * @param columnRenames       输出时的列名映射（原名 -> 新名）
 * @param floatColumns        明细中始终按小数输出的列（按输出列名匹配）
 * @param defaultHeaderRow    默认表头行，1 开始
 * @param sheetTitle          导出 sheet 名称
 * @param serialColumnHeader  序号列表头，为空则不输出序号列
 * @param previewLimit        预览行数上限
 */
@ConfigurationProperties(prefix = "excel.group")
public record ExcelGroupProperties(
        @DefaultValue({"日期", "时间", "Date", "Time"}) List<String> dateKeywords,
        @DefaultValue("_") String jsonKeyDelimiter,
        @DefaultValue List<String> standardKeyColumns,
        Map<String, String> columnRenames,
        @DefaultValue List<String> floatColumns,
        @DefaultValue("2") int defaultHeaderRow,
        @DefaultValue("处理结果") String sheetTitle,
        @DefaultValue("序号") String serialColumnHeader,
        @DefaultValue("50") int previewLimit
) {
    public ExcelGroupProperties {
        dateKeywords = dateKeywords == null ? List.of() : List.copyOf(dateKeywords);
        standardKeyColumns = standardKeyColumns == null ? List.of() : List.copyOf(standardKeyColumns);
        columnRenames = columnRenames == null ? Map.of() : Map.copyOf(columnRenames);
        floatColumns = floatColumns == null ? List.of() : List.copyOf(floatColumns);
        if (defaultHeaderRow < 1) {
            throw new IllegalArgumentException("excel.group.default-header-row 必须从 1 开始：" + defaultHeaderRow);
        }
    }

    public boolean hasSerialColumn() {
        return serialColumnHeader != null && !serialColumnHeader.isBlank();
    }

    public String outputName(String column) {
        return columnRenames.getOrDefault(column, column);
    }
}
