package com.example.excelgroup.service;

import com.example.excelgroup.config.ExcelGroupProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExcelGroupService {

    private static final String XLSX_CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final ExcelGroupProperties properties;
    private final ExcelTableLoader tableLoader;
    private final RowNormalizer rowNormalizer;
    private final RowGrouper rowGrouper;
    private final MergeRangeCalculator mergeRangeCalculator;
    private final GroupedWorkbookWriter workbookWriter;
    private final GroupedJsonExporter jsonExporter;

    private final AtomicReference<LoadedTable> tableRef = new AtomicReference<>();
    private final AtomicReference<GroupingOutcome> outcomeRef = new AtomicReference<>();

    public List<String> listSheets(MultipartFile file) {
        requireFile(file);
        try (InputStream input = file.getInputStream()) {
            return tableLoader.listSheets(input);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + e.getMessage(), e);
        }
    }

    public TableInfo load(MultipartFile file, String sheetName, Integer headerRow) {
        requireFile(file);
        int header = headerRow == null ? properties.defaultHeaderRow() : headerRow;
        LoadedTable table;
        try (InputStream input = file.getInputStream()) {
            table = tableLoader.load(input, file.getOriginalFilename(), sheetName, header);
        } catch (IOException e) {
            throw new IllegalStateException("加载数据失败：" + e.getMessage(), e);
        }
        tableRef.set(table);
        outcomeRef.set(null);

        List<List<String>> preview = new ArrayList<>();
        for (Map<String, String> row : table.rows()) {
            if (preview.size() >= properties.previewLimit()) {
                break;
            }
            preview.add(new ArrayList<>(row.values()));
        }
        return new TableInfo(table.fileName(), table.sheetName(), table.headers(),
                suggestKeyColumns(table.headers()), preview, table.rows().size());
    }

    /**
     * @param detailColumns 为空时取除 Key 列外的全部列
     */
    public GroupResult group(List<String> keyColumns, List<String> detailColumns) {
        LoadedTable table = tableRef.get();
        if (table == null) {
            throw new IllegalStateException("请先加载数据，再进行合并。");
        }
        List<String> orderedKeys = orderKeyColumns(keyColumns);
        GroupingConfig config = detailColumns == null || detailColumns.isEmpty()
                ? GroupingConfig.withRemainingAsDetail(table.headers(), orderedKeys,
                        properties.dateKeywords(), properties.jsonKeyDelimiter())
                : new GroupingConfig(orderedKeys, detailColumns,
                        properties.dateKeywords(), properties.jsonKeyDelimiter());

        GroupingOutcome outcome = run(table, config);
        outcomeRef.set(outcome);

        List<GroupPreview> preview = new ArrayList<>();
        for (RowGroup group : outcome.table().groups()) {
            if (preview.size() >= properties.previewLimit()) {
                break;
            }
            preview.add(new GroupPreview(group.key().join(config.jsonKeyDelimiter()),
                    group.key().values(), group.size()));
        }
        return new GroupResult(config.keyColumns(), config.detailColumns(),
                outcome.table().groups().size(), outcome.table().rowCount(),
                outcome.mergeRanges().size(), outcome.jsonExport().collisions(), preview);
    }

    /**
     * 校验配置后依次清洗、分组、计算合并区域、生成 JSON 数据。两种导出共用同一份分组结果。
     */
    public GroupingOutcome run(LoadedTable table, GroupingConfig config) {
        config.validateAgainst(table.headers());

        List<Map<String, String>> rows = rowNormalizer.normalize(table.headers(), table.rows(), config);
        GroupedTable grouped = rowGrouper.group(rows, config);
        List<MergeRange> ranges = mergeRangeCalculator.calculate(grouped,
                GroupedWorkbookWriter.HEADER_ROW_INDEX, workbookWriter.mergeColumnIndexes(grouped));
        JsonExport json = jsonExporter.export(grouped, config.jsonKeyDelimiter());

        log.info("分组完成：{} 行 -> {} 组，合并区域 {} 个", grouped.rowCount(), grouped.groups().size(), ranges.size());
        return new GroupingOutcome(table, config, grouped, ranges, json);
    }

    public ExportFile exportWorkbook() {
        GroupingOutcome outcome = requireOutcome();
        byte[] bytes = workbookWriter.write(outcome.table(), outcome.mergeRanges());
        return new ExportFile("结果-" + baseName(outcome.source().fileName()) + ".xlsx", XLSX_CONTENT_TYPE, bytes);
    }

    public ExportFile exportJson() {
        GroupingOutcome outcome = requireOutcome();
        byte[] bytes = jsonExporter.toJson(outcome.jsonExport());
        return new ExportFile(baseName(outcome.source().fileName()) + "_data.json", JSON_CONTENT_TYPE, bytes);
    }

    List<String> suggestKeyColumns(List<String> headers) {
        Set<String> standard = new LinkedHashSet<>(properties.standardKeyColumns());
        return headers.stream().filter(standard::contains).toList();
    }

    // 标准 Key 列按标准顺序在前，其余按勾选顺序在后
    List<String> orderKeyColumns(List<String> selected) {
        if (selected == null || selected.isEmpty()) {
            return List.of();
        }
        Set<String> chosen = new LinkedHashSet<>(selected);
        List<String> ordered = new ArrayList<>();
        for (String column : properties.standardKeyColumns()) {
            if (chosen.contains(column)) {
                ordered.add(column);
            }
        }
        for (String column : chosen) {
            if (!ordered.contains(column)) {
                ordered.add(column);
            }
        }
        return ordered;
    }

    private GroupingOutcome requireOutcome() {
        GroupingOutcome outcome = outcomeRef.get();
        if (outcome == null) {
            throw new IllegalStateException("没有可导出的结果，请先完成合并。");
        }
        return outcome;
    }

    private void requireFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("文件不能为空。");
        }
    }

    private String baseName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "data";
        }
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
